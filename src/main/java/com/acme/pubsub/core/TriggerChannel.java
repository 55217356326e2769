package com.acme.pubsub.core;

/**
 * Channel fed by a row-change trigger on the table of {@code E}.
 * <p>
 * Implementations are records with an {@code oldRow} and a {@code newRow} component of the
 * entity type. They may also declare {@code Map<String, Object> context} and
 * {@code Map<String, Object> extras} components to receive the notification context and
 * the payload extras captured by the trigger.
 *
 * @param <E> entity record annotated with {@link TrackedTable}
 */
public interface TriggerChannel<E> extends Channel {

    E oldRow();

    E newRow();
}

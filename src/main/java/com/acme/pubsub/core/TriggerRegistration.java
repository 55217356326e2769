package com.acme.pubsub.core;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Binds row changes of a trigger channel's table (timing + operations) to the channel.
 */
public record TriggerRegistration(
    Class<? extends TriggerChannel<?>> channel,
    TriggerTiming timing,
    Set<TriggerOperation> operations
) {

    public TriggerRegistration {
        if (operations.isEmpty()) {
            throw new ChannelConfigurationException("Trigger on " + channel.getName() + " has no operations");
        }
        operations = Set.copyOf(EnumSet.copyOf(operations));
    }

    public static TriggerRegistration of(Class<? extends TriggerChannel<?>> channel, TriggerTiming timing,
                                         TriggerOperation first, TriggerOperation... rest) {
        return new TriggerRegistration(channel, timing, EnumSet.of(first, rest));
    }

    public static TriggerRegistration preSave(Class<? extends TriggerChannel<?>> channel) {
        return of(channel, TriggerTiming.BEFORE, TriggerOperation.INSERT, TriggerOperation.UPDATE);
    }

    public static TriggerRegistration postSave(Class<? extends TriggerChannel<?>> channel) {
        return of(channel, TriggerTiming.AFTER, TriggerOperation.INSERT, TriggerOperation.UPDATE);
    }

    public static TriggerRegistration preInsert(Class<? extends TriggerChannel<?>> channel) {
        return of(channel, TriggerTiming.BEFORE, TriggerOperation.INSERT);
    }

    public static TriggerRegistration postInsert(Class<? extends TriggerChannel<?>> channel) {
        return of(channel, TriggerTiming.AFTER, TriggerOperation.INSERT);
    }

    public static TriggerRegistration preUpdate(Class<? extends TriggerChannel<?>> channel) {
        return of(channel, TriggerTiming.BEFORE, TriggerOperation.UPDATE);
    }

    public static TriggerRegistration postUpdate(Class<? extends TriggerChannel<?>> channel) {
        return of(channel, TriggerTiming.AFTER, TriggerOperation.UPDATE);
    }

    public static TriggerRegistration preDelete(Class<? extends TriggerChannel<?>> channel) {
        return of(channel, TriggerTiming.BEFORE, TriggerOperation.DELETE);
    }

    public static TriggerRegistration postDelete(Class<? extends TriggerChannel<?>> channel) {
        return of(channel, TriggerTiming.AFTER, TriggerOperation.DELETE);
    }

    /**
     * Example: pgpubsub_1f2e3d4c5b6a7980_after_insert_update
     */
    public String triggerName(String wireName) {
        return wireName + "_" + timing.name().toLowerCase(Locale.ROOT) + "_"
            + EnumSet.copyOf(operations).stream()
                .map(op -> op.name().toLowerCase(Locale.ROOT))
                .collect(Collectors.joining("_"));
    }
}

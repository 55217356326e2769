package com.acme.pubsub.core;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A registered channel: its names, contract, delivery mode and subscribed listeners.
 */
public final class ChannelEntry<C extends Channel> {

    private final Class<C> type;
    private final String logicalName;
    private final String wireName;
    private final boolean durable;
    private final RecordContract<C> contract;
    private final TrackedEntity<?> entity;
    private final List<Listener<? super C>> listeners = new CopyOnWriteArrayList<>();

    private ChannelEntry(Class<C> type, String wireName, RecordContract<C> contract, TrackedEntity<?> entity) {
        this.type = type;
        this.logicalName = ChannelNames.logicalName(type);
        this.wireName = wireName;
        this.durable = type.isAnnotationPresent(Durable.class);
        this.contract = contract;
        this.entity = entity;
    }

    static <C extends Channel> ChannelEntry<C> create(Class<C> type, String wireName) {
        if (wireName.length() > ChannelNames.MAX_IDENTIFIER_LENGTH) {
            throw new ChannelConfigurationException("Wire name " + wireName + " exceeds the identifier limit");
        }
        RecordContract<C> contract = RecordContract.of(type);
        TrackedEntity<?> entity = TriggerChannel.class.isAssignableFrom(type) ? trackedEntity(contract) : null;
        return new ChannelEntry<>(type, wireName, contract, entity);
    }

    private static TrackedEntity<?> trackedEntity(RecordContract<?> contract) {
        RecordContract.Field oldRow = contract.field(TriggerPayloadDecoder.OLD_ROW).orElse(null);
        RecordContract.Field newRow = contract.field(TriggerPayloadDecoder.NEW_ROW).orElse(null);
        if (oldRow == null || newRow == null || oldRow.rawType() != newRow.rawType()) {
            throw new ChannelConfigurationException(contract.type().getName()
                + " must declare oldRow and newRow components of the same entity type");
        }
        return TrackedEntity.of(newRow.rawType());
    }

    void addListener(Listener<? super C> listener) {
        listeners.add(listener);
    }

    /**
     * Runs every listener, in registration order, on the calling thread. Listener exceptions
     * propagate to the caller.
     */
    public void dispatch(C channel) {
        for (Listener<? super C> listener : listeners) {
            listener.onNotification(channel);
        }
    }

    public Class<C> type() {
        return type;
    }

    public String logicalName() {
        return logicalName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean durable() {
        return durable;
    }

    public boolean isTrigger() {
        return entity != null;
    }

    public RecordContract<C> contract() {
        return contract;
    }

    public Optional<TrackedEntity<?>> entity() {
        return Optional.ofNullable(entity);
    }

    public List<Listener<? super C>> listeners() {
        return Collections.unmodifiableList(listeners);
    }

    @Override
    public String toString() {
        return logicalName + "(" + wireName + ")";
    }
}

package com.acme.pubsub.core;

import com.acme.pubsub.spi.EntityLoader;
import com.acme.pubsub.spi.SchemaVersionOracle;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.inject.Singleton;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Decodes row-change payloads into trigger channel records.
 * <p>
 * Row snapshots are mapped onto the entity record by column name, dropping columns the
 * record no longer has. If the payload carries a schema version that is no longer current
 * the snapshots are not used at all: the entity is re-read by primary key instead.
 */
@Singleton
public final class TriggerPayloadDecoder {
    private static final Logger LOG = LoggerFactory.getLogger(TriggerPayloadDecoder.class);

    static final String OLD_ROW = "oldRow";
    static final String NEW_ROW = "newRow";
    static final String CONTEXT = "context";
    static final String EXTRAS = "extras";

    private final ValueCodec values;
    private final SchemaVersionOracle versions;
    private final EntityLoader loader;

    public TriggerPayloadDecoder(ValueCodec values, SchemaVersionOracle versions, EntityLoader loader) {
        this.values = values;
        this.versions = versions;
        this.loader = loader;
    }

    public <C extends Channel, E> C decode(String payload, RecordContract<C> channel, TrackedEntity<E> entity) {
        TriggerPayload trigger = TriggerPayload.parse(payload);
        if (trigger.model() != null && !trigger.model().equalsIgnoreCase(entity.model())) {
            throw new PayloadDecodeException(
                "Payload for model " + trigger.model() + " cannot feed " + channel.type().getSimpleName());
        }

        Map<String, Object> fields = new HashMap<>();
        if (isStale(trigger, entity)) {
            LOG.info("Payload for {} was captured at schema version {}, reloading current row",
                entity.model(), trigger.dbVersion());
            fields.put(OLD_ROW, null);
            fields.put(NEW_ROW, reload(trigger.snapshot(), entity).orElse(null));
        } else {
            fields.put(OLD_ROW, decodeRow(trigger.oldRow(), entity));
            fields.put(NEW_ROW, decodeRow(trigger.newRow(), entity));
        }
        channel.field(CONTEXT).ifPresent(f -> fields.put(CONTEXT, values.decode(orEmpty(trigger.context()), f.type())));
        channel.field(EXTRAS).ifPresent(f -> fields.put(EXTRAS, values.decode(orEmpty(trigger.extras()), f.type())));
        return channel.instantiate(fields, true);
    }

    private boolean isStale(TriggerPayload trigger, TrackedEntity<?> entity) {
        return trigger.dbVersion() != null && !versions.isCurrent(entity.app(), trigger.dbVersion());
    }

    private <E> Optional<E> reload(ObjectNode snapshot, TrackedEntity<E> entity) {
        JsonNode key = snapshot.get(entity.primaryKey());
        if (key == null || key.isNull()) {
            throw new PayloadDecodeException("Snapshot has no primary key column " + entity.primaryKey());
        }
        Object primaryKey = entity.resolveColumn(entity.primaryKey())
            .map(f -> values.decode(key, f.type()))
            .orElseGet(() -> values.decode(key, Object.class));
        return loader.findRow(entity, primaryKey).map(row -> decodeRow(row, entity));
    }

    /**
     * Maps a row snapshot onto the entity record.
     */
    public <E> E decodeRow(ObjectNode row, TrackedEntity<E> entity) {
        if (row == null) {
            return null;
        }
        Map<String, Object> decoded = new LinkedHashMap<>();
        row.fields().forEachRemaining(column -> {
            Optional<RecordContract.Field> field = entity.resolveColumn(column.getKey());
            if (field.isEmpty()) {
                LOG.debug("Dropping column {} unknown to {}", column.getKey(), entity.type().getSimpleName());
                return;
            }
            try {
                decoded.put(field.get().name(), values.decode(column.getValue(), field.get().type()));
            } catch (PayloadDecodeException e) {
                throw new PayloadDecodeException(
                    entity.model() + "." + column.getKey() + ": " + e.getMessage(), e);
            }
        });
        return entity.contract().instantiate(decoded, true);
    }

    private static JsonNode orEmpty(ObjectNode node) {
        return Objects.requireNonNullElseGet(node, Jsons::object);
    }
}

package com.acme.pubsub.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Row-change payload built by the trigger function:
 * {@code {"app", "model", "old", "new", "context"?, "extras"?, "db_version"?}}.
 * {@code old} is null for inserts and {@code new} for deletes.
 */
public record TriggerPayload(
    String app,
    String model,
    ObjectNode oldRow,
    ObjectNode newRow,
    ObjectNode context,
    ObjectNode extras,
    Long dbVersion
) {

    public static TriggerPayload parse(String json) {
        ObjectNode root = Jsons.readObject(json);
        ObjectNode oldRow = objectOrNull(root, "old");
        ObjectNode newRow = objectOrNull(root, "new");
        if (oldRow == null && newRow == null) {
            throw new PayloadDecodeException("Trigger payload has neither an old nor a new row");
        }
        JsonNode version = root.get("db_version");
        return new TriggerPayload(
            root.path("app").asText(null),
            root.path("model").asText(null),
            oldRow,
            newRow,
            objectOrNull(root, "context"),
            objectOrNull(root, "extras"),
            version == null || version.isNull() ? null : version.asLong()
        );
    }

    private static ObjectNode objectOrNull(ObjectNode root, String name) {
        JsonNode node = root.get(name);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new PayloadDecodeException("Trigger payload field '" + name + "' is not an object");
        }
        return (ObjectNode) node;
    }

    public ObjectNode snapshot() {
        return newRow != null ? newRow : oldRow;
    }
}

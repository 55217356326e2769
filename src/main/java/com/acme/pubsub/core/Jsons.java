package com.acme.pubsub.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

public final class Jsons {
    private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);
    private static final ObjectMapper M = new ObjectMapper()
        .setNodeFactory(NODES)
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private Jsons() {
    }

    public static JsonNodeFactory nodes() {
        return NODES;
    }

    public static ObjectNode object() {
        return NODES.objectNode();
    }

    public static String toJson(Object o) {
        try {
            return M.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not serializable to JSON", e);
        }
    }

    /**
     * Parses a notification payload. Decimal numbers are kept as {@code BigDecimal}.
     */
    public static JsonNode readTree(String json) {
        try {
            JsonNode node = M.readTree(json);
            if (node == null || node.isMissingNode()) {
                throw new PayloadDecodeException("Empty payload");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new PayloadDecodeException("Payload is not valid JSON", e);
        }
    }

    public static ObjectNode readObject(String json) {
        JsonNode node = readTree(json);
        if (!node.isObject()) {
            throw new PayloadDecodeException("Payload is not a JSON object: " + node.getNodeType());
        }
        return (ObjectNode) node;
    }
}

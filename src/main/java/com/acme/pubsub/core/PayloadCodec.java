package com.acme.pubsub.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import jakarta.inject.Singleton;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wire format of plain channels: {@code {"kwargs": {"field": value, ...}}}.
 */
@Singleton
public final class PayloadCodec {

    static final String KWARGS = "kwargs";

    private final ValueCodec values;

    public PayloadCodec(ValueCodec values) {
        this.values = values;
    }

    public <C extends Channel> String encode(C channel, RecordContract<C> contract) {
        ObjectNode kwargs = Jsons.object();
        contract.values(channel).forEach((name, value) -> kwargs.set(name, values.encode(value)));
        ObjectNode payload = Jsons.object();
        payload.set(KWARGS, kwargs);
        return payload.toString();
    }

    /**
     * Decodes the kwargs of a payload into typed field values. Kwargs the contract does not
     * declare are ignored; missing ones are left out and handled by
     * {@link RecordContract#instantiate}.
     */
    public Map<String, Object> decode(String payload, RecordContract<?> contract) {
        ObjectNode root = Jsons.readObject(payload);
        JsonNode kwargs = root.get(KWARGS);
        if (kwargs == null || !kwargs.isObject()) {
            throw new PayloadDecodeException("Payload has no kwargs object");
        }
        Map<String, Object> decoded = new LinkedHashMap<>();
        for (RecordContract.Field field : contract.fields()) {
            if (kwargs.has(field.name())) {
                try {
                    decoded.put(field.name(), values.decode(kwargs.get(field.name()), field.type()));
                } catch (PayloadDecodeException e) {
                    throw new PayloadDecodeException("Field '" + field.name() + "': " + e.getMessage(), e);
                }
            }
        }
        return decoded;
    }

    public <C extends Channel> C decodeChannel(String payload, RecordContract<C> contract) {
        return contract.instantiate(decode(payload, contract), false);
    }
}

package com.acme.pubsub.spi;

import com.acme.pubsub.core.ChannelConfigurationException;
import com.acme.pubsub.core.Jsons;
import com.acme.pubsub.core.PayloadDecodeException;

import java.util.Map;
import java.util.Optional;

/**
 * Restricts which outbox rows a listener claims. A listener with a filter only sees rows
 * whose stored payload contains the filter document (jsonb {@code @>}).
 */
public final class NotificationFilter {
    private static final NotificationFilter NONE = new NotificationFilter(null);

    private final String containment;

    private NotificationFilter(String containment) {
        this.containment = containment;
    }

    public static NotificationFilter none() {
        return NONE;
    }

    public static NotificationFilter payloadContains(String json) {
        if (json == null || json.isBlank()) {
            return NONE;
        }
        try {
            return new NotificationFilter(Jsons.readObject(json).toString());
        } catch (PayloadDecodeException e) {
            throw new ChannelConfigurationException("Payload filter must be a JSON object: " + json, e);
        }
    }

    public static NotificationFilter payloadContains(Map<String, ?> document) {
        return document.isEmpty() ? NONE : new NotificationFilter(Jsons.toJson(document));
    }

    public Optional<String> containment() {
        return Optional.ofNullable(containment);
    }

    public boolean isNone() {
        return containment == null;
    }

    @Override
    public String toString() {
        return containment == null ? "none" : containment;
    }
}

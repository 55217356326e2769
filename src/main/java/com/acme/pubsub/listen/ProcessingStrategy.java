package com.acme.pubsub.listen;

import com.acme.pubsub.core.ChannelEntry;

/**
 * How a notification is delivered, decided by the channel's durability and the payload.
 */
public enum ProcessingStrategy {
    /** Not durable: the payload is the message. */
    DIRECT,
    /** Durable: the payload names one outbox row, by id or (legacy) by content. */
    LOCKING,
    /** Durable with the empty sentinel: sweep every outbox row of the channel. */
    RECOVERY;

    public static ProcessingStrategy select(ChannelEntry<?> channel, String payload) {
        if (!channel.durable()) {
            return DIRECT;
        }
        return isRecoverySentinel(payload) ? RECOVERY : LOCKING;
    }

    static boolean isRecoverySentinel(String payload) {
        return payload == null || payload.isBlank() || "null".equals(payload.trim());
    }
}

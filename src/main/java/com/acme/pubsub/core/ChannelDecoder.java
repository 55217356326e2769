package com.acme.pubsub.core;

import jakarta.inject.Singleton;

/**
 * Builds channel instances from notification payloads and hands them to the channel's
 * listeners.
 */
@Singleton
public final class ChannelDecoder {

    private final PayloadCodec payloads;
    private final TriggerPayloadDecoder triggers;

    public ChannelDecoder(PayloadCodec payloads, TriggerPayloadDecoder triggers) {
        this.payloads = payloads;
        this.triggers = triggers;
    }

    public <C extends Channel> C decode(ChannelEntry<C> entry, String payload) {
        if (payload == null || payload.isBlank()) {
            throw new PayloadDecodeException("Empty payload on " + entry);
        }
        if (entry.isTrigger()) {
            return triggers.decode(payload, entry.contract(), entry.entity().orElseThrow());
        }
        return payloads.decodeChannel(payload, entry.contract());
    }

    /**
     * Decodes the payload and runs every listener of the channel synchronously. Listener
     * exceptions are not caught here.
     */
    public <C extends Channel> C dispatch(ChannelEntry<C> entry, String payload) {
        C channel = decode(entry, payload);
        entry.dispatch(channel);
        return channel;
    }
}

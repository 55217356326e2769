package com.acme.pubsub.core;

/**
 * Raised when a channel name or type does not resolve to a registered channel.
 */
public class ChannelNotFoundException extends PubSubException {
    public ChannelNotFoundException(String channel) {
        super("Channel not found: " + channel);
    }
}

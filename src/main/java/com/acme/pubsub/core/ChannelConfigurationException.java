package com.acme.pubsub.core;

/**
 * Misconfigured channel definitions: wire name collisions, malformed trigger channels,
 * empty listener selections. Always raised at registration or startup.
 */
public class ChannelConfigurationException extends PubSubException {
    public ChannelConfigurationException(String message) {
        super(message);
    }

    public ChannelConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

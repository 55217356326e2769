package com.acme.pubsub.config;

import com.acme.pubsub.core.ChannelRegistry;

/**
 * Application hook that declares channels, listeners and trigger bindings. Every registrar
 * bean is applied once to the application's registry before anything listens or publishes.
 */
@FunctionalInterface
public interface ChannelRegistrar {
    void register(ChannelRegistry registry);
}

package com.acme.pubsub.config;

import com.acme.pubsub.core.ChannelRegistry;
import com.acme.pubsub.spi.NotificationFilter;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

@Factory
public class PubSubFactory {
    private static final Logger LOG = LoggerFactory.getLogger(PubSubFactory.class);

    @Singleton
    ChannelRegistry channelRegistry(List<ChannelRegistrar> registrars) {
        ChannelRegistry registry = new ChannelRegistry();
        registrars.forEach(r -> r.register(registry));
        LOG.info("Channel registry built: {} channels, {} triggers",
            registry.entries().size(), registry.triggers().size());
        return registry;
    }

    @Singleton
    NotificationFilter notificationFilter(PubSubConfig config) {
        return NotificationFilter.payloadContains(config.getListener().getPayloadFilter());
    }
}

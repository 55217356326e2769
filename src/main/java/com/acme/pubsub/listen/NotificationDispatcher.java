package com.acme.pubsub.listen;

import com.acme.pubsub.core.ChannelEntry;
import com.acme.pubsub.core.ChannelRegistry;
import jakarta.inject.Singleton;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes a received notification to the processor for its strategy.
 */
@Singleton
public class NotificationDispatcher {
    private final ChannelRegistry registry;
    private final Map<ProcessingStrategy, NotificationProcessor> processors = new EnumMap<>(ProcessingStrategy.class);

    public NotificationDispatcher(ChannelRegistry registry, List<NotificationProcessor> processors) {
        this.registry = registry;
        processors.forEach(p -> this.processors.put(p.strategy(), p));
        for (ProcessingStrategy strategy : ProcessingStrategy.values()) {
            if (!this.processors.containsKey(strategy)) {
                throw new IllegalStateException("No processor for " + strategy);
            }
        }
    }

    public int dispatch(IncomingNotification notification) {
        ChannelEntry<?> channel = registry.resolve(notification.channel());
        ProcessingStrategy strategy = ProcessingStrategy.select(channel, notification.payload());
        return processors.get(strategy).process(channel, notification);
    }
}

package com.acme.pubsub.metrics;

import com.acme.pubsub.config.PubSubConfig;
import com.acme.pubsub.spi.NotificationStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.time.Clock;
import java.time.Duration;

/**
 * Outbox gauges: number of stored notifications and age of the oldest one. Both are read
 * from the database on every scrape.
 */
@Singleton
public class NotificationQueueMetrics implements MeterBinder {

    private final NotificationStore store;
    private final String prefix;
    private final Clock clock;

    @Inject
    public NotificationQueueMetrics(NotificationStore store, PubSubConfig config) {
        this(store, config.getMetricPrefix(), Clock.systemUTC());
    }

    NotificationQueueMetrics(NotificationStore store, String prefix, Clock clock) {
        this.store = store;
        this.prefix = prefix;
        this.clock = clock;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder(prefix + ".notifications-queue.len", this, NotificationQueueMetrics::queueLength)
            .description("Notifications queue length")
            .baseUnit("items")
            .strongReference(true)
            .register(registry);
        Gauge.builder(prefix + ".notifications-queue.processing-lag", this, NotificationQueueMetrics::processingLagMillis)
            .description("Notifications queue processing lag")
            .baseUnit("ms")
            .strongReference(true)
            .register(registry);
    }

    double queueLength() {
        return store.depth();
    }

    /**
     * Zero when the outbox is empty.
     */
    double processingLagMillis() {
        return store.oldestCreatedAt()
            .map(oldest -> (double) Duration.between(oldest, clock.instant()).toMillis())
            .orElse(0.0);
    }
}

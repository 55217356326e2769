package com.acme.pubsub.spi;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

/**
 * Outbox of durable notifications plus the NOTIFY side channel. Every method joins the
 * transaction active on the calling thread; row locks are held until it ends.
 */
public interface NotificationStore {
    long insert(String channel, String payload, Integer dbVersion);
    Optional<StoredNotification> lockById(long id, String channel);
    Optional<StoredNotification> lockByPayload(String channel, String payload);
    Optional<StoredNotification> lockNext(String channel, Collection<Long> excluding);
    void delete(long id);
    void notify(String channel, String payload);
    void setSetting(String name, String value, boolean local);

    long depth();
    Optional<Instant> oldestCreatedAt();

    record StoredNotification(
        long id,
        String channel,
        String payload,
        Instant createdAt,
        Integer dbVersion
    ) {}
}

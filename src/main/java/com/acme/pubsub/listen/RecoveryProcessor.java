package com.acme.pubsub.listen;

import com.acme.pubsub.core.ChannelDecoder;
import com.acme.pubsub.core.ChannelEntry;
import com.acme.pubsub.spi.NotificationStore;
import com.acme.pubsub.spi.NotificationStore.StoredNotification;
import io.micronaut.transaction.TransactionOperations;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drains every outbox row of a durable channel, oldest first, one transaction per row. A row
 * whose listeners fail is rolled back, logged and skipped for the rest of the sweep; it stays
 * in the outbox for the next recovery.
 */
@Singleton
public class RecoveryProcessor implements NotificationProcessor {
    private static final Logger LOG = LoggerFactory.getLogger(RecoveryProcessor.class);

    private final ChannelDecoder decoder;
    private final NotificationStore store;
    private final TransactionOperations<Connection> transactionOps;

    public RecoveryProcessor(ChannelDecoder decoder, NotificationStore store,
                             TransactionOperations<Connection> transactionOps) {
        this.decoder = decoder;
        this.store = store;
        this.transactionOps = transactionOps;
    }

    @Override
    public ProcessingStrategy strategy() {
        return ProcessingStrategy.RECOVERY;
    }

    @Override
    public int process(ChannelEntry<?> channel, IncomingNotification notification) {
        checkApplicable(channel, notification);
        Set<Long> failed = new LinkedHashSet<>();
        int delivered = 0;
        while (true) {
            AtomicReference<StoredNotification> claimed = new AtomicReference<>();
            try {
                boolean found = transactionOps.executeWrite(status -> {
                    Optional<StoredNotification> next = store.lockNext(channel.wireName(), failed);
                    if (next.isEmpty()) {
                        return false;
                    }
                    claimed.set(next.get());
                    decoder.dispatch(channel, next.get().payload());
                    store.delete(next.get().id());
                    return true;
                });
                if (!found) {
                    break;
                }
                delivered++;
            } catch (RuntimeException e) {
                StoredNotification row = claimed.get();
                if (row == null) {
                    throw e;
                }
                failed.add(row.id());
                LOG.error("Recovery of notification {} on {} failed, skipping it", row.id(), channel, e);
            }
        }
        if (delivered > 0 || !failed.isEmpty()) {
            LOG.info("Recovered {} notifications on {}, {} failed", delivered, channel, failed.size());
        }
        return delivered;
    }
}

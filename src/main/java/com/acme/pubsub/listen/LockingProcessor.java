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
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Claims the outbox row a durable notification points at, runs the listeners and deletes
 * the row, all in one transaction. When several listeners receive the same notification
 * only the one that locks the row delivers it.
 */
@Singleton
public class LockingProcessor implements NotificationProcessor {
    private static final Logger LOG = LoggerFactory.getLogger(LockingProcessor.class);
    private static final Pattern ROW_ID = Pattern.compile("\\d{1,18}");

    private final ChannelDecoder decoder;
    private final NotificationStore store;
    private final TransactionOperations<Connection> transactionOps;

    public LockingProcessor(ChannelDecoder decoder, NotificationStore store,
                            TransactionOperations<Connection> transactionOps) {
        this.decoder = decoder;
        this.store = store;
        this.transactionOps = transactionOps;
    }

    @Override
    public ProcessingStrategy strategy() {
        return ProcessingStrategy.LOCKING;
    }

    @Override
    public int process(ChannelEntry<?> channel, IncomingNotification notification) {
        checkApplicable(channel, notification);
        String payload = notification.payload().trim();
        return transactionOps.executeWrite(status -> {
            Optional<StoredNotification> row = isRowId(payload)
                ? store.lockById(Long.parseLong(payload), channel.wireName())
                : store.lockByPayload(channel.wireName(), payload);
            if (row.isEmpty()) {
                LOG.debug("Notification {} on {} already processed or claimed elsewhere", abbreviate(payload), channel);
                return 0;
            }
            decoder.dispatch(channel, row.get().payload());
            store.delete(row.get().id());
            return 1;
        });
    }

    static boolean isRowId(String payload) {
        return ROW_ID.matcher(payload).matches();
    }

    private static String abbreviate(String payload) {
        return payload.length() <= 64 ? payload : payload.substring(0, 64) + "...";
    }
}

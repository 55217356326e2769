package com.acme.pubsub.core;

import com.acme.pubsub.spi.NotificationStore;
import io.micronaut.transaction.TransactionOperations;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.util.Collection;

/**
 * Publishes plain channels. Publishing joins the caller's transaction, so the outbox row and
 * the NOTIFY only become visible when it commits.
 */
@Singleton
public class Notifier {
    private static final Logger LOG = LoggerFactory.getLogger(Notifier.class);

    /** NOTIFY payload asking listeners of a durable channel to sweep its outbox. */
    public static final String RECOVERY_SENTINEL = "";

    private final ChannelRegistry registry;
    private final PayloadCodec codec;
    private final NotificationStore store;
    private final TransactionOperations<Connection> transactionOps;

    public Notifier(ChannelRegistry registry, PayloadCodec codec, NotificationStore store,
                    TransactionOperations<Connection> transactionOps) {
        this.registry = registry;
        this.codec = codec;
        this.store = store;
        this.transactionOps = transactionOps;
    }

    /**
     * Durable channels get an outbox row and a NOTIFY carrying its id; other channels NOTIFY
     * the payload itself.
     */
    @SuppressWarnings("unchecked")
    public <C extends Channel> void publish(C channel) {
        ChannelEntry<C> entry = registry.declare((Class<C>) channel.getClass());
        if (entry.isTrigger()) {
            throw new ChannelConfigurationException(entry + " is fed by table triggers and cannot be published");
        }
        String payload = codec.encode(channel, entry.contract());
        transactionOps.executeWrite(status -> {
            if (entry.durable()) {
                long id = store.insert(entry.wireName(), payload, null);
                store.notify(entry.wireName(), Long.toString(id));
                LOG.debug("Stored notification {} on {}", id, entry);
            } else {
                store.notify(entry.wireName(), payload);
            }
            return null;
        });
    }

    /**
     * Sends the recovery sentinel to every durable channel in {@code channels}.
     */
    public int recover(Collection<? extends ChannelEntry<?>> channels) {
        int sent = transactionOps.executeWrite(status -> {
            int count = 0;
            for (ChannelEntry<?> entry : channels) {
                if (entry.durable()) {
                    store.notify(entry.wireName(), RECOVERY_SENTINEL);
                    count++;
                }
            }
            return count;
        });
        LOG.info("Requested recovery of {} durable channels", sent);
        return sent;
    }

    public int recoverAll() {
        return recover(registry.entries());
    }
}

package com.acme.pubsub.listen;

import com.acme.pubsub.core.ChannelDecoder;
import com.acme.pubsub.core.ChannelEntry;
import io.micronaut.transaction.TransactionOperations;
import jakarta.inject.Singleton;

import java.sql.Connection;

/**
 * Decodes the inline payload and runs the listeners in one transaction. A listener failure
 * rolls the transaction back and propagates.
 */
@Singleton
public class DirectProcessor implements NotificationProcessor {
    private final ChannelDecoder decoder;
    private final TransactionOperations<Connection> transactionOps;

    public DirectProcessor(ChannelDecoder decoder, TransactionOperations<Connection> transactionOps) {
        this.decoder = decoder;
        this.transactionOps = transactionOps;
    }

    @Override
    public ProcessingStrategy strategy() {
        return ProcessingStrategy.DIRECT;
    }

    @Override
    public int process(ChannelEntry<?> channel, IncomingNotification notification) {
        checkApplicable(channel, notification);
        transactionOps.executeWrite(status -> decoder.dispatch(channel, notification.payload()));
        return 1;
    }
}

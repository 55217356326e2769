package com.acme.pubsub.core;

import com.acme.pubsub.config.PubSubConfig;
import com.acme.pubsub.spi.NotificationStore;
import io.micronaut.transaction.TransactionOperations;
import io.micronaut.transaction.TransactionStatus;
import io.micronaut.transaction.support.TransactionSynchronization;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.sql.Connection;
import java.util.Map;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Free-form context copied by trigger functions into every payload they build, plus the name
 * of an optional SQL function whose result is added as {@code extras}.
 * <p>
 * Both are stored as custom Postgres settings and can only be set inside a transaction, so
 * they never stay behind on a pooled connection. With {@code pubsub.tx-bound-context} on they
 * are transaction-local settings. Otherwise they are session settings that are reset just
 * before the transaction commits; a rollback reverts them anyway.
 */
@Singleton
public class NotificationContext {
    public static final String CONTEXT_SETTING = "pgpubsub.notification_context";
    public static final String EXTRAS_BUILDER_SETTING = "pgpubsub.payload_extras_builder";
    private static final Pattern FUNCTION_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");

    private final NotificationStore store;
    private final TransactionOperations<Connection> transactionOps;
    private final boolean txBound;

    @Inject
    public NotificationContext(NotificationStore store, TransactionOperations<Connection> transactionOps,
                               PubSubConfig config) {
        this(store, transactionOps, config.isTxBoundContext());
    }

    NotificationContext(NotificationStore store, TransactionOperations<Connection> transactionOps, boolean txBound) {
        this.store = store;
        this.transactionOps = transactionOps;
        this.txBound = txBound;
    }

    public void set(Map<String, ?> context) {
        apply(CONTEXT_SETTING, Jsons.toJson(context));
    }

    public void clear() {
        apply(CONTEXT_SETTING, "");
    }

    /**
     * Names a zero-argument SQL function returning jsonb; trigger payloads then carry its
     * result under {@code extras}.
     */
    public void setPayloadExtrasBuilder(String functionName) {
        if (!FUNCTION_NAME.matcher(functionName).matches()) {
            throw new IllegalArgumentException("Invalid function name: " + functionName);
        }
        apply(EXTRAS_BUILDER_SETTING, functionName);
    }

    public void clearPayloadExtrasBuilder() {
        apply(EXTRAS_BUILDER_SETTING, "");
    }

    /**
     * Runs {@code work} in a transaction whose trigger payloads carry {@code context}. The
     * context ends with the transaction whatever the tx-bound setting.
     */
    public <T> T inTransaction(Map<String, ?> context, Supplier<T> work) {
        String json = Jsons.toJson(context);
        return transactionOps.executeWrite(status -> {
            store.setSetting(CONTEXT_SETTING, json, true);
            return work.get();
        });
    }

    public boolean isTxBound() {
        return txBound;
    }

    private void apply(String setting, String value) {
        TransactionStatus<?> status = transactionOps.findTransactionStatus()
            .orElseThrow(() -> new PubSubException("Notification context must be set inside a transaction"));
        store.setSetting(setting, value, txBound);
        if (!txBound && !value.isEmpty()) {
            status.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void beforeCommit(boolean readOnly) {
                    store.setSetting(setting, "", false);
                }
            });
        }
    }
}

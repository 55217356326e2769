package com.acme.pubsub.pg;

import com.acme.pubsub.config.PubSubConfig;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import io.micronaut.transaction.TransactionOperations;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Creates the outbox table and installs registered triggers at startup, each step behind its
 * own flag.
 */
@Singleton
public final class PubSubSchemaInitializer implements ApplicationEventListener<StartupEvent> {
    private static final Logger LOG = LoggerFactory.getLogger(PubSubSchemaInitializer.class);
    static final String SCHEMA_RESOURCE = "pgpubsub/schema.sql";

    private final PubSubConfig config;
    private final TransactionOperations<Connection> transactionOps;
    private final TriggerInstaller installer;

    public PubSubSchemaInitializer(PubSubConfig config, TransactionOperations<Connection> transactionOps,
                                   TriggerInstaller installer) {
        this.config = config;
        this.transactionOps = transactionOps;
        this.installer = installer;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        if (config.isCreateSchema()) {
            createSchema();
        }
        if (config.isInstallTriggers()) {
            List<String> installed = installer.installAll();
            LOG.info("Installed {} pubsub triggers", installed.size());
        }
    }

    void createSchema() {
        List<String> statements = statements(loadSchema());
        transactionOps.executeWrite(status -> {
            try (Statement st = status.getConnection().createStatement()) {
                for (String sql : statements) {
                    st.execute(sql);
                }
                return null;
            } catch (SQLException e) {
                throw new RuntimeException("Failed to create pubsub schema", e);
            }
        });
        LOG.info("Ensured table {}", PgNotificationStore.TABLE);
    }

    private static String loadSchema() {
        try (InputStream in = PubSubSchemaInitializer.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing resource " + SCHEMA_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + SCHEMA_RESOURCE, e);
        }
    }

    static List<String> statements(String script) {
        return Arrays.stream(script.split(";"))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toList());
    }
}

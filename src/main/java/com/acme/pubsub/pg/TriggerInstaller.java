package com.acme.pubsub.pg;

import com.acme.pubsub.core.ChannelEntry;
import com.acme.pubsub.core.ChannelRegistry;
import com.acme.pubsub.core.TriggerRegistration;
import com.acme.pubsub.spi.SchemaVersionOracle;
import io.micronaut.transaction.TransactionOperations;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Installs the functions and triggers of every registered trigger binding. Safe to run on
 * every startup: functions are replaced, existing triggers are left alone.
 */
@Singleton
public class TriggerInstaller {
    private static final Logger LOG = LoggerFactory.getLogger(TriggerInstaller.class);

    private final ChannelRegistry registry;
    private final TriggerFunctionBuilder builder;
    private final SchemaVersionOracle versions;
    private final TransactionOperations<Connection> transactionOps;

    public TriggerInstaller(ChannelRegistry registry, TriggerFunctionBuilder builder,
                            SchemaVersionOracle versions, TransactionOperations<Connection> transactionOps) {
        this.registry = registry;
        this.builder = builder;
        this.versions = versions;
        this.transactionOps = transactionOps;
    }

    /**
     * @return the names of the triggers that were installed or refreshed
     */
    public List<String> installAll() {
        List<String> installed = new ArrayList<>();
        for (TriggerRegistration registration : registry.triggers()) {
            installed.add(install(registration));
        }
        return installed;
    }

    public String install(TriggerRegistration registration) {
        ChannelEntry<?> channel = registry.resolve(registration.channel());
        String app = channel.entity().orElseThrow().app();
        Long dbVersion = versions.currentVersion(app).orElse(null);
        String name = builder.functionName(channel, registration);
        transactionOps.executeWrite(status -> {
            try (Statement st = status.getConnection().createStatement()) {
                st.execute(builder.createFunction(channel, registration, dbVersion));
                st.execute(builder.createTrigger(channel, registration));
                return null;
            } catch (SQLException e) {
                throw new RuntimeException("Failed to install trigger " + name, e);
            }
        });
        LOG.info("Installed trigger {} for {} (db_version {})", name, channel.logicalName(), dbVersion);
        return name;
    }
}

package com.acme.pubsub.config;

import io.micronaut.context.annotation.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings under {@code pubsub.*}.
 */
@ConfigurationProperties("pubsub")
public class PubSubConfig {

    private boolean createSchema = true;
    private boolean installTriggers = true;
    private boolean txBoundContext = false;
    private String metricPrefix = "pgpubsub";
    private Map<String, Long> schemaVersions = new LinkedHashMap<>();

    private final Listener listener;

    public PubSubConfig(Listener listener) {
        this.listener = listener;
    }

    public boolean isCreateSchema() {
        return createSchema;
    }

    public void setCreateSchema(boolean createSchema) {
        this.createSchema = createSchema;
    }

    public boolean isInstallTriggers() {
        return installTriggers;
    }

    public void setInstallTriggers(boolean installTriggers) {
        this.installTriggers = installTriggers;
    }

    /**
     * When true the notification context is a transaction-local setting; otherwise it is a
     * session setting reset before commit. Either way it must be set inside a transaction.
     */
    public boolean isTxBoundContext() {
        return txBoundContext;
    }

    public void setTxBoundContext(boolean txBoundContext) {
        this.txBoundContext = txBoundContext;
    }

    public String getMetricPrefix() {
        return metricPrefix;
    }

    public void setMetricPrefix(String metricPrefix) {
        this.metricPrefix = metricPrefix;
    }

    /**
     * Current schema version per app tag. Apps missing here are never considered stale.
     */
    public Map<String, Long> getSchemaVersions() {
        return schemaVersions;
    }

    public void setSchemaVersions(Map<String, Long> schemaVersions) {
        this.schemaVersions = schemaVersions;
    }

    public Listener getListener() {
        return listener;
    }

    @ConfigurationProperties("listener")
    public static class Listener {
        private boolean enabled = false;
        private Duration pollTimeout = Duration.ofSeconds(5);
        private boolean recover = false;
        private boolean autoRestart = true;
        private Duration restartDelay = Duration.ofSeconds(5);
        private List<String> channels = new ArrayList<>();
        private String payloadFilter;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getPollTimeout() {
            return pollTimeout;
        }

        public void setPollTimeout(Duration pollTimeout) {
            this.pollTimeout = pollTimeout;
        }

        public boolean isRecover() {
            return recover;
        }

        public void setRecover(boolean recover) {
            this.recover = recover;
        }

        public boolean isAutoRestart() {
            return autoRestart;
        }

        public void setAutoRestart(boolean autoRestart) {
            this.autoRestart = autoRestart;
        }

        public Duration getRestartDelay() {
            return restartDelay;
        }

        public void setRestartDelay(Duration restartDelay) {
            this.restartDelay = restartDelay;
        }

        /**
         * Channels to LISTEN on, by logical name, wire name or class name. Empty means all.
         */
        public List<String> getChannels() {
            return channels;
        }

        public void setChannels(List<String> channels) {
            this.channels = channels;
        }

        /**
         * JSON object the stored payload must contain for this listener to claim it.
         */
        public String getPayloadFilter() {
            return payloadFilter;
        }

        public void setPayloadFilter(String payloadFilter) {
            this.payloadFilter = payloadFilter;
        }
    }
}

package com.acme.pubsub.config;

import com.acme.pubsub.spi.SchemaVersionOracle;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import java.util.Optional;

/**
 * Schema versions taken from {@code pubsub.schema-versions}. Replaced by any other
 * {@link SchemaVersionOracle} bean, e.g. one reading a migration history table.
 */
@Singleton
@Requires(missingBeans = SchemaVersionOracle.class)
public class ConfiguredSchemaVersionOracle implements SchemaVersionOracle {
    private final PubSubConfig config;

    public ConfiguredSchemaVersionOracle(PubSubConfig config) {
        this.config = config;
    }

    @Override
    public Optional<Long> currentVersion(String app) {
        return Optional.ofNullable(config.getSchemaVersions().get(app));
    }
}

package com.acme.pubsub.spi;

import java.util.Optional;

/**
 * Knows the current schema (migration) version of each app. Trigger payloads embed the
 * version they were captured at; a payload whose version is no longer current is not
 * trusted to match the entity's shape.
 */
public interface SchemaVersionOracle {

    Optional<Long> currentVersion(String app);

    /**
     * Unknown apps are treated as current.
     */
    default boolean isCurrent(String app, long version) {
        return currentVersion(app).map(current -> current == version).orElse(true);
    }
}

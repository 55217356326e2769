package com.acme.pubsub.spi;

import com.acme.pubsub.core.TrackedEntity;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

/**
 * Loads the current state of an entity row, as a column map, by primary key.
 */
public interface EntityLoader {
    Optional<ObjectNode> findRow(TrackedEntity<?> entity, Object primaryKey);
}

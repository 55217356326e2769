package com.acme.pubsub.pg;

import com.acme.pubsub.core.Jsons;
import com.acme.pubsub.core.TrackedEntity;
import com.acme.pubsub.spi.EntityLoader;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micronaut.data.connection.ConnectionOperations;
import jakarta.inject.Singleton;
import java.sql.*;
import java.util.Optional;

/**
 * Reads the current row of a tracked table as the same column map the trigger would have
 * captured ({@code to_jsonb(row)}).
 */
@Singleton
public class PgEntityLoader implements EntityLoader {
    private final ConnectionOperations<Connection> connectionOps;

    public PgEntityLoader(ConnectionOperations<Connection> connectionOps) {
        this.connectionOps = connectionOps;
    }

    @Override
    public Optional<ObjectNode> findRow(TrackedEntity<?> entity, Object primaryKey) {
        String sql = "select to_jsonb(t)::text from " + SqlIdentifiers.quote(entity.table())
            + " t where t." + SqlIdentifiers.quote(entity.primaryKey()) + " = ?";
        return connectionOps.executeRead(status -> {
            try (var ps = status.getConnection().prepareStatement(sql)) {
                ps.setObject(1, primaryKey);
                var rs = ps.executeQuery();
                if (rs.next()) {
                    return Optional.of(Jsons.readObject(rs.getString(1)));
                }
                return Optional.<ObjectNode>empty();
            } catch (SQLException e) {
                throw new RuntimeException("Failed to load " + entity.model() + " " + primaryKey, e);
            }
        });
    }
}

package com.acme.pubsub.pg;

import com.acme.pubsub.spi.NotificationFilter;
import com.acme.pubsub.spi.NotificationStore;
import io.micronaut.data.connection.ConnectionOperations;
import jakarta.inject.Singleton;
import java.sql.*;
import java.time.Instant;
import java.util.*;

/**
 * Outbox table {@code pgpubsub_notification} accessed with plain JDBC. Connections come from
 * {@link ConnectionOperations}, so every call joins the surrounding transaction.
 */
@Singleton
public class PgNotificationStore implements NotificationStore {
    static final String TABLE = "pgpubsub_notification";
    private static final String COLUMNS = "id, channel, payload::text, created_at, db_version";

    private final ConnectionOperations<Connection> connectionOps;
    private final NotificationFilter filter;

    public PgNotificationStore(ConnectionOperations<Connection> connectionOps, NotificationFilter filter) {
        this.connectionOps = connectionOps;
        this.filter = filter;
    }

    @Override
    public long insert(String channel, String payload, Integer dbVersion) {
        return connectionOps.executeWrite(status -> {
            try (var ps = status.getConnection().prepareStatement(
                "insert into " + TABLE + "(channel, payload, db_version) values (?, ?::jsonb, ?) returning id")) {
                ps.setString(1, channel);
                ps.setString(2, payload);
                ps.setObject(3, dbVersion, Types.INTEGER);
                var rs = ps.executeQuery();
                rs.next();
                return rs.getLong(1);
            } catch (SQLException e) {
                throw new RuntimeException("Failed to store notification for " + channel, e);
            }
        });
    }

    @Override
    public Optional<StoredNotification> lockById(long id, String channel) {
        return lockOne("id = ? and channel = ?", "", 2, ps -> {
            ps.setLong(1, id);
            ps.setString(2, channel);
        });
    }

    @Override
    public Optional<StoredNotification> lockByPayload(String channel, String payload) {
        return lockOne("channel = ? and payload = ?::jsonb", "", 2, ps -> {
            ps.setString(1, channel);
            ps.setString(2, payload);
        });
    }

    @Override
    public Optional<StoredNotification> lockNext(String channel, Collection<Long> excluding) {
        return lockOne("channel = ? and not (id = any(?))", " order by created_at, id", 2, ps -> {
            ps.setString(1, channel);
            ps.setArray(2, ps.getConnection().createArrayOf("bigint", excluding.toArray()));
        });
    }

    private Optional<StoredNotification> lockOne(String condition, String order, int params, SqlApplier a) {
        String containment = filter.containment().orElse(null);
        String sql = "select " + COLUMNS + " from " + TABLE + " where " + condition
            + (containment != null ? " and payload @> ?::jsonb" : "")
            + order + " limit 1 for update skip locked";
        return connectionOps.executeWrite(status -> {
            try (var ps = status.getConnection().prepareStatement(sql)) {
                a.apply(ps);
                if (containment != null) {
                    ps.setString(params + 1, containment);
                }
                var rs = ps.executeQuery();
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
                return Optional.<StoredNotification>empty();
            } catch (SQLException e) {
                throw new RuntimeException("Failed to lock notification", e);
            }
        });
    }

    private StoredNotification mapRow(ResultSet rs) throws SQLException {
        Timestamp createdAt = rs.getTimestamp(4);
        return new StoredNotification(
            rs.getLong(1),
            rs.getString(2),
            rs.getString(3),
            createdAt != null ? createdAt.toInstant() : null,
            (Integer) rs.getObject(5)
        );
    }

    @Override
    public void delete(long id) {
        exec("delete from " + TABLE + " where id = ?", ps -> ps.setLong(1, id));
    }

    @Override
    public void notify(String channel, String payload) {
        query("select pg_notify(?, ?)", ps -> {
            ps.setString(1, channel);
            ps.setString(2, payload);
        });
    }

    @Override
    public void setSetting(String name, String value, boolean local) {
        query("select set_config(?, ?, ?)", ps -> {
            ps.setString(1, name);
            ps.setString(2, value);
            ps.setBoolean(3, local);
        });
    }

    @Override
    public long depth() {
        return connectionOps.executeRead(status -> {
            try (var ps = status.getConnection().prepareStatement("select count(*) from " + TABLE)) {
                var rs = ps.executeQuery();
                return rs.next() ? rs.getLong(1) : 0L;
            } catch (SQLException e) {
                throw new RuntimeException(e);
            }
        });
    }

    @Override
    public Optional<Instant> oldestCreatedAt() {
        return connectionOps.executeRead(status -> {
            try (var ps = status.getConnection().prepareStatement("select min(created_at) from " + TABLE)) {
                var rs = ps.executeQuery();
                if (rs.next() && rs.getTimestamp(1) != null) {
                    return Optional.of(rs.getTimestamp(1).toInstant());
                }
                return Optional.<Instant>empty();
            } catch (SQLException e) {
                throw new RuntimeException(e);
            }
        });
    }

    private void exec(String sql, SqlApplier a) {
        connectionOps.executeWrite(status -> {
            try (var ps = status.getConnection().prepareStatement(sql)) {
                a.apply(ps);
                ps.executeUpdate();
                return null;
            } catch (SQLException e) {
                throw new RuntimeException(e);
            }
        });
    }

    private void query(String sql, SqlApplier a) {
        connectionOps.executeWrite(status -> {
            try (var ps = status.getConnection().prepareStatement(sql)) {
                a.apply(ps);
                ps.executeQuery().close();
                return null;
            } catch (SQLException e) {
                throw new RuntimeException(e);
            }
        });
    }

    interface SqlApplier {
        void apply(PreparedStatement ps) throws SQLException;
    }
}

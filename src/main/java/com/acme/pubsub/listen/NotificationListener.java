package com.acme.pubsub.listen;

import com.acme.pubsub.core.ChannelEntry;
import com.acme.pubsub.core.ListenerFailedException;
import com.acme.pubsub.core.Notifier;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;

/**
 * One blocking LISTEN loop on a dedicated connection. Notifications are handed to the
 * {@link NotificationDispatcher} on the loop thread, one at a time. A listener is used once:
 * after {@link #listen()} returns or fails, build a new one.
 */
public class NotificationListener implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(NotificationListener.class);

    private final DataSource dataSource;
    private final List<ChannelEntry<?>> channels;
    private final NotificationDispatcher dispatcher;
    private final Notifier notifier;
    private final Duration pollTimeout;
    private final boolean recover;

    private volatile ListenerState state = ListenerState.DISCONNECTED;
    private volatile boolean stopRequested;
    private volatile Connection connection;

    public NotificationListener(DataSource dataSource, List<ChannelEntry<?>> channels,
                                NotificationDispatcher dispatcher, Notifier notifier,
                                Duration pollTimeout, boolean recover) {
        this.dataSource = dataSource;
        this.channels = List.copyOf(channels);
        this.dispatcher = dispatcher;
        this.notifier = notifier;
        this.pollTimeout = pollTimeout;
        this.recover = recover;
    }

    /**
     * Blocks until {@link #stop()} is called. Any error ends the loop in
     * {@link ListenerState#FAILED} and is rethrown as {@link ListenerFailedException}.
     */
    public void listen() {
        try {
            connection = dataSource.getConnection();
            PGConnection pg = connection.unwrap(PGConnection.class);
            subscribe();
            if (recover) {
                notifier.recover(channels);
            }
            int timeoutMillis = (int) Math.max(1, pollTimeout.toMillis());
            while (!stopRequested) {
                state = ListenerState.POLLING;
                PGNotification[] received = pg.getNotifications(timeoutMillis);
                if (received == null || received.length == 0) {
                    continue;
                }
                state = ListenerState.DRAINING;
                for (PGNotification notification : received) {
                    dispatcher.dispatch(IncomingNotification.of(notification));
                }
            }
            state = ListenerState.STOPPED;
            LOG.info("Listener on {} channels stopped", channels.size());
        } catch (Throwable e) {
            if (stopRequested) {
                state = ListenerState.STOPPED;
                LOG.debug("Listener interrupted while stopping", e);
                return;
            }
            state = ListenerState.FAILED;
            LOG.error("Listener failed", e);
            throw new ListenerFailedException("Listener on " + channels + " failed", e);
        } finally {
            closeConnection();
        }
    }

    private void subscribe() throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try (Statement st = connection.createStatement()) {
            for (ChannelEntry<?> channel : channels) {
                st.execute("LISTEN \"" + channel.wireName() + "\"");
                LOG.info("Listening on {}", channel);
            }
            connection.commit();
        } finally {
            connection.setAutoCommit(autoCommit);
        }
        state = ListenerState.LISTENING;
    }

    /**
     * Asks the loop to finish after the current poll. Safe to call from any thread.
     */
    public void stop() {
        stopRequested = true;
    }

    @Override
    public void close() {
        stop();
        closeConnection();
    }

    private void closeConnection() {
        Connection c = connection;
        connection = null;
        if (c == null) {
            return;
        }
        // pooled sessions outlive this listener
        try (Statement st = c.createStatement()) {
            st.execute("UNLISTEN *");
        } catch (SQLException e) {
            LOG.debug("UNLISTEN failed on closing connection", e);
        }
        try {
            c.close();
        } catch (SQLException e) {
            LOG.warn("Failed to close listener connection", e);
        }
    }

    public ListenerState state() {
        return state;
    }

    public List<ChannelEntry<?>> channels() {
        return channels;
    }
}

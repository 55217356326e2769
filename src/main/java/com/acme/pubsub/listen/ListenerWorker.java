package com.acme.pubsub.listen;

import com.acme.pubsub.config.PubSubConfig;
import com.acme.pubsub.core.ChannelRegistry;
import com.acme.pubsub.core.Notifier;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.jdbc.DataSourceResolver;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs a {@link NotificationListener} on a background thread and replaces it with a fresh
 * one (new connection, LISTEN again, optional recovery) whenever it fails.
 */
@Singleton
@Requires(property = "pubsub.listener.enabled", value = "true")
public class ListenerWorker implements ApplicationEventListener<StartupEvent> {
    private static final Logger LOG = LoggerFactory.getLogger(ListenerWorker.class);

    private final DataSource dataSource;
    private final ChannelRegistry registry;
    private final NotificationDispatcher dispatcher;
    private final Notifier notifier;
    private final PubSubConfig.Listener config;

    private volatile boolean running;
    private volatile NotificationListener current;
    private Thread thread;

    public ListenerWorker(DataSource dataSource, @Nullable DataSourceResolver dataSourceResolver,
                          ChannelRegistry registry, NotificationDispatcher dispatcher, Notifier notifier,
                          PubSubConfig config) {
        DataSourceResolver resolver = dataSourceResolver != null ? dataSourceResolver : DataSourceResolver.DEFAULT;
        this.dataSource = resolver.resolve(dataSource);
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.notifier = notifier;
        this.config = config.getListener();
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        start();
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        // fail fast on an empty or unknown selection
        registry.select(config.getChannels(), List.of());
        running = true;
        thread = new Thread(this::supervise, "pgpubsub-listener");
        thread.setDaemon(true);
        thread.start();
    }

    void supervise() {
        try {
            while (running) {
                try {
                    NotificationListener listener = newListener();
                    current = listener;
                    listener.listen();
                } catch (RuntimeException e) {
                    if (!running) {
                        break;
                    }
                    if (!config.isAutoRestart()) {
                        LOG.error("Listener failed and auto-restart is off, giving up", e);
                        break;
                    }
                    LOG.warn("Listener failed, restarting in {}", config.getRestartDelay(), e);
                    if (!pause(config.getRestartDelay())) {
                        break;
                    }
                }
            }
        } finally {
            current = null;
            running = false;
        }
    }

    NotificationListener newListener() {
        return new NotificationListener(
            dataSource,
            registry.select(config.getChannels(), List.of()),
            dispatcher,
            notifier,
            config.getPollTimeout(),
            config.isRecover()
        );
    }

    private boolean pause(Duration delay) {
        try {
            TimeUnit.MILLISECONDS.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @PreDestroy
    public synchronized void stop() {
        running = false;
        NotificationListener listener = current;
        if (listener != null) {
            listener.close();
        }
        if (thread != null) {
            thread.interrupt();
            try {
                thread.join(config.getPollTimeout().toMillis() + 1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            thread = null;
        }
    }

    public boolean isRunning() {
        return running;
    }

    public ListenerState state() {
        NotificationListener listener = current;
        return listener != null ? listener.state() : ListenerState.DISCONNECTED;
    }
}

package com.acme.pubsub.listen;

import com.acme.pubsub.config.PubSubConfig;
import com.acme.pubsub.core.ChannelConfigurationException;
import com.acme.pubsub.core.ChannelRegistry;
import com.acme.pubsub.core.ListenerFailedException;
import com.acme.pubsub.core.Notifier;
import com.acme.pubsub.test.MediaDeleted;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ListenerWorkerTest {

    private ChannelRegistry registry;
    private PubSubConfig config;
    private ListenerWorker worker;

    @BeforeEach
    void setUp() {
        registry = new ChannelRegistry();
        config = new PubSubConfig(new PubSubConfig.Listener());
        config.getListener().setRestartDelay(Duration.ofMillis(10));
        config.getListener().setPollTimeout(Duration.ofMillis(50));
    }

    @AfterEach
    void tearDown() {
        if (worker != null) {
            worker.stop();
        }
    }

    private ListenerWorker worker(Deque<NotificationListener> listeners) {
        return new ListenerWorker(mock(DataSource.class), null, registry,
            mock(NotificationDispatcher.class), mock(Notifier.class), config) {
            @Override
            NotificationListener newListener() {
                return listeners.poll();
            }
        };
    }

    @Test
    void testRestartsFailedListener() throws Exception {
        registry.declare(MediaDeleted.class);
        NotificationListener failing = mock(NotificationListener.class);
        doThrow(new ListenerFailedException("lost", new RuntimeException())).when(failing).listen();
        NotificationListener healthy = mock(NotificationListener.class);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch closed = new CountDownLatch(1);
        doAnswer(inv -> {
            started.countDown();
            try {
                closed.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }).when(healthy).listen();
        doAnswer(inv -> {
            closed.countDown();
            return null;
        }).when(healthy).close();
        Deque<NotificationListener> listeners = new ArrayDeque<>();
        listeners.add(failing);
        listeners.add(healthy);
        worker = worker(listeners);

        worker.start();

        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertTrue(worker.isRunning());
        worker.stop();
        verify(healthy).close();
        assertFalse(worker.isRunning());
    }

    @Test
    void testGivesUpWithoutAutoRestart() throws Exception {
        registry.declare(MediaDeleted.class);
        config.getListener().setAutoRestart(false);
        NotificationListener failing = mock(NotificationListener.class);
        CountDownLatch failed = new CountDownLatch(1);
        doAnswer(inv -> {
            failed.countDown();
            throw new ListenerFailedException("lost", new RuntimeException());
        }).when(failing).listen();
        Deque<NotificationListener> listeners = new ArrayDeque<>();
        listeners.add(failing);
        worker = worker(listeners);

        worker.start();

        assertTrue(failed.await(5, TimeUnit.SECONDS));
        for (int i = 0; i < 50 && worker.isRunning(); i++) {
            Thread.sleep(20);
        }
        assertFalse(worker.isRunning());
        verify(failing, times(1)).listen();
    }

    @Test
    void testRestartsAfterUnexpectedRuntimeException() throws Exception {
        registry.declare(MediaDeleted.class);
        NotificationListener broken = mock(NotificationListener.class);
        doThrow(new IllegalStateException("pool exhausted")).when(broken).listen();
        NotificationListener healthy = mock(NotificationListener.class);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch closed = new CountDownLatch(1);
        doAnswer(inv -> {
            started.countDown();
            try {
                closed.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }).when(healthy).listen();
        doAnswer(inv -> {
            closed.countDown();
            return null;
        }).when(healthy).close();
        Deque<NotificationListener> listeners = new ArrayDeque<>();
        listeners.add(broken);
        listeners.add(healthy);
        worker = worker(listeners);

        worker.start();

        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertTrue(worker.isRunning());
        verify(broken).listen();
    }

    @Test
    void testStopsRunningWhenSupervisorDies() throws Exception {
        registry.declare(MediaDeleted.class);
        NotificationListener failing = mock(NotificationListener.class);
        doThrow(new AssertionError("unexpected")).when(failing).listen();
        Deque<NotificationListener> listeners = new ArrayDeque<>();
        listeners.add(failing);
        worker = worker(listeners);

        worker.start();

        for (int i = 0; i < 50 && worker.isRunning(); i++) {
            Thread.sleep(20);
        }
        assertFalse(worker.isRunning());
    }

    @Test
    void testStartWithoutChannelsFails() {
        worker = worker(new ArrayDeque<>());

        assertThrows(ChannelConfigurationException.class, worker::start);
        assertFalse(worker.isRunning());
    }
}

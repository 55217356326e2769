package com.acme.pubsub.integration;

import com.acme.pubsub.core.ChannelDecoder;
import com.acme.pubsub.core.ChannelEntry;
import com.acme.pubsub.core.ChannelRegistry;
import com.acme.pubsub.core.Notifier;
import com.acme.pubsub.core.TrackedEntity;
import com.acme.pubsub.listen.IncomingNotification;
import com.acme.pubsub.listen.LockingProcessor;
import com.acme.pubsub.listen.RecoveryProcessor;
import com.acme.pubsub.pg.PgEntityLoader;
import com.acme.pubsub.spi.NotificationStore;
import com.acme.pubsub.test.AuthorRenamed;
import com.acme.pubsub.test.Post;
import com.acme.pubsub.test.PostChanged;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import io.micronaut.transaction.TransactionOperations;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
@MicronautTest(transactional = false)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class NotificationStoreIntegrationTest extends PostgresSupport {

    @Inject
    ChannelRegistry registry;

    @Inject
    Notifier notifier;

    @Inject
    NotificationStore store;

    @Inject
    LockingProcessor lockingProcessor;

    @Inject
    RecoveryProcessor recoveryProcessor;

    @Inject
    ChannelDecoder decoder;

    @Inject
    PgEntityLoader entityLoader;

    @Inject
    TransactionOperations<Connection> transactionOps;

    @Inject
    BlogChannels channels;

    @BeforeEach
    void setUp() {
        execute("delete from pgpubsub_notification");
        channels.reset();
    }

    @Test
    void testDurablePublishIsDeliveredOnce() {
        notifier.publish(new AuthorRenamed(7, "Ann", Optional.empty(), null));
        List<Long> ids = storedIds();
        assertEquals(1, ids.size());

        ChannelEntry<AuthorRenamed> entry = registry.resolve(AuthorRenamed.class);
        IncomingNotification notification = new IncomingNotification(entry.wireName(), String.valueOf(ids.get(0)), 0);

        assertEquals(1, lockingProcessor.process(entry, notification));
        assertEquals(0, lockingProcessor.process(entry, notification));

        assertEquals(1, channels.authorRenamed.received().size());
        assertEquals("Ann", channels.authorRenamed.received().get(0).name());
        assertEquals(0, store.depth());
    }

    @Test
    void testLockedRowIsSkippedByConcurrentTransaction() throws Exception {
        notifier.publish(new AuthorRenamed(8, "Bob", Optional.of("Robert"), "typo"));
        long id = storedIds().get(0);
        String wire = registry.resolve(AuthorRenamed.class).wireName();

        Optional<?> seenElsewhere = transactionOps.executeWrite(status -> {
            assertTrue(store.lockById(id, wire).isPresent());
            try {
                return CompletableFuture
                    .supplyAsync(() -> transactionOps.executeWrite(other -> store.lockById(id, wire)))
                    .get(10, TimeUnit.SECONDS);
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });

        assertTrue(seenElsewhere.isEmpty());
        assertEquals(1, store.depth());
    }

    @Test
    void testRolledBackPublishLeavesNothingBehind() {
        assertThrows(RuntimeException.class, () -> transactionOps.executeWrite(status -> {
            notifier.publish(new AuthorRenamed(9, "Cy", Optional.empty(), null));
            throw new IllegalStateException("rollback");
        }));

        assertTrue(storedIds().isEmpty());
    }

    @Test
    void testRecoveryDrainsEveryStoredRow() {
        for (int i = 0; i < 3; i++) {
            notifier.publish(new AuthorRenamed(i, "author-" + i, Optional.empty(), null));
        }
        ChannelEntry<AuthorRenamed> entry = registry.resolve(AuthorRenamed.class);

        int processed = recoveryProcessor.process(entry,
            new IncomingNotification(entry.wireName(), Notifier.RECOVERY_SENTINEL, 0));

        assertEquals(3, processed);
        assertThat(channels.authorRenamed.received())
            .extracting(AuthorRenamed::name)
            .containsExactly("author-0", "author-1", "author-2");
        assertEquals(0, store.depth());
        assertTrue(store.oldestCreatedAt().isEmpty());
    }

    @Test
    void testEntityLoaderReadsRowByPrimaryKey() {
        execute("insert into blog_post (id, title, author, rating, pub_date) "
            + "values (9001, 'Loaded', 4, 3.50, '2024-05-01') on conflict (id) do nothing");

        Optional<ObjectNode> row = entityLoader.findRow(TrackedEntity.of(Post.class), 9001L);

        assertTrue(row.isPresent());
        assertEquals("Loaded", row.get().get("title").asText());
        assertEquals("2024-05-01", row.get().get("pub_date").asText());
        assertTrue(entityLoader.findRow(TrackedEntity.of(Post.class), -1L).isEmpty());
    }

    @Test
    void testStalePayloadReloadsCurrentRow() {
        execute("insert into blog_post (id, title, author, rating, pub_date) "
            + "values (9002, 'Current title', 5, 4.25, null) "
            + "on conflict (id) do update set title = excluded.title, rating = excluded.rating");
        String payload = """
            {"app": "blog", "model": "Post", "db_version": 1,
             "old": {"id": 9002, "title": "Old title", "legacy_column": true},
             "new": {"id": 9002, "title": "Captured title", "legacy_column": true}}""";

        PostChanged changed = decoder.decode(registry.resolve(PostChanged.class), payload);

        assertNull(changed.oldRow());
        assertEquals("Current title", changed.newRow().title());
        assertEquals(0, new BigDecimal("4.25").compareTo(changed.newRow().rating()));
    }

    private static List<Long> storedIds() {
        List<Long> ids = new ArrayList<>();
        try (Connection c = DriverManager.getConnection(POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword());
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("select id from pgpubsub_notification order by id")) {
            while (rs.next()) {
                ids.add(rs.getLong(1));
            }
        } catch (SQLException e) {
            throw new IllegalStateException(e);
        }
        return ids;
    }
}

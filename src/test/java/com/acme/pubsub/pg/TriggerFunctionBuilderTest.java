package com.acme.pubsub.pg;

import com.acme.pubsub.core.ChannelConfigurationException;
import com.acme.pubsub.core.ChannelEntry;
import com.acme.pubsub.core.ChannelRegistry;
import com.acme.pubsub.core.TriggerRegistration;
import com.acme.pubsub.test.MediaDeleted;
import com.acme.pubsub.test.PostChanged;
import com.acme.pubsub.test.PostSaved;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TriggerFunctionBuilderTest {

    private final TriggerFunctionBuilder builder = new TriggerFunctionBuilder();
    private ChannelRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ChannelRegistry();
    }

    @Test
    void testNonDurableFunctionNotifiesPayload() {
        ChannelEntry<PostSaved> channel = registry.declare(PostSaved.class);
        TriggerRegistration registration = TriggerRegistration.postInsert(PostSaved.class);

        String sql = builder.createFunction(channel, registration, null);

        assertTrue(sql.startsWith("CREATE OR REPLACE FUNCTION \"" + channel.wireName() + "_after_insert\"()"));
        assertTrue(sql.contains("'app', 'blog'"));
        assertTrue(sql.contains("'model', 'Post'"));
        assertTrue(sql.contains("COALESCE(to_jsonb(OLD), 'null'::jsonb)"));
        assertTrue(sql.contains("current_setting('pgpubsub.notification_context', true)"));
        assertTrue(sql.contains("current_setting('pgpubsub.payload_extras_builder', true)"));
        assertTrue(sql.contains("notify_payload := payload::text;"));
        assertTrue(sql.contains("PERFORM pg_notify('" + channel.wireName() + "', notify_payload);"));
        assertTrue(sql.contains("RETURN COALESCE(NEW, OLD);"));
        assertFalse(sql.contains("db_version"));
        assertFalse(sql.contains("INSERT INTO"));
    }

    @Test
    void testDurableFunctionStoresRowAndNotifiesId() {
        ChannelEntry<PostChanged> channel = registry.declare(PostChanged.class);

        String sql = builder.createFunction(channel, TriggerRegistration.postSave(PostChanged.class), 12L);

        assertTrue(sql.contains("jsonb_build_object('db_version', 12)"));
        assertTrue(sql.contains("INSERT INTO pgpubsub_notification (channel, payload, db_version)"));
        assertTrue(sql.contains("VALUES ('" + channel.wireName() + "', payload, 12)"));
        assertTrue(sql.contains("RETURNING id::text INTO notify_payload;"));
    }

    @Test
    void testTriggerDdlIsGuarded() {
        ChannelEntry<PostSaved> channel = registry.declare(PostSaved.class);
        TriggerRegistration registration = TriggerRegistration.preSave(PostSaved.class);
        String name = channel.wireName() + "_before_insert_update";

        String sql = builder.createTrigger(channel, registration);

        assertTrue(sql.contains("SELECT 1 FROM pg_trigger WHERE tgname = '" + name + "'"));
        assertTrue(sql.contains("tgrelid = '\"blog_post\"'::regclass"));
        assertTrue(sql.contains("CREATE TRIGGER \"" + name + "\""));
        assertTrue(sql.contains("BEFORE INSERT OR UPDATE ON \"blog_post\""));
        assertTrue(sql.contains("FOR EACH ROW EXECUTE FUNCTION \"" + name + "\"();"));
    }

    @Test
    void testPlainChannelHasNoTrigger() {
        ChannelEntry<MediaDeleted> channel = registry.declare(MediaDeleted.class);

        assertThrows(IllegalArgumentException.class,
            () -> builder.createTrigger(channel, TriggerRegistration.postInsert(PostSaved.class)));
    }

    @Test
    void testIdentifierQuoting() {
        assertEquals("\"public\".\"blog_post\"", SqlIdentifiers.quote("public.blog_post"));
        assertEquals("'it''s'", SqlIdentifiers.literal("it's"));
        assertThrows(ChannelConfigurationException.class, () -> SqlIdentifiers.quote("post\"; drop table x; --"));
        assertThrows(ChannelConfigurationException.class, () -> SqlIdentifiers.quote("public."));
    }
}

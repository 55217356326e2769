package com.acme.pubsub.config;

import com.acme.pubsub.core.ChannelRegistry;
import com.acme.pubsub.core.TriggerRegistration;
import com.acme.pubsub.test.MediaDeleted;
import com.acme.pubsub.test.PostSaved;
import com.acme.pubsub.test.RecordingListener;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PubSubFactoryTest {

    private final PubSubFactory factory = new PubSubFactory();

    @Test
    void testRegistryAppliesEveryRegistrar() {
        ChannelRegistrar media = registry -> registry.register(MediaDeleted.class, new RecordingListener<>());
        ChannelRegistrar posts = registry -> registry.registerTrigger(TriggerRegistration.postSave(PostSaved.class));

        ChannelRegistry registry = factory.channelRegistry(List.of(media, posts));

        assertEquals(2, registry.entries().size());
        assertEquals(1, registry.triggers().size());
        assertEquals(1, registry.resolve(MediaDeleted.class).listeners().size());
    }

    @Test
    void testFilterFromConfig() {
        PubSubConfig config = new PubSubConfig(new PubSubConfig.Listener());
        assertTrue(factory.notificationFilter(config).isNone());

        config.getListener().setPayloadFilter("{\"app\": \"blog\"}");
        assertEquals(Optional.of("{\"app\":\"blog\"}"), factory.notificationFilter(config).containment());
    }

    @Test
    void testConfiguredSchemaVersions() {
        PubSubConfig config = new PubSubConfig(new PubSubConfig.Listener());
        config.setSchemaVersions(Map.of("blog", 7L));
        ConfiguredSchemaVersionOracle oracle = new ConfiguredSchemaVersionOracle(config);

        assertEquals(Optional.of(7L), oracle.currentVersion("blog"));
        assertTrue(oracle.isCurrent("blog", 7));
        assertFalse(oracle.isCurrent("blog", 6));
        assertTrue(oracle.isCurrent("shop", 1));
    }
}

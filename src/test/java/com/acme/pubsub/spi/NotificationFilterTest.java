package com.acme.pubsub.spi;

import com.acme.pubsub.core.ChannelConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NotificationFilterTest {

    @Test
    void testBlankFilterIsNone() {
        assertTrue(NotificationFilter.payloadContains((String) null).isNone());
        assertTrue(NotificationFilter.payloadContains(" ").isNone());
        assertTrue(NotificationFilter.payloadContains(Map.of()).isNone());
        assertTrue(NotificationFilter.none().containment().isEmpty());
    }

    @Test
    void testJsonFilterIsNormalized() {
        NotificationFilter filter = NotificationFilter.payloadContains("{ \"kwargs\" : { \"tenant\" : 4 } }");

        assertEquals("{\"kwargs\":{\"tenant\":4}}", filter.containment().orElseThrow());
    }

    @Test
    void testMapFilter() {
        NotificationFilter filter = NotificationFilter.payloadContains(Map.of("app", "blog"));

        assertEquals("{\"app\":\"blog\"}", filter.containment().orElseThrow());
    }

    @Test
    void testFilterMustBeObject() {
        assertThrows(ChannelConfigurationException.class, () -> NotificationFilter.payloadContains("[1, 2]"));
        assertThrows(ChannelConfigurationException.class, () -> NotificationFilter.payloadContains("{oops"));
    }
}

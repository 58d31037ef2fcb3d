package com.clapgrow.fleet.session.session;

import com.clapgrow.fleet.common.protocol.event.InboundMessage;
import com.clapgrow.fleet.common.protocol.event.MessageKey;
import com.clapgrow.fleet.common.tenant.TenantId;
import com.clapgrow.fleet.session.config.FleetProperties;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecentMessageStoreTest {

    private final RecentMessageStore store = new RecentMessageStore(new FleetProperties());
    private final TenantId first = TenantId.of("100");
    private final TenantId second = TenantId.of("200");
    private final MessageKey key = new MessageKey("254733000000@s.whatsapp.net", "M1", false, null);

    private InboundMessage message(String text) {
        return new InboundMessage(key, JsonNodeFactory.instance.objectNode().put("conversation", text), null, 1L, null);
    }

    @Test
    void testLookup_IsScopedPerTenant() {
        store.record(first, List.of(message("hello")));

        assertEquals("hello", store.lookupFor(first).loadMessage(key).orElseThrow().path("conversation").asText());
        assertTrue(store.lookupFor(second).loadMessage(key).isEmpty());
    }

    @Test
    void testContentlessMessages_AreNotRecorded() {
        store.record(first, List.of(new InboundMessage(key, null, null, 1L, null)));

        assertTrue(store.find(first, key).isEmpty());
    }

    @Test
    void testForget_DropsOnlyThatTenant() {
        store.record(first, List.of(message("a")));
        store.record(second, List.of(message("b")));

        store.forget(first);

        assertTrue(store.find(first, key).isEmpty());
        assertTrue(store.find(second, key).isPresent());
    }
}

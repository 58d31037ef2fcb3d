package com.clapgrow.fleet.session.bridge;

import com.clapgrow.fleet.common.protocol.MessageLookup;
import com.clapgrow.fleet.common.tenant.TenantId;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BridgeClientDirectoryTest {

    private static final TenantId TENANT = TenantId.of("254700000001");

    private final BridgeClientDirectory directory = new BridgeClientDirectory();
    private final BridgeTestSupport bridge = new BridgeTestSupport();
    private final MessageLookup noMessages = key -> Optional.empty();

    private BridgeProtocolClient newClient() {
        return new BridgeProtocolClient(TENANT, bridge.webClient(), Duration.ofSeconds(5),
            new ObjectMapper(), directory::remove);
    }

    @Test
    void testRegister_ReplacesAndClosesPrevious() {
        BridgeProtocolClient first = newClient();
        BridgeProtocolClient second = newClient();

        directory.register(first, noMessages);
        directory.register(second, noMessages);

        assertTrue(first.isClosed());
        assertFalse(second.isClosed());
        assertSame(second, directory.client(TENANT).orElseThrow());
    }

    @Test
    void testRemove_IgnoresStaleClient() {
        BridgeProtocolClient first = newClient();
        BridgeProtocolClient second = newClient();
        directory.register(first, noMessages);
        directory.register(second, noMessages);

        directory.remove(first);

        assertSame(second, directory.client(TENANT).orElseThrow());
    }

    @Test
    void testClose_RemovesEntry() {
        BridgeProtocolClient client = newClient();
        directory.register(client, noMessages);

        client.close();

        assertTrue(directory.client(TENANT).isEmpty());
        assertTrue(directory.lookup(TENANT).isEmpty());
    }
}

package com.clapgrow.fleet.session.command.builtin;

import com.clapgrow.fleet.common.protocol.OutgoingMessage;
import com.clapgrow.fleet.common.protocol.ProtocolClient;
import com.clapgrow.fleet.common.protocol.event.InboundMessage;
import com.clapgrow.fleet.common.protocol.event.MessageKey;
import com.clapgrow.fleet.common.tenant.TenantId;
import com.clapgrow.fleet.session.command.CommandInvocation;
import com.clapgrow.fleet.session.command.CommandRegistry;
import com.clapgrow.fleet.session.config.FleetProperties;
import com.clapgrow.fleet.session.dispatch.MessageContextFactory;
import com.clapgrow.fleet.session.session.SessionHandle;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class CorePluginTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");
    private static final String CHAT = "254733000000@s.whatsapp.net";

    private FleetProperties fleetProperties;
    private CorePlugin plugin;
    private ProtocolClient client;
    private SessionHandle handle;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        fleetProperties = new FleetProperties();
        fleetProperties.setBotName("FLEET");
        ObjectProvider<CommandRegistry> provider = mock(ObjectProvider.class);
        plugin = new CorePlugin(fleetProperties, provider, Clock.fixed(NOW, ZoneOffset.UTC));
        CommandRegistry registry = new CommandRegistry(List.of(plugin, new StatusSaverPlugin()));
        when(provider.getObject()).thenReturn(registry);

        client = mock(ProtocolClient.class);
        when(client.selfJid()).thenReturn(Optional.of("254700000001@s.whatsapp.net"));
        handle = new SessionHandle(TenantId.of("254700000001"), client, NOW.minusSeconds(3725), false, null);
    }

    private CommandInvocation invocation(String text, long timestamp) {
        InboundMessage message = new InboundMessage(new MessageKey(CHAT, "M1", false, null),
            JsonNodeFactory.instance.objectNode().put("conversation", text), "Bob", timestamp, null);
        return new CommandInvocation(handle, message, new MessageContextFactory(fleetProperties).create(handle, message));
    }

    private String replyText() {
        ArgumentCaptor<OutgoingMessage> sent = ArgumentCaptor.forClass(OutgoingMessage.class);
        verify(client).sendMessage(eq(CHAT), sent.capture(), any());
        return sent.getValue().text();
    }

    @Test
    void testPing_ReportsLatencyFromMessageTimestamp() {
        plugin.ping(invocation(".ping", NOW.getEpochSecond() - 2));

        assertEquals("*Pong!* 2000 ms", replyText());
    }

    @Test
    void testAlive_ShowsUptimeAndMode() {
        plugin.alive(invocation(".alive", NOW.getEpochSecond()));

        String text = replyText();
        assertTrue(text.startsWith("*FLEET is alive*"));
        assertTrue(text.contains("Uptime: 1h 2m 5s"));
        assertTrue(text.contains("Prefix: ."));
    }

    @Test
    void testMenu_ListsPrefixCommandsOnly() {
        plugin.menu(invocation(".menu", NOW.getEpochSecond()));

        String text = replyText();
        assertTrue(text.startsWith("*FLEET MENU*"));
        assertTrue(text.contains("*MAIN*"));
        assertTrue(text.contains("│ .ping - Check response time"));
        assertTrue(text.contains("│ .menu"));
        assertFalse(text.contains("status-saver"));
    }

    @Test
    void testFormatUptime() {
        assertEquals("0h 0m 0s", CorePlugin.formatUptime(Duration.ofSeconds(-5)));
        assertEquals("26h 0m 1s", CorePlugin.formatUptime(Duration.ofHours(26).plusSeconds(1)));
    }
}

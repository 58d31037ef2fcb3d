package com.clapgrow.fleet.session.dispatch;

import com.clapgrow.fleet.common.protocol.OutgoingMessage;
import com.clapgrow.fleet.common.protocol.ProtocolClient;
import com.clapgrow.fleet.common.protocol.ProtocolClientException;
import com.clapgrow.fleet.common.protocol.event.InboundMessage;
import com.clapgrow.fleet.common.protocol.event.MessageKey;
import com.clapgrow.fleet.common.tenant.TenantId;
import com.clapgrow.fleet.session.command.CommandDescriptor;
import com.clapgrow.fleet.session.command.CommandInvocation;
import com.clapgrow.fleet.session.command.CommandRegistry;
import com.clapgrow.fleet.session.command.CommandTrigger;
import com.clapgrow.fleet.session.config.FleetProperties;
import com.clapgrow.fleet.session.session.SessionHandle;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class CommandDispatcherTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<String> fired = new ArrayList<>();
    private FleetProperties fleetProperties;
    private SimpleMeterRegistry meterRegistry;
    private CommandDispatcher dispatcher;
    private ProtocolClient client;
    private SessionHandle handle;

    @BeforeEach
    void setUp() {
        fleetProperties = new FleetProperties();
        meterRegistry = new SimpleMeterRegistry();
        CommandRegistry registry = new CommandRegistry(List.of(() -> List.of(
            CommandDescriptor.command("ping", "general", "Latency", inv -> fired.add("ping")).withReact("🏓"),
            CommandDescriptor.command("menu", "general", "Menu", inv -> fired.add("menu")).withAliases("help"),
            CommandDescriptor.command("boom", "general", "Fails", inv -> {
                throw new IllegalStateException("handler failed");
            }),
            CommandDescriptor.on(CommandTrigger.BODY, "body-watch", "Any body", inv -> fired.add("body")),
            CommandDescriptor.on(CommandTrigger.IMAGE, "image-watch", "Any image", inv -> fired.add("image")),
            CommandDescriptor.on(CommandTrigger.STICKER, "sticker-watch", "Any sticker", inv -> fired.add("sticker")))));
        dispatcher = new CommandDispatcher(registry, fleetProperties, meterRegistry);

        client = mock(ProtocolClient.class);
        when(client.selfJid()).thenReturn(Optional.of("254700000001@s.whatsapp.net"));
        handle = new SessionHandle(TenantId.of("254700000001"), client, Instant.EPOCH, false, null);
    }

    private CommandInvocation invocation(String json) throws Exception {
        InboundMessage message = new InboundMessage(
            new MessageKey("254733000000@s.whatsapp.net", "M1", false, null),
            objectMapper.readTree(json), "Bob", 1L, null);
        MessageContext context = new MessageContextFactory(fleetProperties).create(handle, message);
        return new CommandInvocation(handle, message, context);
    }

    @Test
    void testDispatchCommand_RunsMatchingCommandAfterReaction() throws Exception {
        Optional<HandlerOutcome> outcome = dispatcher.dispatchCommand(invocation("{\"conversation\":\".ping\"}"));

        assertTrue(outcome.isPresent());
        assertTrue(outcome.get().success());
        assertEquals(List.of("ping"), fired);
        verify(client).sendMessage(eq("254733000000@s.whatsapp.net"),
            argThat((OutgoingMessage m) -> m.isReaction() && "🏓".equals(m.reactionEmoji())));
    }

    @Test
    void testDispatchCommand_ResolvesAlias() throws Exception {
        dispatcher.dispatchCommand(invocation("{\"conversation\":\".HELP\"}"));

        assertEquals(List.of("menu"), fired);
    }

    @Test
    void testDispatchCommand_UnknownOrPlainText_DoesNothing() throws Exception {
        assertTrue(dispatcher.dispatchCommand(invocation("{\"conversation\":\".nope\"}")).isEmpty());
        assertTrue(dispatcher.dispatchCommand(invocation("{\"conversation\":\"ping\"}")).isEmpty());
        assertTrue(fired.isEmpty());
    }

    @Test
    void testDispatchCommand_PrivateModeIgnoresNonOwners() throws Exception {
        fleetProperties.setWorkType("private");

        assertTrue(dispatcher.dispatchCommand(invocation("{\"conversation\":\".menu\"}")).isEmpty());

        fleetProperties.setOwnerNumber("254733000000");
        assertTrue(dispatcher.dispatchCommand(invocation("{\"conversation\":\".menu\"}")).isPresent());
        assertEquals(List.of("menu"), fired);
    }

    @Test
    void testDispatchCommand_HandlerFailureIsReturnedAndCounted() throws Exception {
        HandlerOutcome outcome = dispatcher.dispatchCommand(invocation("{\"conversation\":\".boom\"}")).orElseThrow();

        assertFalse(outcome.success());
        assertEquals("handler failed", outcome.failure().getMessage());
        assertEquals(1.0, meterRegistry.get("fleet.dispatch.handler.failures").counter().count());
    }

    @Test
    void testDispatchCommand_ReactionFailureDoesNotBlockHandler() throws Exception {
        doThrow(new ProtocolClientException("send failed")).when(client).sendMessage(any(), any());

        dispatcher.dispatchCommand(invocation("{\"conversation\":\".ping\"}"));

        assertEquals(List.of("ping"), fired);
    }

    @Test
    void testDispatchPassive_FiresEveryMatchingTrigger() throws Exception {
        List<HandlerOutcome> outcomes = dispatcher.dispatchPassive(invocation("{\"imageMessage\":{\"caption\":\"look\"}}"));

        assertEquals(2, outcomes.size());
        assertEquals(List.of("body", "image"), fired);
    }

    @Test
    void testDispatchPassive_StickerWithoutBody() throws Exception {
        dispatcher.dispatchPassive(invocation("{\"stickerMessage\":{\"mimetype\":\"image/webp\"}}"));

        assertEquals(List.of("sticker"), fired);
    }
}

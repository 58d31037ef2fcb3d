package com.clapgrow.fleet.session.dispatch;

import com.clapgrow.fleet.common.protocol.GroupMetadata;
import com.clapgrow.fleet.common.protocol.ProtocolClient;
import com.clapgrow.fleet.common.protocol.ProtocolClientException;
import com.clapgrow.fleet.common.protocol.event.InboundMessage;
import com.clapgrow.fleet.common.protocol.event.MessageKey;
import com.clapgrow.fleet.common.tenant.TenantId;
import com.clapgrow.fleet.session.config.FleetProperties;
import com.clapgrow.fleet.session.session.SessionHandle;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class MessageContextFactoryTest {

    private static final String BOT = "254700000001";
    private static final String GROUP = "1203630@g.us";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private FleetProperties fleetProperties;
    private MessageContextFactory factory;
    private ProtocolClient client;
    private SessionHandle handle;

    @BeforeEach
    void setUp() {
        fleetProperties = new FleetProperties();
        fleetProperties.setOwnerNumber("+254 711 000 000, 254722000000");
        factory = new MessageContextFactory(fleetProperties);
        client = mock(ProtocolClient.class);
        when(client.selfJid()).thenReturn(Optional.of(BOT + ":7@s.whatsapp.net"));
        handle = new SessionHandle(TenantId.of(BOT), client, Instant.EPOCH, false, null);
    }

    private InboundMessage message(String remoteJid, boolean fromMe, String participant, String json) throws Exception {
        return new InboundMessage(new MessageKey(remoteJid, "MSG1", fromMe, participant),
            objectMapper.readTree(json), "Alice", 1_700_000_000L, null);
    }

    @Test
    void testCommand_ParsesNameAndArguments() throws Exception {
        MessageContext context = factory.create(handle,
            message("254733000000@s.whatsapp.net", false, null, "{\"conversation\":\".Menu  all   commands\"}"));

        assertTrue(context.isCmd());
        assertEquals("menu", context.command());
        assertEquals(List.of("all", "commands"), context.args());
        assertEquals("all commands", context.q());
        assertEquals("254733000000", context.senderNumber());
        assertEquals(BOT, context.botNumber());
        assertFalse(context.isOwner());
        assertFalse(context.isGroup());
        assertEquals("Alice", context.pushName());
    }

    @Test
    void testPlainText_IsNotACommand() throws Exception {
        MessageContext context = factory.create(handle,
            message("254733000000@s.whatsapp.net", false, null, "{\"conversation\":\"hello there\"}"));

        assertFalse(context.isCmd());
        assertEquals("", context.command());
        assertEquals(List.of("there"), context.args());
    }

    @Test
    void testImageCaption_UsedAsBody() throws Exception {
        MessageContext context = factory.create(handle,
            message("254733000000@s.whatsapp.net", false, null, "{\"imageMessage\":{\"caption\":\".ping\"}}"));

        assertEquals("imageMessage", context.contentType());
        assertEquals(".ping", context.body());
        assertTrue(context.isCmd());
        assertEquals("ping", context.command());
    }

    @Test
    void testOwnNumberAndConfiguredOwners_AreOwners() throws Exception {
        MessageContext fromMe = factory.create(handle,
            message("254733000000@s.whatsapp.net", true, null, "{\"conversation\":\"hi\"}"));
        MessageContext fromOwner = factory.create(handle,
            message("254711000000@s.whatsapp.net", false, null, "{\"conversation\":\"hi\"}"));

        assertTrue(fromMe.isMe());
        assertTrue(fromMe.isOwner());
        assertEquals(BOT + "@s.whatsapp.net", fromMe.sender());
        assertFalse(fromOwner.isMe());
        assertTrue(fromOwner.isOwner());
    }

    @Test
    void testGroupMessage_ResolvesAdmins() throws Exception {
        when(client.groupMetadata(GROUP)).thenReturn(new GroupMetadata(GROUP, "Team", List.of(
            new GroupMetadata.Participant("254744000000@s.whatsapp.net", "admin"),
            new GroupMetadata.Participant(BOT + "@s.whatsapp.net", null))));

        MessageContext context = factory.create(handle,
            message(GROUP, false, "254744000000@s.whatsapp.net", "{\"conversation\":\"hey\"}"));

        assertTrue(context.isGroup());
        assertEquals("254744000000@s.whatsapp.net", context.sender());
        assertEquals(Optional.of("Team"), context.group().subject());
        assertTrue(context.isAdmins());
        assertFalse(context.isBotAdmins());
    }

    @Test
    void testGroupLookupFailure_LeavesGroupContextEmpty() throws Exception {
        when(client.groupMetadata(GROUP)).thenThrow(new ProtocolClientException("forbidden"));

        MessageContext context = factory.create(handle,
            message(GROUP, false, "254744000000@s.whatsapp.net", "{\"conversation\":\"hey\"}"));

        assertTrue(context.isGroup());
        assertTrue(context.group().isFailed());
        assertFalse(context.group().isPresent());
        assertFalse(context.isAdmins());
    }

    @Test
    void testQuotedText_IsExposed() throws Exception {
        String json = "{\"extendedTextMessage\":{\"text\":\"send\",\"contextInfo\":"
            + "{\"quotedMessage\":{\"conversation\":\"original\"}}}}";

        MessageContext context = factory.create(handle, message("254733000000@s.whatsapp.net", false, null, json));

        assertEquals("send", context.body());
        assertEquals(Optional.of("original"), context.quotedText());
        assertTrue(context.quoted().isPresent());
    }
}

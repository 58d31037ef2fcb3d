package com.clapgrow.fleet.session.dispatch;

import com.clapgrow.fleet.common.protocol.OutgoingMessage;
import com.clapgrow.fleet.common.protocol.ProtocolClient;
import com.clapgrow.fleet.common.protocol.ProtocolClientException;
import com.clapgrow.fleet.common.protocol.event.InboundMessage;
import com.clapgrow.fleet.common.protocol.event.MessageKey;
import com.clapgrow.fleet.common.tenant.TenantId;
import com.clapgrow.fleet.session.config.TenantConfigDefaults;
import com.clapgrow.fleet.session.session.SessionHandle;
import com.clapgrow.fleet.session.store.TenantConfig;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class StatusAutomationTest {

    private static final String POSTER = "254755000000@s.whatsapp.net";
    private static final String SELF = "254700000001@s.whatsapp.net";

    private final StatusAutomation automation = new StatusAutomation();
    private ProtocolClient client;
    private SessionHandle handle;
    private TenantConfigDefaults defaults;
    private InboundMessage status;

    @BeforeEach
    void setUp() {
        client = mock(ProtocolClient.class);
        when(client.selfJid()).thenReturn(Optional.of(SELF));
        handle = new SessionHandle(TenantId.of("254700000001"), client, Instant.EPOCH, false, null);
        defaults = new TenantConfigDefaults();
        defaults.setAutoLikeEmojis(List.of("🔥"));
        status = new InboundMessage(new MessageKey("status@broadcast", "S1", false, POSTER),
            JsonNodeFactory.instance.objectNode().put("conversation", "my day"), "Poster", 1L, null);
    }

    @Test
    void testDefaults_ViewAndLikeVisibleToPosterAndSelf() {
        automation.handle(handle, status, TenantConfig.defaults(defaults));

        verify(client).readMessages(List.of(status.key()));
        verify(client).sendStatusReaction(status.key(), "🔥", List.of(POSTER, SELF));
        verify(client, never()).sendMessage(any(), any(), any());
    }

    @Test
    void testReplyEnabled_SendsQuotedReplyWithReaction() {
        defaults.setAutoStatusReply(true);
        defaults.setAutoStatusMessage("Nice one");

        automation.handle(handle, status, TenantConfig.defaults(defaults));

        verify(client).sendMessage(eq(POSTER), argThat((OutgoingMessage m) ->
            "Nice one".equals(m.text()) && StatusAutomation.REPLY_REACTION.equals(m.reactionEmoji())), any());
    }

    @Test
    void testAllFlagsOff_DoesNothing() {
        defaults.setAutoViewStatus(false);
        defaults.setAutoLikeStatus(false);

        automation.handle(handle, status, TenantConfig.defaults(defaults));

        verifyNoInteractions(client);
    }

    @Test
    void testViewFailure_StillLikes() {
        doThrow(new ProtocolClientException("offline")).when(client).readMessages(anyList());

        automation.handle(handle, status, TenantConfig.defaults(defaults));

        verify(client).sendStatusReaction(eq(status.key()), eq("🔥"), anyList());
    }
}

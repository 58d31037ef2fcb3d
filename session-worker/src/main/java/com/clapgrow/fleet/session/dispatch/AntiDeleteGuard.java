package com.clapgrow.fleet.session.dispatch;

import com.clapgrow.fleet.common.message.MessageContent;
import com.clapgrow.fleet.common.protocol.OutgoingMessage;
import com.clapgrow.fleet.common.protocol.event.ClientEventListener;
import com.clapgrow.fleet.common.protocol.event.MessageKey;
import com.clapgrow.fleet.common.protocol.event.MessageUpdate;
import com.clapgrow.fleet.session.session.RecentMessageStore;
import com.clapgrow.fleet.session.session.SessionHandle;
import com.clapgrow.fleet.session.store.CredentialStore;
import com.clapgrow.fleet.session.store.TenantConfig;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Re-posts messages deleted by their sender to the tenant's own chat,
 * for tenants with anti-delete enabled.
 * 
 * Only messages still held by {@link RecentMessageStore} can be recovered.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AntiDeleteGuard {

    private final CredentialStore credentialStore;
    private final RecentMessageStore messageStore;

    public ClientEventListener listenerFor(SessionHandle handle) {
        return new ClientEventListener() {
            @Override
            public void onMessagesUpdate(List<MessageUpdate> updates) {
                handleUpdates(handle, updates);
            }
        };
    }

    void handleUpdates(SessionHandle handle, List<MessageUpdate> updates) {
        List<MessageUpdate> revokes = updates.stream()
            .filter(MessageUpdate::isRevoke)
            .filter(update -> update.key() != null && !update.key().fromMe())
            .toList();
        if (revokes.isEmpty()) {
            return;
        }
        TenantConfig config;
        try {
            config = credentialStore.getConfig(handle.tenant());
        } catch (RuntimeException e) {
            log.error("Could not load config for tenant {}; ignoring deletions: {}", handle.tenant(), e.getMessage());
            return;
        }
        if (!config.antiDelete()) {
            return;
        }
        for (MessageUpdate revoke : revokes) {
            Optional<JsonNode> original = messageStore.find(handle.tenant(), revoke.key());
            if (original.isEmpty()) {
                log.debug("Deleted message {} for tenant {} is no longer cached", revoke.key().id(), handle.tenant());
                continue;
            }
            try {
                handle.client().sendMessage(handle.selfJid(), OutgoingMessage.text(notice(revoke.key(), original.get())));
                log.info("Recovered deleted message {} in {} for tenant {}",
                    revoke.key().id(), revoke.key().remoteJid(), handle.tenant());
            } catch (RuntimeException e) {
                log.error("Anti-delete failed for tenant {} on message {}: {}",
                    handle.tenant(), revoke.key().id(), e.getMessage());
            }
        }
    }

    static String notice(MessageKey key, JsonNode original) {
        JsonNode content = MessageContent.unwrapEphemeral(original);
        String sender = key.participant() != null ? key.participant() : key.remoteJid();
        String text = MessageContent.body(content);
        if (text.isEmpty()) {
            text = MessageContent.caption(content)
                .orElseGet(() -> "[" + MessageContent.contentType(content).orElse("unknown") + "]");
        }
        return "*🗑️ Deleted message*\n"
            + "*From:* @" + sender.split("@")[0] + "\n"
            + "*Chat:* " + key.remoteJid() + "\n\n"
            + text;
    }
}

package com.clapgrow.fleet.session.dispatch;

import com.clapgrow.fleet.common.protocol.OutgoingMessage;
import com.clapgrow.fleet.common.protocol.ProtocolClient;
import com.clapgrow.fleet.common.protocol.event.InboundMessage;
import com.clapgrow.fleet.common.protocol.event.MessageKey;
import com.clapgrow.fleet.session.session.SessionHandle;
import com.clapgrow.fleet.session.store.TenantConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Automatic view, like and reply for status posts, each gated by its own flag.
 */
@Component
@Slf4j
public class StatusAutomation {

    static final String REPLY_REACTION = "💫";

    public void handle(SessionHandle handle, InboundMessage message, TenantConfig config) {
        MessageKey key = message.key();
        ProtocolClient client = handle.client();

        if (config.autoViewStatus()) {
            attempt(handle, "view status", () -> client.readMessages(List.of(key)));
        }

        if (config.autoLikeStatus() && !config.autoLikeEmojis().isEmpty()) {
            String emoji = pick(config.autoLikeEmojis());
            List<String> audience = new ArrayList<>();
            if (key.participant() != null) {
                audience.add(key.participant());
            }
            audience.add(handle.selfJid());
            attempt(handle, "like status", () -> client.sendStatusReaction(key, emoji, audience));
        }

        if (config.autoStatusReply() && key.participant() != null) {
            OutgoingMessage reply = OutgoingMessage.text(config.autoStatusMessage()).withReaction(REPLY_REACTION, key);
            attempt(handle, "reply to status",
                () -> client.sendMessage(key.participant(), reply, message.toQuotedNode()));
        }
    }

    static String pick(List<String> options) {
        return options.get(ThreadLocalRandom.current().nextInt(options.size()));
    }

    private void attempt(SessionHandle handle, String action, Runnable step) {
        try {
            step.run();
        } catch (RuntimeException e) {
            log.warn("Failed to {} for tenant {}: {}", action, handle.tenant(), e.getMessage());
        }
    }
}

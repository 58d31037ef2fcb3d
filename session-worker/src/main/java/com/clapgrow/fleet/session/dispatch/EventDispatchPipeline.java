package com.clapgrow.fleet.session.dispatch;

import com.clapgrow.fleet.common.jid.Jids;
import com.clapgrow.fleet.common.message.MessageContent;
import com.clapgrow.fleet.common.protocol.Presence;
import com.clapgrow.fleet.common.protocol.ProtocolClient;
import com.clapgrow.fleet.common.protocol.event.ClientEventListener;
import com.clapgrow.fleet.common.protocol.event.InboundMessage;
import com.clapgrow.fleet.common.protocol.event.MessageKey;
import com.clapgrow.fleet.common.tenant.TenantId;
import com.clapgrow.fleet.session.command.CommandInvocation;
import com.clapgrow.fleet.session.config.FleetProperties;
import com.clapgrow.fleet.session.session.SessionHandle;
import com.clapgrow.fleet.session.store.CredentialStore;
import com.clapgrow.fleet.session.store.StatCounter;
import com.clapgrow.fleet.session.store.TenantConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns inbound messages of one session into automatic behaviours and handler invocations.
 * 
 * <p>Per message, in order:
 * <ol>
 *   <li>Load the tenant's configuration from the store (never cached)</li>
 *   <li>Unwrap an ephemeral envelope</li>
 *   <li>Read receipt, broadcast-channel reaction</li>
 *   <li>Status posts: view/like/reply, then stop</li>
 *   <li>Build the message context, send typing/recording presence</li>
 *   <li>Prefixed command, usage counters, passive triggers</li>
 * </ol>
 * Side effects are best-effort; a failure is logged and the next step runs.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventDispatchPipeline {

    private final CredentialStore credentialStore;
    private final MessageContextFactory contextFactory;
    private final StatusAutomation statusAutomation;
    private final CommandDispatcher commandDispatcher;
    private final FleetProperties fleetProperties;

    public ClientEventListener listenerFor(SessionHandle handle) {
        return new ClientEventListener() {
            @Override
            public void onMessagesUpsert(List<InboundMessage> messages) {
                for (InboundMessage message : messages) {
                    try {
                        dispatch(handle, message);
                    } catch (RuntimeException e) {
                        log.error("Message handler error for tenant {}: {}", handle.tenant(), e.getMessage(), e);
                    }
                }
            }
        };
    }

    public void dispatch(SessionHandle handle, InboundMessage inbound) {
        if (!inbound.hasContent() || inbound.key() == null) {
            return;
        }
        TenantId tenant = handle.tenant();
        ProtocolClient client = handle.client();
        TenantConfig config = credentialStore.getConfig(tenant);

        InboundMessage message = inbound.withMessage(MessageContent.unwrapEphemeral(inbound.message()));
        MessageKey key = message.key();

        if (config.readMessage()) {
            bestEffort(tenant, "send read receipt", () -> client.readMessages(List.of(key)));
        }

        List<String> channels = fleetProperties.getBroadcast().getChannelJids();
        if (Jids.isNewsletter(key.remoteJid()) && channels.contains(key.remoteJid())
            && message.newsletterServerId() != null
            && !fleetProperties.getBroadcast().getEmojis().isEmpty()) {
            String emoji = StatusAutomation.pick(fleetProperties.getBroadcast().getEmojis());
            bestEffort(tenant, "react to channel post",
                () -> client.newsletterReact(key.remoteJid(), message.newsletterServerId(), emoji));
        }

        if (Jids.isStatusBroadcast(key.remoteJid())) {
            statusAutomation.handle(handle, message, config);
            return;
        }

        MessageContext context = contextFactory.create(handle, message);

        if (config.autoTyping()) {
            bestEffort(tenant, "send typing presence", () -> client.sendPresenceUpdate(Presence.COMPOSING, context.from()));
        }
        if (config.autoRecording()) {
            bestEffort(tenant, "send recording presence", () -> client.sendPresenceUpdate(Presence.RECORDING, context.from()));
        }

        CommandInvocation invocation = new CommandInvocation(handle, message, context);
        commandDispatcher.dispatchCommand(invocation);

        if (context.isCmd()) {
            countStat(tenant, StatCounter.COMMANDS_USED);
        }
        countStat(tenant, StatCounter.MESSAGES_RECEIVED);
        if (context.isGroup()) {
            countStat(tenant, StatCounter.GROUPS_INTERACTED);
        }

        commandDispatcher.dispatchPassive(invocation);
    }

    private void countStat(TenantId tenant, StatCounter counter) {
        bestEffort(tenant, "count " + counter, () -> credentialStore.incrementStat(tenant, counter));
    }

    private void bestEffort(TenantId tenant, String action, Runnable step) {
        try {
            step.run();
        } catch (RuntimeException e) {
            log.warn("Failed to {} for tenant {}: {}", action, tenant, e.getMessage());
        }
    }
}

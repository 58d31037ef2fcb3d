package com.clapgrow.fleet.session.session;

import com.clapgrow.fleet.common.protocol.OutgoingMessage;
import com.clapgrow.fleet.common.protocol.event.ClientEventListener;
import com.clapgrow.fleet.common.protocol.event.ConnectionUpdate;
import com.clapgrow.fleet.session.config.FleetProperties;
import com.clapgrow.fleet.session.store.CredentialStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Marks a session open, adds its tenant to the roster and greets newly paired accounts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionOpenHandler {

    private final CredentialStore credentialStore;
    private final FleetProperties fleetProperties;
    private final Clock clock;

    public ClientEventListener listenerFor(SessionHandle handle) {
        return new ClientEventListener() {
            @Override
            public void onConnectionUpdate(ConnectionUpdate update) {
                if (update.isOpen()) {
                    onOpen(handle);
                }
            }
        };
    }

    void onOpen(SessionHandle handle) {
        if (!handle.markOpen(clock.instant())) {
            return;
        }
        log.info("Connected: tenant {}", handle.tenant());
        try {
            credentialStore.addTenant(handle.tenant());
        } catch (RuntimeException e) {
            log.error("Failed to add tenant {} to roster: {}", handle.tenant(), e.getMessage(), e);
        }
        if (handle.isNewPairing()) {
            try {
                handle.client().sendMessage(handle.selfJid(), OutgoingMessage.text(welcomeText()));
            } catch (RuntimeException e) {
                log.warn("Failed to send welcome message to tenant {}: {}", handle.tenant(), e.getMessage());
            }
        }
    }

    String welcomeText() {
        String prefix = fleetProperties.getCommandPrefix();
        return "*Connected successfully*\n"
            + "Type *" + prefix + "menu* to see the full command list\n"
            + "Prefix: " + prefix + "\n"
            + "Mode: " + fleetProperties.getMode() + "\n"
            + "_" + fleetProperties.getBotName() + "_";
    }
}

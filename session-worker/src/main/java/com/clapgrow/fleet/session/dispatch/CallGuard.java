package com.clapgrow.fleet.session.dispatch;

import com.clapgrow.fleet.common.protocol.OutgoingMessage;
import com.clapgrow.fleet.common.protocol.event.CallOffer;
import com.clapgrow.fleet.common.protocol.event.ClientEventListener;
import com.clapgrow.fleet.session.session.SessionHandle;
import com.clapgrow.fleet.session.store.CredentialStore;
import com.clapgrow.fleet.session.store.TenantConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Rejects incoming calls for tenants with anti-call enabled and tells the caller why.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CallGuard {

    private final CredentialStore credentialStore;

    public ClientEventListener listenerFor(SessionHandle handle) {
        return new ClientEventListener() {
            @Override
            public void onCalls(List<CallOffer> calls) {
                handleCalls(handle, calls);
            }
        };
    }

    void handleCalls(SessionHandle handle, List<CallOffer> calls) {
        TenantConfig config;
        try {
            config = credentialStore.getConfig(handle.tenant());
        } catch (RuntimeException e) {
            log.error("Could not load config for tenant {}; leaving calls alone: {}", handle.tenant(), e.getMessage());
            return;
        }
        if (!config.antiCall()) {
            return;
        }
        for (CallOffer call : calls) {
            if (!call.isOffer()) {
                continue;
            }
            try {
                handle.client().rejectCall(call.id(), call.from());
                handle.client().sendMessage(call.from(), OutgoingMessage.text(config.rejectMessage()));
                log.info("Rejected call {} from {} for tenant {}", call.id(), call.from(), handle.tenant());
            } catch (RuntimeException e) {
                log.error("Anti-call failed for tenant {} on call {}: {}", handle.tenant(), call.id(), e.getMessage());
            }
        }
    }
}

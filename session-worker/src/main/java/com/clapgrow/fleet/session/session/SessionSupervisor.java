package com.clapgrow.fleet.session.session;

import com.clapgrow.fleet.common.protocol.ClientOptions;
import com.clapgrow.fleet.common.protocol.ProtocolClient;
import com.clapgrow.fleet.common.protocol.ProtocolClientFactory;
import com.clapgrow.fleet.common.protocol.event.ClientEventBus;
import com.clapgrow.fleet.common.protocol.event.ClientEventListener;
import com.clapgrow.fleet.common.protocol.event.InboundMessage;
import com.clapgrow.fleet.common.tenant.TenantId;
import com.clapgrow.fleet.session.config.FleetProperties;
import com.clapgrow.fleet.session.dispatch.AntiDeleteGuard;
import com.clapgrow.fleet.session.dispatch.CallGuard;
import com.clapgrow.fleet.session.dispatch.EventDispatchPipeline;
import com.clapgrow.fleet.session.reconnect.ReconnectionPolicy;
import com.clapgrow.fleet.session.session.ConnectionLockTable.ConnectionLock;
import com.clapgrow.fleet.session.store.CredentialStore;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Creates, restores and tears down per-tenant protocol sessions.
 * 
 * <p>Rules (must not be violated):
 * <ul>
 *   <li>At most one registered handle per tenant</li>
 *   <li>The connection lock is taken before any other mutation of a connect
 *       attempt and released exactly once on every exit path</li>
 *   <li>{@link #connect} never throws; failures go to the result sink and the log</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionSupervisor {

    private final SessionRegistry registry;
    private final ConnectionLockTable locks;
    private final CredentialStore credentialStore;
    private final LocalCredentialCache localCache;
    private final RecentMessageStore messageStore;
    private final ProtocolClientFactory clientFactory;
    private final MediaSaver mediaSaver;
    private final SessionOpenHandler openHandler;
    private final ReconnectionPolicy reconnectionPolicy;
    private final CallGuard callGuard;
    private final AntiDeleteGuard antiDeleteGuard;
    private final EventDispatchPipeline dispatchPipeline;
    private final TaskScheduler taskScheduler;
    private final FleetProperties fleetProperties;
    private final Clock clock;

    /**
     * Connect a tenant: pair a new account or restore stored credentials.
     * 
     * @param tenant Tenant to connect
     * @param sink Receiver of the outcome; may be null for background connects
     */
    public void connect(TenantId tenant, ConnectResultSink sink) {
        ConnectResultSink target = sink != null ? sink : ConnectResultSink.discard();

        if (respondIfRegistered(tenant, target)) {
            return;
        }

        Optional<ConnectionLock> acquired = locks.tryAcquire(tenant);
        if (acquired.isEmpty()) {
            log.info("Tenant {} is already in connection process, skipping", tenant);
            target.respond(ConnectResult.inProgress());
            return;
        }

        try (ConnectionLock lock = acquired.get()) {
            // A concurrent attempt may have finished between the first check and the lock
            if (respondIfRegistered(tenant, target)) {
                return;
            }
            openSession(tenant, target);
        } catch (RuntimeException e) {
            log.error("Connect failed for tenant {}: {}", tenant, e.getMessage(), e);
            if (!target.hasResponded()) {
                target.respond(ConnectResult.error(e.getMessage()));
            }
        }
    }

    /**
     * Background connect with nobody waiting for the outcome.
     */
    public void reconnect(TenantId tenant) {
        connect(tenant, ConnectResultSink.discard());
    }

    /**
     * Close a session's transport, detach its listeners and unregister it.
     * Stored state is left to the caller.
     */
    public void closeSession(SessionHandle handle) {
        try {
            handle.shutdown();
        } finally {
            registry.unregister(handle);
            messageStore.forget(handle.tenant());
        }
    }

    private boolean respondIfRegistered(TenantId tenant, ConnectResultSink sink) {
        Optional<SessionHandle> existing = registry.get(tenant);
        if (existing.isEmpty()) {
            return false;
        }
        if (existing.get().isOpen()) {
            log.info("Tenant {} is already connected, skipping", tenant);
            sink.respond(ConnectResult.alreadyConnected(registry.status(tenant)));
        } else {
            sink.respond(ConnectResult.inProgress());
        }
        return true;
    }

    private void openSession(TenantId tenant, ConnectResultSink sink) {
        Optional<JsonNode> stored = credentialStore.getCredential(tenant);
        boolean newPairing = stored.isEmpty();
        try {
            if (newPairing) {
                log.info("No stored session for tenant {}, new pairing required", tenant);
                localCache.purge(tenant);
            } else {
                localCache.write(tenant, stored.get());
                log.info("Restoring stored session for tenant {}", tenant);
            }
        } catch (UncheckedIOException e) {
            log.warn("Local credential cache unavailable for tenant {}: {}", tenant, e.getMessage());
        }

        ClientOptions options = newPairing ? ClientOptions.forNewPairing() : ClientOptions.forRestore();
        ProtocolClient client = clientFactory.create(tenant, stored, messageStore.lookupFor(tenant), options);
        SessionHandle handle = new SessionHandle(tenant, client, clock.instant(), newPairing, mediaSaver);

        if (!registry.register(handle)) {
            client.close();
            sink.respond(ConnectResult.inProgress());
            return;
        }

        try {
            bindListeners(handle);
        } catch (RuntimeException e) {
            closeSession(handle);
            throw e;
        }

        if (newPairing) {
            schedulePairingCode(handle, sink);
        } else {
            sink.respond(ConnectResult.reconnecting());
        }
    }

    private void bindListeners(SessionHandle handle) {
        TenantId tenant = handle.tenant();
        ClientEventBus events = handle.events();

        events.subscribe(new ClientEventListener() {
            @Override
            public void onMessagesUpsert(List<InboundMessage> messages) {
                messageStore.record(tenant, messages);
            }

            @Override
            public void onCredentialsUpdate(JsonNode credentials) {
                persistCredentials(tenant, credentials);
            }
        });
        events.subscribe(openHandler.listenerFor(handle));
        events.subscribe(reconnectionPolicy.listenerFor(handle, this::reconnect));
        events.subscribe(callGuard.listenerFor(handle));
        events.subscribe(antiDeleteGuard.listenerFor(handle));
        events.subscribe(dispatchPipeline.listenerFor(handle));
    }

    void persistCredentials(TenantId tenant, JsonNode credentials) {
        try {
            localCache.write(tenant, credentials);
        } catch (RuntimeException e) {
            log.warn("Failed to write local credentials for tenant {}: {}", tenant, e.getMessage());
        }
        try {
            credentialStore.saveCredential(tenant, credentials);
            log.debug("Session updated in store for tenant {}", tenant);
        } catch (RuntimeException e) {
            log.error("Failed to persist credentials for tenant {}; local cache stays current until the next write: {}",
                tenant, e.getMessage(), e);
        }
    }

    private void schedulePairingCode(SessionHandle handle, ConnectResultSink sink) {
        long delayMs = fleetProperties.getPairing().getCodeDelayMs();
        taskScheduler.schedule(() -> requestPairingCode(handle, sink), clock.instant().plusMillis(delayMs));
    }

    void requestPairingCode(SessionHandle handle, ConnectResultSink sink) {
        TenantId tenant = handle.tenant();
        if (registry.get(tenant).filter(current -> current == handle).isEmpty()) {
            log.warn("Session for tenant {} closed before the pairing code was requested", tenant);
            sink.respond(ConnectResult.pairingFailed("session closed before pairing"));
            return;
        }
        try {
            String code = handle.client().requestPairingCode(tenant.value());
            log.info("Pairing code issued for tenant {}", tenant);
            sink.respond(ConnectResult.newPairing(code));
        } catch (RuntimeException e) {
            log.error("Pairing error for tenant {}: {}", tenant, e.getMessage(), e);
            sink.respond(ConnectResult.pairingFailed(e.getMessage()));
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Closing {} session(s)", registry.size());
        for (SessionHandle handle : registry.handles()) {
            try {
                closeSession(handle);
            } catch (RuntimeException e) {
                log.warn("Failed to close session for tenant {}: {}", handle.tenant(), e.getMessage());
            }
        }
        messageStore.clear();
        try {
            localCache.purgeAll();
        } catch (RuntimeException e) {
            log.warn("Failed to purge local credential cache: {}", e.getMessage());
        }
    }
}

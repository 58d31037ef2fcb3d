package com.clapgrow.fleet.session.fleet;

import com.clapgrow.fleet.common.tenant.TenantId;
import com.clapgrow.fleet.session.config.FleetProperties;
import com.clapgrow.fleet.session.exception.SessionNotFoundException;
import com.clapgrow.fleet.session.exception.SessionOperationException;
import com.clapgrow.fleet.session.reconnect.ReconnectAttemptTracker;
import com.clapgrow.fleet.session.session.CompletableConnectSink;
import com.clapgrow.fleet.session.session.ConnectResult;
import com.clapgrow.fleet.session.session.LocalCredentialCache;
import com.clapgrow.fleet.session.session.SessionHandle;
import com.clapgrow.fleet.session.session.SessionRegistry;
import com.clapgrow.fleet.session.session.SessionStatus;
import com.clapgrow.fleet.session.session.SessionSupervisor;
import com.clapgrow.fleet.session.store.CredentialStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Operations over the whole fleet of sessions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FleetService {

    private final SessionSupervisor supervisor;
    private final SessionRegistry registry;
    private final CredentialStore credentialStore;
    private final LocalCredentialCache localCache;
    private final ReconnectAttemptTracker attemptTracker;
    private final FleetProperties fleetProperties;

    /**
     * On-demand connect of every known tenant.
     */
    public ConnectAllReport connectAll() {
        return connectAll(fleetProperties.getBulk().getSpacingMs());
    }

    /**
     * Connect every tenant of the roster that has no registered session, one at a time.
     * 
     * @param spacingMs Pause after each connect, to avoid a connection stampede
     */
    public ConnectAllReport connectAll(long spacingMs) {
        List<TenantId> roster = credentialStore.listTenants();
        log.info("Connecting {} known tenant(s)", roster.size());

        List<TenantConnectOutcome> outcomes = new ArrayList<>();
        int skipped = 0;
        for (TenantId tenant : roster) {
            if (registry.contains(tenant)) {
                skipped++;
                outcomes.add(new TenantConnectOutcome(tenant.value(), "already_active", "Session already registered"));
                continue;
            }

            CompletableConnectSink sink = new CompletableConnectSink();
            supervisor.connect(tenant, sink);
            ConnectResult result = sink.future().getNow(null);
            if (result == null) {
                outcomes.add(new TenantConnectOutcome(tenant.value(), "pairing_pending", "Waiting for pairing code"));
            } else {
                outcomes.add(new TenantConnectOutcome(tenant.value(), result.status().wireValue(), result.message()));
            }

            try {
                Thread.sleep(spacingMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Bulk connect interrupted after {} of {} tenant(s)", outcomes.size(), roster.size());
                break;
            }
        }
        log.info("Bulk connect finished: {} processed, {} already active", outcomes.size(), skipped);
        return new ConnectAllReport(roster.size(), skipped, outcomes);
    }

    /**
     * Close a tenant's session and erase its stored credentials and roster entry.
     * 
     * @throws SessionNotFoundException if no session is registered for the tenant
     * @throws SessionOperationException if the teardown fails
     */
    public void disconnect(TenantId tenant) {
        SessionHandle handle = registry.get(tenant)
            .orElseThrow(() -> new SessionNotFoundException(tenant));
        try {
            supervisor.closeSession(handle);
            attemptTracker.forget(tenant);
            credentialStore.deleteCredential(tenant);
            credentialStore.removeTenant(tenant);
            localCache.purge(tenant);
            log.info("Disconnected tenant {}", tenant);
        } catch (RuntimeException e) {
            throw new SessionOperationException("Failed to disconnect " + tenant + ": " + e.getMessage(), e);
        }
    }

    public SessionStatus status(TenantId tenant) {
        return registry.status(tenant);
    }

    /**
     * Status of every registered session, keyed by tenant id.
     */
    public Map<String, SessionStatus> statusAll() {
        Map<String, SessionStatus> statuses = new LinkedHashMap<>();
        registry.handles().stream()
            .map(SessionHandle::tenant)
            .sorted((a, b) -> a.value().compareTo(b.value()))
            .forEach(tenant -> statuses.put(tenant.value(), registry.status(tenant)));
        return statuses;
    }

    public Set<TenantId> listActive() {
        return registry.listActive();
    }
}

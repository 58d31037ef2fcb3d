package com.clapgrow.fleet.session.reconnect;

import com.clapgrow.fleet.common.protocol.event.ClientEventListener;
import com.clapgrow.fleet.common.protocol.event.ConnectionUpdate;
import com.clapgrow.fleet.common.retry.DisconnectClassification;
import com.clapgrow.fleet.common.retry.ReconnectPolicyResolver;
import com.clapgrow.fleet.common.retry.ReconnectPolicyResolver.ReconnectPolicy;
import com.clapgrow.fleet.common.tenant.TenantId;
import com.clapgrow.fleet.session.session.LocalCredentialCache;
import com.clapgrow.fleet.session.session.RecentMessageStore;
import com.clapgrow.fleet.session.session.SessionHandle;
import com.clapgrow.fleet.session.session.SessionRegistry;
import com.clapgrow.fleet.session.store.CredentialStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;

/**
 * Reacts to connection-state changes of one session.
 * 
 * <p>On open the tenant's attempt counter is reset. On close the disconnect is
 * classified and resolved to a policy:
 * <ul>
 *   <li>Purge: close the handle, erase credentials and roster entry, cancel any pending retry</li>
 *   <li>No retry: close the dead handle and keep credentials</li>
 *   <li>Fixed backoff: close the handle and schedule one reconnect while the budget allows</li>
 * </ul>
 */
@Component
@Slf4j
public class ReconnectionPolicy {

    private final DisconnectClassifier classifier;
    private final ReconnectPolicyResolver policyResolver;
    private final ReconnectAttemptTracker attemptTracker;
    private final SessionRegistry registry;
    private final CredentialStore credentialStore;
    private final LocalCredentialCache localCache;
    private final RecentMessageStore messageStore;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Counter reconnectCounter;

    public ReconnectionPolicy(DisconnectClassifier classifier,
                              ReconnectPolicyResolver policyResolver,
                              ReconnectAttemptTracker attemptTracker,
                              SessionRegistry registry,
                              CredentialStore credentialStore,
                              LocalCredentialCache localCache,
                              RecentMessageStore messageStore,
                              TaskScheduler taskScheduler,
                              Clock clock,
                              MeterRegistry meterRegistry) {
        this.classifier = classifier;
        this.policyResolver = policyResolver;
        this.attemptTracker = attemptTracker;
        this.registry = registry;
        this.credentialStore = credentialStore;
        this.localCache = localCache;
        this.messageStore = messageStore;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.reconnectCounter = Counter.builder("fleet.sessions.reconnects")
            .description("Automatic reconnect attempts scheduled")
            .register(meterRegistry);
    }

    /**
     * Listener bound to one handle.
     * 
     * @param handle Session the events belong to
     * @param reconnect Action that starts a fresh connect for a tenant
     */
    public ClientEventListener listenerFor(SessionHandle handle, Consumer<TenantId> reconnect) {
        return new ClientEventListener() {
            @Override
            public void onConnectionUpdate(ConnectionUpdate update) {
                handle(handle, update, reconnect);
            }
        };
    }

    void handle(SessionHandle handle, ConnectionUpdate update, Consumer<TenantId> reconnect) {
        TenantId tenant = handle.tenant();
        if (update.isOpen()) {
            attemptTracker.reset(tenant);
            log.info("Connection established for tenant {}; retry budget reset", tenant);
            return;
        }
        if (!update.isClose()) {
            return;
        }

        DisconnectClassification classification = classifier.classify(update);
        ReconnectPolicy policy = policyResolver.resolve(classification);
        log.warn("Connection closed for tenant {}: status={}, error={}, classification={}",
            tenant, update.statusCode(), update.errorMessage(), classification);

        if (policy.purgeCredentials()) {
            purge(handle);
            return;
        }

        if (!policy.shouldRetry()) {
            release(handle, true);
            log.info("Expected closure for tenant {}, no reconnect needed", tenant);
            return;
        }

        int attemptsSoFar = attemptTracker.attempts(tenant);
        if (!policy.allowsAttempt(attemptsSoFar)) {
            release(handle, true);
            log.error("Max reconnect attempts ({}) reached for tenant {}. Manual intervention required.",
                policy.maxAttempts(), tenant);
            return;
        }

        // Recent messages stay for the retried session
        release(handle, false);
        if (!attemptTracker.markRetryPending(tenant)) {
            log.info("Reconnect already scheduled for tenant {}", tenant);
            return;
        }

        int attempt = attemptTracker.increment(tenant);
        reconnectCounter.increment();
        log.warn("Reconnecting tenant {} ({}/{}) in {} ms", tenant, attempt, policy.maxAttempts(), policy.backoffMs());
        ScheduledFuture<?> retry = taskScheduler.schedule(() -> {
            if (!attemptTracker.claimRetry(tenant)) {
                log.info("Reconnect for tenant {} cancelled, tenant was disconnected meanwhile", tenant);
                return;
            }
            try {
                reconnect.accept(tenant);
                log.info("Reconnection initiated for tenant {}", tenant);
            } catch (RuntimeException e) {
                log.error("Reconnection failed for tenant {}: {}", tenant, e.getMessage(), e);
            }
        }, clock.instant().plusMillis(policy.backoffMs()));
        attemptTracker.retryScheduled(tenant, retry);
    }

    /**
     * Unregister a dead handle, detach its listeners and close its transport.
     */
    private void release(SessionHandle handle, boolean forgetMessages) {
        registry.unregister(handle);
        try {
            handle.shutdown();
        } catch (RuntimeException e) {
            log.warn("Failed to close transport for tenant {}: {}", handle.tenant(), e.getMessage());
        }
        if (forgetMessages) {
            messageStore.forget(handle.tenant());
        }
    }

    private void purge(SessionHandle handle) {
        TenantId tenant = handle.tenant();
        log.warn("Manual unlink detected for tenant {}, cleaning up", tenant);
        release(handle, true);
        attemptTracker.forget(tenant);
        try {
            credentialStore.deleteCredential(tenant);
            credentialStore.removeTenant(tenant);
        } catch (RuntimeException e) {
            log.error("Failed to erase stored state for unlinked tenant {}: {}", tenant, e.getMessage(), e);
        }
        try {
            localCache.purge(tenant);
        } catch (RuntimeException e) {
            log.warn("Failed to purge local credentials for tenant {}: {}", tenant, e.getMessage());
        }
    }
}

package com.clapgrow.fleet.session.reconnect;

import com.clapgrow.fleet.common.tenant.TenantId;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-tenant reconnect attempt counters and pending retries.
 * Counters live per tenant, not per handle, so they survive the handle being replaced by a retry.
 */
@Component
public class ReconnectAttemptTracker {

    private final ConcurrentHashMap<TenantId, AtomicInteger> attempts = new ConcurrentHashMap<>();
    private final Set<TenantId> pendingRetries = ConcurrentHashMap.newKeySet();
    private final ConcurrentHashMap<TenantId, ScheduledFuture<?>> scheduledRetries = new ConcurrentHashMap<>();

    public int attempts(TenantId tenant) {
        AtomicInteger counter = attempts.get(tenant);
        return counter == null ? 0 : counter.get();
    }

    public int increment(TenantId tenant) {
        return attempts.computeIfAbsent(tenant, t -> new AtomicInteger()).incrementAndGet();
    }

    public void reset(TenantId tenant) {
        attempts.remove(tenant);
    }

    /**
     * @return false if a retry is already scheduled for the tenant
     */
    public boolean markRetryPending(TenantId tenant) {
        return pendingRetries.add(tenant);
    }

    /**
     * Remember the scheduled retry so {@link #forget} can cancel it.
     */
    public void retryScheduled(TenantId tenant, ScheduledFuture<?> future) {
        if (future != null && pendingRetries.contains(tenant)) {
            scheduledRetries.put(tenant, future);
        }
    }

    /**
     * Called by the retry task when it fires.
     *
     * @return false if the tenant was forgotten after the retry was scheduled, in which case it must not run
     */
    public boolean claimRetry(TenantId tenant) {
        scheduledRetries.remove(tenant);
        return pendingRetries.remove(tenant);
    }

    /**
     * Drop all state of the tenant and cancel its scheduled retry, if any.
     */
    public void forget(TenantId tenant) {
        attempts.remove(tenant);
        pendingRetries.remove(tenant);
        ScheduledFuture<?> scheduled = scheduledRetries.remove(tenant);
        if (scheduled != null) {
            scheduled.cancel(false);
        }
    }
}

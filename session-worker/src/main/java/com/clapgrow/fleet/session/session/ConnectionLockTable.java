package com.clapgrow.fleet.session.session;

import com.clapgrow.fleet.common.tenant.TenantId;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-tenant flag held for the duration of one connect attempt.
 * 
 * <p>Acquisition hands out a {@link ConnectionLock} guard meant for
 * try-with-resources; closing it releases the flag exactly once no matter
 * how many times it is closed.
 * 
 * Example usage:
 * <pre>
 * Optional&lt;ConnectionLock&gt; acquired = locks.tryAcquire(tenant);
 * if (acquired.isEmpty()) {
 *     return inProgress();
 * }
 * try (ConnectionLock lock = acquired.get()) {
 *     ...
 * }
 * </pre>
 */
@Component
public class ConnectionLockTable {

    private final ConcurrentHashMap<TenantId, ConnectionLock> held = new ConcurrentHashMap<>();
    private final AtomicLong acquisitions = new AtomicLong();
    private final AtomicLong releases = new AtomicLong();

    /**
     * @return the guard, or empty if a connect attempt for the tenant already holds it
     */
    public Optional<ConnectionLock> tryAcquire(TenantId tenant) {
        ConnectionLock lock = new ConnectionLock(tenant);
        if (held.putIfAbsent(tenant, lock) != null) {
            return Optional.empty();
        }
        acquisitions.incrementAndGet();
        return Optional.of(lock);
    }

    public boolean isHeld(TenantId tenant) {
        return held.containsKey(tenant);
    }

    public long acquisitions() {
        return acquisitions.get();
    }

    public long releases() {
        return releases.get();
    }

    void release(ConnectionLock lock) {
        if (held.remove(lock.tenant(), lock)) {
            releases.incrementAndGet();
        }
    }

    /**
     * Scoped hold on one tenant's connection flag.
     */
    public final class ConnectionLock implements AutoCloseable {

        private final TenantId tenant;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private ConnectionLock(TenantId tenant) {
            this.tenant = tenant;
        }

        public TenantId tenant() {
            return tenant;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                release(this);
            }
        }
    }
}

package com.clapgrow.fleet.session.session;

import com.clapgrow.fleet.common.tenant.TenantId;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory map from tenant to its live session handle.
 * 
 * <p>Rules:
 * <ul>
 *   <li>At most one handle per tenant; {@link #register} never replaces an existing one</li>
 *   <li>A handle is registered from client creation until teardown; it counts as
 *       connected only once its transport is open</li>
 *   <li>No I/O, never blocks</li>
 * </ul>
 */
@Component
@Slf4j
public class SessionRegistry {

    private final ConcurrentHashMap<TenantId, SessionHandle> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public SessionRegistry(Clock clock, MeterRegistry meterRegistry) {
        this.clock = clock;
        Gauge.builder("fleet.sessions.active", sessions, map -> map.values().stream().filter(SessionHandle::isOpen).count())
            .description("Sessions with an open transport")
            .register(meterRegistry);
    }

    /**
     * @return false if another handle is already registered for the tenant
     */
    public boolean register(SessionHandle handle) {
        SessionHandle existing = sessions.putIfAbsent(handle.tenant(), handle);
        if (existing != null) {
            log.warn("Refusing to register a second session for tenant {}", handle.tenant());
            return false;
        }
        log.info("Registered session for tenant {} ({})", handle.tenant(), handle.phase());
        return true;
    }

    public Optional<SessionHandle> get(TenantId tenant) {
        return Optional.ofNullable(sessions.get(tenant));
    }

    public boolean contains(TenantId tenant) {
        return sessions.containsKey(tenant);
    }

    public boolean isConnected(TenantId tenant) {
        SessionHandle handle = sessions.get(tenant);
        return handle != null && handle.isOpen();
    }

    public SessionStatus status(TenantId tenant) {
        SessionHandle handle = sessions.get(tenant);
        if (handle == null) {
            return SessionStatus.disconnected();
        }
        long uptime = Duration.between(handle.createdAt(), clock.instant()).toSeconds();
        return new SessionStatus(handle.isOpen(), handle.createdAt(), Math.max(0, uptime));
    }

    public Optional<SessionHandle> unregister(TenantId tenant) {
        SessionHandle removed = sessions.remove(tenant);
        if (removed != null) {
            log.info("Unregistered session for tenant {}", tenant);
        }
        return Optional.ofNullable(removed);
    }

    /**
     * Unregister only if the given handle is still the registered one, so a stale
     * handle cannot evict its replacement.
     */
    public boolean unregister(SessionHandle handle) {
        boolean removed = sessions.remove(handle.tenant(), handle);
        if (removed) {
            log.info("Unregistered session for tenant {}", handle.tenant());
        }
        return removed;
    }

    /**
     * Tenants whose transport is open, in id order.
     */
    public Set<TenantId> listActive() {
        return sessions.values().stream()
            .filter(SessionHandle::isOpen)
            .map(SessionHandle::tenant)
            .collect(Collectors.toCollection(() -> new TreeSet<>(
                Comparator.comparing(TenantId::value))));
    }

    public Collection<SessionHandle> handles() {
        return List.copyOf(sessions.values());
    }

    public int size() {
        return sessions.size();
    }
}

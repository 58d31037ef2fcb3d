package com.clapgrow.fleet.session.fleet;

import com.clapgrow.fleet.common.protocol.ProtocolClient;
import com.clapgrow.fleet.common.protocol.event.ClientEventBus;
import com.clapgrow.fleet.common.tenant.TenantId;
import com.clapgrow.fleet.session.config.FleetProperties;
import com.clapgrow.fleet.session.exception.SessionNotFoundException;
import com.clapgrow.fleet.session.exception.SessionOperationException;
import com.clapgrow.fleet.session.reconnect.ReconnectAttemptTracker;
import com.clapgrow.fleet.session.session.ConnectResult;
import com.clapgrow.fleet.session.session.ConnectResultSink;
import com.clapgrow.fleet.session.session.LocalCredentialCache;
import com.clapgrow.fleet.session.session.SessionHandle;
import com.clapgrow.fleet.session.session.SessionRegistry;
import com.clapgrow.fleet.session.session.SessionStatus;
import com.clapgrow.fleet.session.session.SessionSupervisor;
import com.clapgrow.fleet.session.store.CredentialStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class FleetServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    @Mock
    private SessionSupervisor supervisor;
    @Mock
    private CredentialStore credentialStore;
    @Mock
    private LocalCredentialCache localCache;

    private SessionRegistry registry;
    private ReconnectAttemptTracker attemptTracker;
    private FleetService fleetService;

    @BeforeEach
    void setUp() {
        registry = new SessionRegistry(Clock.fixed(NOW, ZoneOffset.UTC), new SimpleMeterRegistry());
        attemptTracker = new ReconnectAttemptTracker();
        fleetService = new FleetService(supervisor, registry, credentialStore, localCache,
            attemptTracker, new FleetProperties());
        doAnswer(invocation -> {
            registry.unregister((SessionHandle) invocation.getArgument(0));
            return null;
        }).when(supervisor).closeSession(any());
    }

    private SessionHandle register(String number, boolean open) {
        ProtocolClient client = mock(ProtocolClient.class);
        when(client.events()).thenReturn(new ClientEventBus(number));
        SessionHandle handle = new SessionHandle(TenantId.of(number), client, NOW, false, null);
        if (open) {
            handle.markOpen(NOW);
        }
        registry.register(handle);
        return handle;
    }

    @Test
    void testDisconnect_UnknownTenant_ThrowsNotFound() {
        assertThrows(SessionNotFoundException.class, () -> fleetService.disconnect(TenantId.of("254700000009")));

        verify(credentialStore, never()).deleteCredential(any());
    }

    @Test
    void testDisconnect_ErasesStateAndSecondCallIsNotFound() {
        TenantId tenant = TenantId.of("254700000001");
        SessionHandle handle = register(tenant.value(), true);
        attemptTracker.increment(tenant);

        fleetService.disconnect(tenant);

        verify(supervisor).closeSession(handle);
        verify(credentialStore).deleteCredential(tenant);
        verify(credentialStore).removeTenant(tenant);
        verify(localCache).purge(tenant);
        assertEquals(0, attemptTracker.attempts(tenant));
        assertFalse(registry.contains(tenant));
        assertThrows(SessionNotFoundException.class, () -> fleetService.disconnect(tenant));
    }

    @Test
    void testDisconnect_StoreFailure_RaisesOperationError() {
        TenantId tenant = TenantId.of("254700000001");
        register(tenant.value(), true);
        doThrow(new IllegalStateException("db down")).when(credentialStore).deleteCredential(tenant);

        SessionOperationException error = assertThrows(SessionOperationException.class,
            () -> fleetService.disconnect(tenant));

        assertTrue(error.getMessage().contains("db down"));
    }

    @Test
    void testConnectAll_SkipsRegisteredAndReportsOutcomes() {
        TenantId active = TenantId.of("100");
        TenantId restored = TenantId.of("200");
        TenantId pairing = TenantId.of("300");
        register(active.value(), true);
        when(credentialStore.listTenants()).thenReturn(List.of(active, restored, pairing));
        doAnswer(invocation -> {
            ((ConnectResultSink) invocation.getArgument(1)).respond(ConnectResult.reconnecting());
            return null;
        }).when(supervisor).connect(eq(restored), any());

        ConnectAllReport report = fleetService.connectAll(0);

        assertEquals(3, report.total());
        assertEquals(1, report.skipped());
        assertEquals(List.of("already_active", "reconnecting", "pairing_pending"),
            report.outcomes().stream().map(TenantConnectOutcome::status).toList());
        verify(supervisor, never()).connect(eq(active), any());
        verify(supervisor).connect(eq(pairing), any());
    }

    @Test
    void testConnectAll_EmptyRoster() {
        when(credentialStore.listTenants()).thenReturn(List.of());

        ConnectAllReport report = fleetService.connectAll(0);

        assertTrue(report.isEmpty());
        verifyNoInteractions(supervisor);
    }

    @Test
    void testStatusAll_SortedByTenant() {
        register("300", true);
        register("100", false);

        Map<String, SessionStatus> statuses = fleetService.statusAll();

        assertEquals(List.of("100", "300"), List.copyOf(statuses.keySet()));
        assertFalse(statuses.get("100").connected());
        assertTrue(statuses.get("300").connected());
        assertEquals(1, fleetService.listActive().size());
    }
}

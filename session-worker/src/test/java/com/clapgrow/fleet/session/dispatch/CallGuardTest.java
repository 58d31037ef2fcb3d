package com.clapgrow.fleet.session.dispatch;

import com.clapgrow.fleet.common.protocol.OutgoingMessage;
import com.clapgrow.fleet.common.protocol.ProtocolClient;
import com.clapgrow.fleet.common.protocol.ProtocolClientException;
import com.clapgrow.fleet.common.protocol.event.CallOffer;
import com.clapgrow.fleet.common.tenant.TenantId;
import com.clapgrow.fleet.session.config.TenantConfigDefaults;
import com.clapgrow.fleet.session.session.SessionHandle;
import com.clapgrow.fleet.session.store.CredentialStore;
import com.clapgrow.fleet.session.store.TenantConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CallGuardTest {

    private static final String CALLER = "254766000000@s.whatsapp.net";

    @Mock
    private CredentialStore credentialStore;

    @Mock
    private ProtocolClient client;

    @InjectMocks
    private CallGuard callGuard;

    private SessionHandle handle;
    private TenantConfigDefaults defaults;
    private final TenantId tenant = TenantId.of("254700000001");

    @BeforeEach
    void setUp() {
        handle = new SessionHandle(tenant, client, Instant.EPOCH, false, null);
        defaults = new TenantConfigDefaults();
    }

    @Test
    void testAntiCallOn_RejectsOffersAndExplains() {
        defaults.setAntiCall(true);
        when(credentialStore.getConfig(tenant)).thenReturn(TenantConfig.defaults(defaults));

        callGuard.handleCalls(handle, List.of(
            new CallOffer("c1", CALLER, "offer"),
            new CallOffer("c2", CALLER, "ringing")));

        verify(client).rejectCall("c1", CALLER);
        verify(client, never()).rejectCall(eq("c2"), any());
        verify(client).sendMessage(eq(CALLER), argThat((OutgoingMessage m) -> defaults.getRejectMessage().equals(m.text())));
    }

    @Test
    void testAntiCallOff_LeavesCallsAlone() {
        when(credentialStore.getConfig(tenant)).thenReturn(TenantConfig.defaults(defaults));

        callGuard.handleCalls(handle, List.of(new CallOffer("c1", CALLER, "offer")));

        verifyNoInteractions(client);
    }

    @Test
    void testConfigUnavailable_LeavesCallsAlone() {
        when(credentialStore.getConfig(tenant)).thenThrow(new IllegalStateException("db down"));

        assertDoesNotThrow(() -> callGuard.handleCalls(handle, List.of(new CallOffer("c1", CALLER, "offer"))));

        verifyNoInteractions(client);
    }

    @Test
    void testRejectFailure_ContinuesWithNextCall() {
        defaults.setAntiCall(true);
        when(credentialStore.getConfig(tenant)).thenReturn(TenantConfig.defaults(defaults));
        doThrow(new ProtocolClientException("gone")).when(client).rejectCall(eq("c1"), any());

        callGuard.handleCalls(handle, List.of(
            new CallOffer("c1", CALLER, "offer"),
            new CallOffer("c2", CALLER, "offer")));

        verify(client).rejectCall("c2", CALLER);
    }
}

package com.clapgrow.fleet.session.store;

import com.clapgrow.fleet.common.tenant.TenantId;
import com.clapgrow.fleet.session.config.FleetProperties;
import com.clapgrow.fleet.session.config.TenantConfigDefaults;
import com.clapgrow.fleet.session.entity.KnownTenant;
import com.clapgrow.fleet.session.entity.PendingOtp;
import com.clapgrow.fleet.session.entity.TenantCredential;
import com.clapgrow.fleet.session.entity.TenantSettings;
import com.clapgrow.fleet.session.entity.TenantStats;
import com.clapgrow.fleet.session.repository.KnownTenantRepository;
import com.clapgrow.fleet.session.repository.PendingOtpRepository;
import com.clapgrow.fleet.session.repository.TenantCredentialRepository;
import com.clapgrow.fleet.session.repository.TenantSettingsRepository;
import com.clapgrow.fleet.session.repository.TenantStatsRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class JpaCredentialStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    @Mock
    private TenantCredentialRepository credentialRepository;
    @Mock
    private KnownTenantRepository knownTenantRepository;
    @Mock
    private TenantSettingsRepository settingsRepository;
    @Mock
    private PendingOtpRepository pendingOtpRepository;
    @Mock
    private TenantStatsRepository statsRepository;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private JpaCredentialStore store;
    private final TenantId tenant = TenantId.of("254700000001");

    @BeforeEach
    void setUp() {
        store = new JpaCredentialStore(credentialRepository, knownTenantRepository, settingsRepository,
            pendingOtpRepository, statsRepository, new TenantConfigDefaults(), new FleetProperties(),
            objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private PendingOtp pending(String code, Instant expiresAt) {
        return new PendingOtp(tenant.value(), code, "{\"ANTI_CALL\":true}", expiresAt, 0);
    }

    @Test
    void testSaveCredential_UpdatesExistingRow() {
        TenantCredential existing = new TenantCredential(tenant.value(), "{}");
        when(credentialRepository.findById(tenant.value())).thenReturn(Optional.of(existing));

        store.saveCredential(tenant, objectMapper.createObjectNode().put("me", "x"));

        verify(credentialRepository).save(existing);
        assertEquals("{\"me\":\"x\"}", existing.getCredsJson());
    }

    @Test
    void testGetCredential_CorruptRow_FailsLoudly() {
        when(credentialRepository.findById(tenant.value()))
            .thenReturn(Optional.of(new TenantCredential(tenant.value(), "{broken")));

        assertThrows(IllegalStateException.class, () -> store.getCredential(tenant));
    }

    @Test
    void testGetConfig_MergesOverridesOverDefaults() {
        when(settingsRepository.findById(tenant.value()))
            .thenReturn(Optional.of(new TenantSettings(tenant.value(), "{\"ANTI_CALL\":\"true\",\"READ_MESSAGE\":1}")));

        TenantConfig config = store.getConfig(tenant);

        assertTrue(config.antiCall());
        assertFalse(config.readMessage());
        assertTrue(config.autoViewStatus());
    }

    @Test
    void testUpdateConfig_MergesDeltaIntoStoredObject() {
        TenantSettings settings = new TenantSettings(tenant.value(), "{\"AUTO_TYPING\":true}");
        when(settingsRepository.findById(tenant.value())).thenReturn(Optional.of(settings));

        store.updateConfig(tenant, objectMapper.createObjectNode().put("ANTI_CALL", true));

        assertEquals("{\"AUTO_TYPING\":true,\"ANTI_CALL\":true}", settings.getConfigJson());
        verify(settingsRepository).save(settings);
    }

    @Test
    void testAddTenant_IsIdempotent() {
        when(knownTenantRepository.existsById(tenant.value())).thenReturn(false, true);

        store.addTenant(tenant);
        store.addTenant(tenant);

        verify(knownTenantRepository, times(1)).save(any(KnownTenant.class));
    }

    @Test
    void testListTenants_InInsertionOrder() {
        when(knownTenantRepository.findAllByOrderByCreatedAtAsc())
            .thenReturn(List.of(new KnownTenant("300"), new KnownTenant("100")));

        assertEquals(List.of(TenantId.of("300"), TenantId.of("100")), store.listTenants());
    }

    @Test
    void testSaveOtp_ExpiresAfterValidityWindow() {
        when(pendingOtpRepository.findById(tenant.value())).thenReturn(Optional.empty());

        store.saveOtp(tenant, "123456", objectMapper.createObjectNode().put("ANTI_CALL", true));

        ArgumentCaptor<PendingOtp> saved = ArgumentCaptor.forClass(PendingOtp.class);
        verify(pendingOtpRepository).save(saved.capture());
        assertEquals("123456", saved.getValue().getCode());
        assertEquals(NOW.plusSeconds(300), saved.getValue().getExpiresAt());
    }

    @Test
    void testVerifyOtp_Unknown() {
        when(pendingOtpRepository.findForUpdate(tenant.value())).thenReturn(Optional.empty());

        OtpVerification result = store.verifyOtp(tenant, "123456");

        assertFalse(result.valid());
        assertEquals("No OTP request found for this number", result.error());
    }

    @Test
    void testVerifyOtp_Expired_DeletesCode() {
        PendingOtp otp = pending("123456", NOW);
        when(pendingOtpRepository.findForUpdate(tenant.value())).thenReturn(Optional.of(otp));

        OtpVerification result = store.verifyOtp(tenant, "123456");

        assertEquals("OTP has expired", result.error());
        verify(pendingOtpRepository).delete(otp);
    }

    @Test
    void testVerifyOtp_Mismatch_KeepsCodeAndCountsFailure() {
        PendingOtp otp = pending("123456", NOW.plusSeconds(60));
        when(pendingOtpRepository.findForUpdate(tenant.value())).thenReturn(Optional.of(otp));

        OtpVerification result = store.verifyOtp(tenant, "654321");

        assertEquals("Invalid OTP", result.error());
        assertEquals(1, otp.getFailedAttempts());
        verify(pendingOtpRepository).save(otp);
        verify(pendingOtpRepository, never()).delete(any());
    }

    @Test
    void testVerifyOtp_FifthMismatch_DiscardsCode() {
        PendingOtp otp = pending("123456", NOW.plusSeconds(60));
        when(pendingOtpRepository.findForUpdate(tenant.value())).thenReturn(Optional.of(otp));

        for (int i = 0; i < 4; i++) {
            assertEquals("Invalid OTP", store.verifyOtp(tenant, "000000").error());
        }
        OtpVerification last = store.verifyOtp(tenant, "000000");

        assertFalse(last.valid());
        assertEquals("Too many failed attempts. Request a new OTP", last.error());
        verify(pendingOtpRepository).delete(otp);
    }

    @Test
    void testSaveOtp_ReplacingCodeResetsFailures() {
        PendingOtp previous = pending("111111", NOW.plusSeconds(60));
        previous.setFailedAttempts(3);
        when(pendingOtpRepository.findById(tenant.value())).thenReturn(Optional.of(previous));

        store.saveOtp(tenant, "222222", objectMapper.createObjectNode());

        assertEquals(0, previous.getFailedAttempts());
        assertEquals("222222", previous.getCode());
    }

    @Test
    void testVerifyOtp_Match_ConsumesCodeAndReturnsDelta() {
        PendingOtp otp = pending("123456", NOW.plusSeconds(60));
        when(pendingOtpRepository.findForUpdate(tenant.value())).thenReturn(Optional.of(otp));

        OtpVerification result = store.verifyOtp(tenant, " 123456 ");

        assertTrue(result.valid());
        ObjectNode delta = result.delta();
        assertTrue(delta.get("ANTI_CALL").booleanValue());
        verify(pendingOtpRepository).delete(otp);
    }

    @Test
    void testIncrementStat_InsertsRowOnFirstUse() {
        when(statsRepository.incrementMessagesReceived(tenant.value(), NOW)).thenReturn(0);

        store.incrementStat(tenant, StatCounter.MESSAGES_RECEIVED);

        ArgumentCaptor<TenantStats> saved = ArgumentCaptor.forClass(TenantStats.class);
        verify(statsRepository).save(saved.capture());
        assertEquals(1, saved.getValue().getMessagesReceived());
        assertEquals(0, saved.getValue().getCommandsUsed());
        assertEquals(NOW, saved.getValue().getLastActiveAt());
    }

    @Test
    void testIncrementStat_UpdatesExistingRow() {
        when(statsRepository.incrementCommandsUsed(tenant.value(), NOW)).thenReturn(1);

        store.incrementStat(tenant, StatCounter.COMMANDS_USED);

        verify(statsRepository, never()).save(any());
    }

    @Test
    void testGetStats_UnknownTenant_IsZero() {
        when(statsRepository.findById(tenant.value())).thenReturn(Optional.empty());

        StatsSnapshot stats = store.getStats(tenant);

        assertEquals(0, stats.commandsUsed());
        assertNull(stats.lastActiveAt());
    }

    @Test
    void testDeleteCredential_MissingRowIsNoOp() {
        when(credentialRepository.existsById(tenant.value())).thenReturn(false);

        store.deleteCredential(tenant);

        verify(credentialRepository, never()).deleteById(any());
    }
}

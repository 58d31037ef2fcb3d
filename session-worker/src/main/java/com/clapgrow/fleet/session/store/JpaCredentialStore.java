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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class JpaCredentialStore implements CredentialStore {

    private final TenantCredentialRepository credentialRepository;
    private final KnownTenantRepository knownTenantRepository;
    private final TenantSettingsRepository settingsRepository;
    private final PendingOtpRepository pendingOtpRepository;
    private final TenantStatsRepository statsRepository;
    private final TenantConfigDefaults configDefaults;
    private final FleetProperties fleetProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<JsonNode> getCredential(TenantId tenant) {
        return credentialRepository.findById(tenant.value())
            .map(credential -> readJson(credential.getCredsJson(), "credentials", tenant));
    }

    @Override
    @Transactional
    public void saveCredential(TenantId tenant, JsonNode credentials) {
        String json = writeJson(credentials);
        TenantCredential credential = credentialRepository.findById(tenant.value())
            .orElseGet(() -> new TenantCredential(tenant.value(), json));
        credential.setCredsJson(json);
        credentialRepository.save(credential);
        log.debug("Saved credentials for tenant {}", tenant);
    }

    @Override
    @Transactional
    public void deleteCredential(TenantId tenant) {
        if (credentialRepository.existsById(tenant.value())) {
            credentialRepository.deleteById(tenant.value());
            log.info("Deleted credentials for tenant {}", tenant);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public TenantConfig getConfig(TenantId tenant) {
        JsonNode overrides = settingsRepository.findById(tenant.value())
            .map(settings -> readJson(settings.getConfigJson(), "config", tenant))
            .orElse(null);
        return TenantConfig.merge(configDefaults, overrides);
    }

    @Override
    @Transactional
    public void updateConfig(TenantId tenant, ObjectNode delta) {
        TenantSettings settings = settingsRepository.findById(tenant.value())
            .orElseGet(() -> new TenantSettings(tenant.value(), "{}"));
        JsonNode current = readJson(settings.getConfigJson(), "config", tenant);
        ObjectNode merged = current.isObject() ? (ObjectNode) current : objectMapper.createObjectNode();
        merged.setAll(delta);
        settings.setConfigJson(writeJson(merged));
        settingsRepository.save(settings);
        log.info("Updated config for tenant {}: {} key(s) changed", tenant, delta.size());
    }

    @Override
    @Transactional
    public void addTenant(TenantId tenant) {
        if (!knownTenantRepository.existsById(tenant.value())) {
            knownTenantRepository.save(new KnownTenant(tenant.value()));
            log.info("Added tenant {} to roster", tenant);
        }
    }

    @Override
    @Transactional
    public void removeTenant(TenantId tenant) {
        if (knownTenantRepository.existsById(tenant.value())) {
            knownTenantRepository.deleteById(tenant.value());
            log.info("Removed tenant {} from roster", tenant);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<TenantId> listTenants() {
        return knownTenantRepository.findAllByOrderByCreatedAtAsc().stream()
            .map(known -> new TenantId(known.getTenantId()))
            .toList();
    }

    @Override
    @Transactional
    public void saveOtp(TenantId tenant, String code, ObjectNode delta) {
        Instant expiresAt = clock.instant().plus(Duration.ofMinutes(fleetProperties.getOtp().getValidityMinutes()));
        PendingOtp otp = pendingOtpRepository.findById(tenant.value())
            .orElseGet(PendingOtp::new);
        otp.setTenantId(tenant.value());
        otp.setCode(code);
        otp.setConfigDeltaJson(writeJson(delta));
        otp.setExpiresAt(expiresAt);
        otp.setFailedAttempts(0);
        pendingOtpRepository.save(otp);
        log.info("Stored pending OTP for tenant {} (expires at {})", tenant, expiresAt);
    }

    @Override
    @Transactional
    public OtpVerification verifyOtp(TenantId tenant, String code) {
        Optional<PendingOtp> pending = pendingOtpRepository.findForUpdate(tenant.value());
        if (pending.isEmpty()) {
            return OtpVerification.rejected("No OTP request found for this number");
        }
        PendingOtp otp = pending.get();
        if (!clock.instant().isBefore(otp.getExpiresAt())) {
            pendingOtpRepository.delete(otp);
            log.info("Pending OTP for tenant {} expired", tenant);
            return OtpVerification.rejected("OTP has expired");
        }
        if (code == null || !constantTimeEquals(otp.getCode(), code.trim())) {
            int failures = otp.getFailedAttempts() + 1;
            if (failures >= fleetProperties.getOtp().getMaxAttempts()) {
                pendingOtpRepository.delete(otp);
                log.warn("OTP for tenant {} discarded after {} failed attempts", tenant, failures);
                return OtpVerification.rejected("Too many failed attempts. Request a new OTP");
            }
            otp.setFailedAttempts(failures);
            pendingOtpRepository.save(otp);
            log.warn("OTP mismatch for tenant {} ({} failed attempt(s))", tenant, failures);
            return OtpVerification.rejected("Invalid OTP");
        }
        pendingOtpRepository.delete(otp);
        JsonNode delta = readJson(otp.getConfigDeltaJson(), "otp delta", tenant);
        return OtpVerification.accepted(delta.isObject() ? (ObjectNode) delta : objectMapper.createObjectNode());
    }

    @Override
    @Transactional
    public void incrementStat(TenantId tenant, StatCounter counter) {
        Instant now = clock.instant();
        int updated = switch (counter) {
            case COMMANDS_USED -> statsRepository.incrementCommandsUsed(tenant.value(), now);
            case MESSAGES_RECEIVED -> statsRepository.incrementMessagesReceived(tenant.value(), now);
            case GROUPS_INTERACTED -> statsRepository.incrementGroupsInteracted(tenant.value(), now);
        };
        if (updated == 0) {
            TenantStats stats = new TenantStats(tenant.value());
            switch (counter) {
                case COMMANDS_USED -> stats.setCommandsUsed(1);
                case MESSAGES_RECEIVED -> stats.setMessagesReceived(1);
                case GROUPS_INTERACTED -> stats.setGroupsInteracted(1);
            }
            stats.setLastActiveAt(now);
            statsRepository.save(stats);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public StatsSnapshot getStats(TenantId tenant) {
        return statsRepository.findById(tenant.value())
            .map(stats -> new StatsSnapshot(
                stats.getTenantId(),
                stats.getCommandsUsed(),
                stats.getMessagesReceived(),
                stats.getGroupsInteracted(),
                stats.getLastActiveAt()))
            .orElseGet(() -> StatsSnapshot.empty(tenant.value()));
    }

    private static boolean constantTimeEquals(String expected, String actual) {
        return MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.UTF_8),
            actual.getBytes(StandardCharsets.UTF_8));
    }

    private JsonNode readJson(String json, String what, TenantId tenant) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored " + what + " for tenant " + tenant + " is not valid JSON", e);
        }
    }

    private String writeJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize JSON: " + e.getMessage(), e);
        }
    }
}

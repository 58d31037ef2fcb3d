package com.clapgrow.fleet.session.otp;

import com.clapgrow.fleet.common.protocol.OutgoingMessage;
import com.clapgrow.fleet.common.tenant.TenantId;
import com.clapgrow.fleet.session.config.FleetProperties;
import com.clapgrow.fleet.session.exception.BadRequestException;
import com.clapgrow.fleet.session.exception.OtpVerificationException;
import com.clapgrow.fleet.session.exception.SessionNotFoundException;
import com.clapgrow.fleet.session.exception.SessionOperationException;
import com.clapgrow.fleet.session.session.SessionHandle;
import com.clapgrow.fleet.session.session.SessionRegistry;
import com.clapgrow.fleet.session.store.CredentialStore;
import com.clapgrow.fleet.session.store.OtpVerification;
import com.clapgrow.fleet.session.store.TenantConfigKey;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Iterator;
import java.util.Map;

/**
 * OTP-gated update of a tenant's automation settings.
 * 
 * <p>Flow:
 * <ol>
 *   <li>{@link #requestUpdate}: validate the proposed delta, store it with a fresh
 *       six-digit code and send the code to the tenant's own chat</li>
 *   <li>{@link #verify}: consume the code and apply the delta in one transaction</li>
 * </ol>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConfigUpdateService {

    private final SessionRegistry registry;
    private final CredentialStore credentialStore;
    private final OtpGenerator otpGenerator;
    private final FleetProperties fleetProperties;
    private final ObjectMapper objectMapper;

    /**
     * @param tenant Tenant whose configuration changes; must have an open session
     * @param configJson Proposed delta as a JSON object keyed by setting name
     * @throws SessionNotFoundException if the tenant has no open session
     * @throws BadRequestException if the delta is malformed
     * @throws SessionOperationException if the code cannot be delivered
     */
    public void requestUpdate(TenantId tenant, String configJson) {
        ObjectNode delta = parseDelta(configJson);
        SessionHandle handle = registry.get(tenant)
            .filter(SessionHandle::isOpen)
            .orElseThrow(() -> new SessionNotFoundException("No active session found for this number"));

        String code = otpGenerator.generate();
        credentialStore.saveOtp(tenant, code, delta);

        try {
            handle.client().sendMessage(handle.selfJid(), OutgoingMessage.text(otpText(code)));
        } catch (RuntimeException e) {
            log.error("Failed to send OTP to tenant {}: {}", tenant, e.getMessage(), e);
            throw new SessionOperationException("Failed to send OTP", e);
        }
        log.info("OTP sent to tenant {}", tenant);
    }

    /**
     * @throws OtpVerificationException if the code is unknown, expired or wrong
     */
    @Transactional(noRollbackFor = OtpVerificationException.class)
    public void verify(TenantId tenant, String code) {
        OtpVerification verification = credentialStore.verifyOtp(tenant, code);
        if (!verification.valid()) {
            throw new OtpVerificationException(verification.error());
        }
        credentialStore.updateConfig(tenant, verification.delta());
        log.info("Config updated for tenant {}", tenant);

        registry.get(tenant).filter(SessionHandle::isOpen).ifPresent(handle -> {
            try {
                handle.client().sendMessage(handle.selfJid(), OutgoingMessage.text(
                    "*CONFIG UPDATED*\n\nYour configuration has been successfully updated!"));
            } catch (RuntimeException e) {
                log.warn("Failed to notify tenant {} of config update: {}", tenant, e.getMessage());
            }
        });
    }

    ObjectNode parseDelta(String configJson) {
        JsonNode parsed;
        try {
            parsed = objectMapper.readTree(configJson);
        } catch (JsonProcessingException e) {
            throw new BadRequestException("Invalid config format", e);
        }
        if (parsed == null || !parsed.isObject() || parsed.isEmpty()) {
            throw new BadRequestException("Invalid config format: expected a non-empty JSON object");
        }
        ObjectNode delta = (ObjectNode) parsed;
        Iterator<Map.Entry<String, JsonNode>> fields = delta.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            TenantConfigKey key = TenantConfigKey.fromKey(field.getKey())
                .orElseThrow(() -> new BadRequestException("Unknown config key: " + field.getKey()));
            if (!hasValidShape(key, field.getValue())) {
                throw new BadRequestException("Invalid value for " + key.name());
            }
        }
        return delta;
    }

    private static boolean hasValidShape(TenantConfigKey key, JsonNode value) {
        return switch (key.kind()) {
            case FLAG -> value.isBoolean()
                || (value.isTextual() && ("true".equalsIgnoreCase(value.textValue()) || "false".equalsIgnoreCase(value.textValue())));
            case TEXT -> value.isTextual() && !value.textValue().isBlank();
            case EMOJI_LIST -> value.isArray() && !value.isEmpty() && allTextual(value);
        };
    }

    private static boolean allTextual(JsonNode array) {
        for (JsonNode element : array) {
            if (!element.isTextual() || element.textValue().isBlank()) {
                return false;
            }
        }
        return true;
    }

    private String otpText(String code) {
        return "*🔐 " + fleetProperties.getBotName() + " - CONFIGURATION UPDATE*\n\n"
            + "Your OTP: *" + code + "*\n"
            + "Valid for " + fleetProperties.getOtp().getValidityMinutes() + " minutes\n\n"
            + "Use: /verify-otp " + code;
    }
}

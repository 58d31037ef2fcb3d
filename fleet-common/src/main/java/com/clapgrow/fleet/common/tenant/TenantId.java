package com.clapgrow.fleet.common.tenant;

import java.util.Objects;

/**
 * Normalized identifier of one managed chat session ("number").
 * 
 * Every non-digit character is stripped from the raw input, so "+254 700-000"
 * and "254700000" resolve to the same tenant. This is the key used by every
 * in-memory map and every persisted row.
 * 
 * Example usage:
 * <pre>
 * TenantId tenant = TenantId.of(request.getParameter("number"));
 * registry.isConnected(tenant);
 * </pre>
 */
public record TenantId(String value) {

    public TenantId {
        Objects.requireNonNull(value, "value");
        if (value.isEmpty() || !value.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new IllegalArgumentException("Tenant id must be a non-empty ASCII digit string");
        }
    }

    /**
     * Derive a tenant id from user-supplied input.
     * 
     * @param raw Phone number or JID user part, in any formatting
     * @return Sanitized tenant id
     * @throws IllegalArgumentException if the input contains no digits
     */
    public static TenantId of(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Number is required");
        }
        String digits = sanitize(raw);
        if (digits.isEmpty()) {
            throw new IllegalArgumentException("Number must contain at least one digit: " + raw);
        }
        return new TenantId(digits);
    }

    /**
     * Strip every non-digit character.
     */
    public static String sanitize(String raw) {
        return raw == null ? "" : raw.replaceAll("[^0-9]", "");
    }

    /**
     * User JID of this tenant on the messaging network.
     */
    public String userJid() {
        return value + "@s.whatsapp.net";
    }

    @Override
    public String toString() {
        return value;
    }
}

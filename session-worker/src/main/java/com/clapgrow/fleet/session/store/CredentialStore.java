package com.clapgrow.fleet.session.store;

import com.clapgrow.fleet.common.tenant.TenantId;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Optional;

/**
 * Durable per-tenant state: credential blobs, the known-tenant roster,
 * configuration overrides, pending one-time codes and usage counters.
 * 
 * Authoritative over the local credential cache. Implementations throw
 * Spring {@code DataAccessException}s on storage failure; callers on
 * background paths log and continue.
 */
public interface CredentialStore {

    Optional<JsonNode> getCredential(TenantId tenant);

    void saveCredential(TenantId tenant, JsonNode credentials);

    void deleteCredential(TenantId tenant);

    /**
     * Effective configuration, defaults merged with the tenant's overrides.
     */
    TenantConfig getConfig(TenantId tenant);

    /**
     * Merge a delta into the tenant's stored overrides.
     */
    void updateConfig(TenantId tenant, ObjectNode delta);

    void addTenant(TenantId tenant);

    void removeTenant(TenantId tenant);

    List<TenantId> listTenants();

    /**
     * Store a pending code for a tenant, replacing any previous one.
     */
    void saveOtp(TenantId tenant, String code, ObjectNode delta);

    /**
     * Check and consume a pending code. Single use: a matching code is deleted,
     * an expired one is deleted and rejected, a mismatch leaves it pending.
     */
    OtpVerification verifyOtp(TenantId tenant, String code);

    void incrementStat(TenantId tenant, StatCounter counter);

    StatsSnapshot getStats(TenantId tenant);
}

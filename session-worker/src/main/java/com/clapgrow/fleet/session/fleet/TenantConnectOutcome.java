package com.clapgrow.fleet.session.fleet;

/**
 * What a bulk connect did for one tenant.
 * 
 * @param number Tenant id
 * @param status "already_active", "pairing_pending", or the connect status reported synchronously
 * @param detail Message accompanying the status
 */
public record TenantConnectOutcome(String number, String status, String detail) {
}

package com.clapgrow.fleet.session.exception;

import com.clapgrow.fleet.common.tenant.TenantId;

/**
 * No live session is registered for the requested number.
 */
public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(TenantId tenant) {
        super("No active session found for number " + tenant);
    }

    public SessionNotFoundException(String message) {
        super(message);
    }
}

package com.clapgrow.fleet.session.session;

import java.time.Instant;

/**
 * Status of one tenant as reported by the registry.
 * 
 * @param connected Handle registered and its transport is open
 * @param connectedAt When the handle was registered (null if none)
 * @param uptimeSeconds Seconds since registration (0 if none)
 */
public record SessionStatus(boolean connected, Instant connectedAt, long uptimeSeconds) {

    public static SessionStatus disconnected() {
        return new SessionStatus(false, null, 0);
    }
}

package com.clapgrow.fleet.common.protocol;

/**
 * Protocol client error category.
 * 
 * - TEMPORARY: Transport hiccups, timeouts, bridge unavailable; the operation may succeed later
 * - PERMANENT: Malformed request or unsupported operation; retrying will not help
 * - AUTH: Session logged out or credentials rejected
 */
public enum ProtocolErrorCategory {
    TEMPORARY,
    PERMANENT,
    AUTH
}

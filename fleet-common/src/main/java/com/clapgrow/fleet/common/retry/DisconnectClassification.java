package com.clapgrow.fleet.common.retry;

/**
 * Classification of a closed connection.
 * 
 * Used to decide what happens to the tenant after its transport closes:
 * - MANUAL_UNLINK: Device was unlinked or logged out; erase credentials, never reconnect
 * - EXPECTED_CLOSURE: Pairing was not completed in time; nothing to recover
 * - TRANSIENT: Anything else; reconnect from stored credentials with a bounded budget
 */
public enum DisconnectClassification {
    MANUAL_UNLINK,
    EXPECTED_CLOSURE,
    TRANSIENT
}

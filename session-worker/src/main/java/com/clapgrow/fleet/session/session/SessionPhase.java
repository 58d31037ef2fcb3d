package com.clapgrow.fleet.session.session;

public enum SessionPhase {
    /** Waiting for the user to enter a pairing code */
    PAIRING,
    /** Resuming from stored credentials */
    RESTORING,
    /** Transport open and accepting events */
    OPEN
}

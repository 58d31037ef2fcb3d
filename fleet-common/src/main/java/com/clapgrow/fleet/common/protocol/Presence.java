package com.clapgrow.fleet.common.protocol;

/**
 * Chat presence states a session can announce.
 */
public enum Presence {
    AVAILABLE("available"),
    UNAVAILABLE("unavailable"),
    COMPOSING("composing"),
    RECORDING("recording"),
    PAUSED("paused");

    private final String wireValue;

    Presence(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}

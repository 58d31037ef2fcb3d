package com.clapgrow.fleet.session.session;

public enum ConnectStatus {
    ALREADY_CONNECTED("already_connected"),
    CONNECTION_IN_PROGRESS("connection_in_progress"),
    NEW_PAIRING("new_pairing"),
    RECONNECTING("reconnecting"),
    PAIRING_FAILED("pairing_failed"),
    ERROR("error");

    private final String wireValue;

    ConnectStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}

package com.clapgrow.fleet.session.session;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one connect attempt as reported to its caller.
 * 
 * @param status Outcome kind
 * @param message Human-readable detail
 * @param code Pairing code (new pairing only)
 * @param sessionStatus Registry status (already connected only)
 */
public record ConnectResult(ConnectStatus status, String message, String code, SessionStatus sessionStatus) {

    public static ConnectResult alreadyConnected(SessionStatus sessionStatus) {
        return new ConnectResult(ConnectStatus.ALREADY_CONNECTED, "This number is already connected", null, sessionStatus);
    }

    public static ConnectResult inProgress() {
        return new ConnectResult(ConnectStatus.CONNECTION_IN_PROGRESS,
            "Connection is already in progress for this number. Please wait a moment.", null, null);
    }

    public static ConnectResult newPairing(String code) {
        return new ConnectResult(ConnectStatus.NEW_PAIRING, "Enter this code in Linked Devices", code, null);
    }

    public static ConnectResult reconnecting() {
        return new ConnectResult(ConnectStatus.RECONNECTING, "Restoring session from stored credentials", null, null);
    }

    public static ConnectResult pairingFailed(String detail) {
        return new ConnectResult(ConnectStatus.PAIRING_FAILED, "Failed to generate pairing code: " + detail, null, null);
    }

    public static ConnectResult error(String detail) {
        return new ConnectResult(ConnectStatus.ERROR, "Connection failed: " + detail, null, null);
    }

    public boolean isFailure() {
        return status == ConnectStatus.PAIRING_FAILED || status == ConnectStatus.ERROR;
    }

    public Map<String, Object> toBody() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", !isFailure());
        body.put("status", status.wireValue());
        body.put("message", message);
        if (code != null) {
            body.put("code", code);
        }
        if (sessionStatus != null) {
            body.put("connected", sessionStatus.connected());
            body.put("connectedAt", sessionStatus.connectedAt());
            body.put("uptime", sessionStatus.uptimeSeconds());
        }
        return body;
    }
}

package com.clapgrow.fleet.session.reconnect;

import com.clapgrow.fleet.common.protocol.event.ConnectionUpdate;
import com.clapgrow.fleet.common.retry.DisconnectClassification;
import org.springframework.stereotype.Component;

/**
 * Classifies a connection close into a disconnect classification.
 * 
 * Classification rules:
 * - 401, or an error message mentioning 401: MANUAL_UNLINK (device unlinked / logged out)
 * - 408, or "QR refs attempts ended": EXPECTED_CLOSURE (pairing never completed)
 * - Anything else: TRANSIENT
 */
@Component
public class DisconnectClassifier {

    static final int UNAUTHORIZED = 401;
    static final int TIMED_OUT = 408;
    static final String PAIRING_EXPIRED = "QR refs attempts ended";

    public DisconnectClassification classify(ConnectionUpdate update) {
        Integer statusCode = update.statusCode();
        String message = update.errorMessage();

        if ((statusCode != null && statusCode == UNAUTHORIZED)
            || (message != null && message.contains(String.valueOf(UNAUTHORIZED)))) {
            return DisconnectClassification.MANUAL_UNLINK;
        }
        if ((statusCode != null && statusCode == TIMED_OUT)
            || (message != null && message.contains(PAIRING_EXPIRED))) {
            return DisconnectClassification.EXPECTED_CLOSURE;
        }
        return DisconnectClassification.TRANSIENT;
    }
}

package com.clapgrow.fleet.session.bridge;

import com.clapgrow.fleet.common.protocol.ProtocolClientException;
import com.clapgrow.fleet.common.protocol.ProtocolErrorCategory;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Maps bridge call failures onto {@link ProtocolClientException}.
 * 
 * Classification rules:
 * - AUTH: 401 and 403
 * - TEMPORARY: 408, 429, 5xx, connection failures and timeouts
 * - PERMANENT: Any other 4xx
 */
final class BridgeErrors {

    private BridgeErrors() {
        // Utility class - prevent instantiation
    }

    static ProtocolClientException translate(String operation, RuntimeException e) {
        if (e instanceof ProtocolClientException protocolError) {
            return protocolError;
        }
        if (e instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            String body = response.getResponseBodyAsString();
            return new ProtocolClientException(
                operation + " failed with HTTP " + status + (body.isEmpty() ? "" : ": " + body),
                status, categorize(status), e);
        }
        if (e instanceof WebClientRequestException) {
            return new ProtocolClientException(operation + " failed: bridge unreachable (" + e.getMessage() + ")",
                null, ProtocolErrorCategory.TEMPORARY, e);
        }
        return new ProtocolClientException(operation + " failed: " + e.getMessage(), null, ProtocolErrorCategory.TEMPORARY, e);
    }

    static ProtocolErrorCategory categorize(int status) {
        if (status == 401 || status == 403) {
            return ProtocolErrorCategory.AUTH;
        }
        if (status == 408 || status == 429 || status >= 500) {
            return ProtocolErrorCategory.TEMPORARY;
        }
        return ProtocolErrorCategory.PERMANENT;
    }
}

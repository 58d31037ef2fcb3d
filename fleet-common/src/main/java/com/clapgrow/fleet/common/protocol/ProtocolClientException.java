package com.clapgrow.fleet.common.protocol;

/**
 * Raised by protocol client operations.
 * 
 * Carries the status code reported by the transport (when there is one) and an
 * error category so callers can decide between retrying and giving up.
 */
public class ProtocolClientException extends RuntimeException {

    private final Integer statusCode;
    private final ProtocolErrorCategory category;

    public ProtocolClientException(String message) {
        this(message, null, ProtocolErrorCategory.TEMPORARY, null);
    }

    public ProtocolClientException(String message, Throwable cause) {
        this(message, null, ProtocolErrorCategory.TEMPORARY, cause);
    }

    public ProtocolClientException(String message, Integer statusCode, ProtocolErrorCategory category, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.category = category;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public ProtocolErrorCategory getCategory() {
        return category;
    }
}

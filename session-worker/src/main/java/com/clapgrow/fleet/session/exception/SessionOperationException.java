package com.clapgrow.fleet.session.exception;

/**
 * Exception thrown when an operation on a live session fails.
 * This exception is handled by GlobalExceptionHandler as a server error.
 */
public class SessionOperationException extends RuntimeException {

    public SessionOperationException(String message) {
        super(message);
    }

    public SessionOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.clapgrow.fleet.session.exception;

/**
 * A one-time code was unknown, expired or wrong.
 */
public class OtpVerificationException extends RuntimeException {

    public OtpVerificationException(String message) {
        super(message);
    }
}

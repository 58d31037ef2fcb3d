package com.clapgrow.fleet.session.store;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Result of checking a one-time code.
 * 
 * @param valid Code matched and was consumed
 * @param delta Configuration delta bound to the code (valid only)
 * @param error Reason for rejection (invalid only)
 */
public record OtpVerification(boolean valid, ObjectNode delta, String error) {

    public static OtpVerification accepted(ObjectNode delta) {
        return new OtpVerification(true, delta, null);
    }

    public static OtpVerification rejected(String error) {
        return new OtpVerification(false, null, error);
    }
}

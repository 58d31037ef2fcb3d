package com.clapgrow.fleet.session.otp;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * Six-digit numeric one-time codes (100000-999999).
 */
@Component
public class OtpGenerator {

    private final SecureRandom random = new SecureRandom();

    public String generate() {
        return String.valueOf(100000 + random.nextInt(900000));
    }
}

package com.authplatform.authsvc.shared.crypto;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;

/**
 * Opaque single-use tokens (password reset, email verification, refresh, OAuth state,
 * session ids) and their expiry arithmetic.
 */
@Component
public class SecretTokenGenerator {

    public static final int DEFAULT_BYTE_LENGTH = 32;

    /**
     * Stored tokens live in 128-character columns, two hex characters per byte.
     */
    public static final int MAX_BYTE_LENGTH = 64;

    private final SecureRandom secureRandom;
    private final HexFormat hexFormat;
    private final Clock clock;

    public SecretTokenGenerator(Clock clock) {
        this.secureRandom = new SecureRandom();
        this.hexFormat = HexFormat.of();
        this.clock = clock;
    }

    /**
     * Generates a secure random 32-byte token as a 64-char hex string.
     */
    public String generate() {
        return generate(DEFAULT_BYTE_LENGTH);
    }

    /**
     * Generates {@code byteLength} random bytes, hex encoded.
     */
    public String generate(int byteLength) {
        if (byteLength <= 0) {
            throw new IllegalArgumentException("Token byte length must be positive");
        }
        byte[] bytes = new byte[byteLength];
        secureRandom.nextBytes(bytes);
        return hexFormat.formatHex(bytes);
    }

    public Instant expiryFromNow(Duration ttl) {
        return clock.instant().plus(ttl);
    }

    /**
     * A token is expired from its expiry instant onward; a missing expiry counts as expired.
     */
    public boolean isExpired(Instant expiry) {
        if (expiry == null) {
            return true;
        }
        return !clock.instant().isBefore(expiry);
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * Compares two tokens in constant time. Nulls never match.
     */
    public boolean matches(String expected, String actual) {
        if (expected == null || actual == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                actual.getBytes(StandardCharsets.UTF_8)
        );
    }
}

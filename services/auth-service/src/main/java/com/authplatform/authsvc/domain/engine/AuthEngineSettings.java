package com.authplatform.authsvc.domain.engine;

import com.authplatform.authsvc.shared.crypto.SecretTokenGenerator;
import com.authplatform.authsvc.shared.crypto.SigningKeys;
import lombok.Builder;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable engine configuration, validated once at startup.
 */
@Builder(toBuilder = true)
public record AuthEngineSettings(
        SigningKeys signingKeys,
        SessionStrategy sessionStrategy,
        Duration sessionMaxAge,
        boolean refreshTokensEnabled,
        Duration refreshTokenMaxAge,
        String issuer,
        String audience,
        int tokenByteLength,
        Duration resetTokenTtl,
        Duration verificationTokenTtl
) {

    public static final Duration DEFAULT_SESSION_MAX_AGE = Duration.ofDays(30);
    public static final Duration DEFAULT_REFRESH_TOKEN_MAX_AGE = Duration.ofDays(30);
    public static final Duration DEFAULT_RESET_TOKEN_TTL = Duration.ofHours(1);
    public static final Duration DEFAULT_VERIFICATION_TOKEN_TTL = Duration.ofHours(24);

    public AuthEngineSettings {
        Objects.requireNonNull(signingKeys, "signingKeys is required");
        if (sessionStrategy == null) sessionStrategy = SessionStrategy.JWT;
        sessionMaxAge = positiveOr(sessionMaxAge, DEFAULT_SESSION_MAX_AGE, "sessionMaxAge");
        refreshTokenMaxAge = positiveOr(refreshTokenMaxAge, DEFAULT_REFRESH_TOKEN_MAX_AGE, "refreshTokenMaxAge");
        resetTokenTtl = positiveOr(resetTokenTtl, DEFAULT_RESET_TOKEN_TTL, "resetTokenTtl");
        verificationTokenTtl = positiveOr(verificationTokenTtl, DEFAULT_VERIFICATION_TOKEN_TTL, "verificationTokenTtl");
        if (tokenByteLength == 0) {
            tokenByteLength = SecretTokenGenerator.DEFAULT_BYTE_LENGTH;
        } else if (tokenByteLength < 16 || tokenByteLength > SecretTokenGenerator.MAX_BYTE_LENGTH) {
            throw new IllegalArgumentException(
                    "tokenByteLength must be between 16 and " + SecretTokenGenerator.MAX_BYTE_LENGTH);
        }
        issuer = blankToNull(issuer);
        audience = blankToNull(audience);
    }

    /**
     * Sessions are stored for the database strategy, and whenever refresh tokens are on since
     * rotation needs a row to swap on.
     */
    public boolean persistSessions() {
        return sessionStrategy == SessionStrategy.DATABASE || refreshTokensEnabled;
    }

    private static Duration positiveOr(Duration value, Duration fallback, String name) {
        if (value == null) {
            return fallback;
        }
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}

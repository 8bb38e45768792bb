package com.authplatform.authsvc.shared.crypto;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Claims carried by a session token. {@code issuedAt} and {@code expiresAt} are filled by the
 * codec on encode and ignored if set by the caller.
 */
@Builder(toBuilder = true)
public record TokenClaims(
        String subject,
        String email,
        String name,
        String picture,
        String sessionId,
        Instant issuedAt,
        Instant expiresAt,
        String issuer,
        String audience,
        Map<String, Object> customClaims
) {

    public static final String EMAIL = "email";
    public static final String NAME = "name";
    public static final String PICTURE = "picture";
    public static final String SESSION_ID = "sid";

    /**
     * Claim names the codec manages itself; custom claims with these names are dropped.
     */
    public static final Set<String> RESERVED = Set.of(
            "sub", EMAIL, NAME, PICTURE, SESSION_ID, "iat", "exp", "nbf", "iss", "aud", "jti"
    );

    public TokenClaims {
        customClaims = customClaims == null ? Map.of() : Map.copyOf(customClaims);
    }

    public Object customClaim(String name) {
        return customClaims.get(name);
    }
}

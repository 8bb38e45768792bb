package com.authplatform.authsvc.domain.session;

import java.time.Instant;

/**
 * Tokens handed to a client after a successful sign-in.
 * {@code sessionToken} is set only when sessions are persisted, {@code refreshToken} only when
 * refresh tokens are enabled.
 */
public record IssuedTokens(
        String accessToken,
        Instant accessTokenExpiresAt,
        String sessionToken,
        String refreshToken,
        Instant refreshTokenExpiresAt
) {
}

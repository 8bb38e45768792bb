package com.authplatform.authsvc.domain.port;

import java.time.Instant;

/**
 * Tokens a provider returned from its token endpoint. Any field may be null.
 */
public record ProviderTokens(
        String accessToken,
        String refreshToken,
        Instant expiresAt,
        String tokenType,
        String scope,
        String idToken
) {
}

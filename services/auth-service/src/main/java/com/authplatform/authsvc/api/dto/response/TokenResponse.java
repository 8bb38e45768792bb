package com.authplatform.authsvc.api.dto.response;

import com.authplatform.authsvc.domain.session.IssuedTokens;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenResponse(
        String accessToken,
        String tokenType,
        Instant expiresAt,
        String refreshToken,
        Instant refreshTokenExpiresAt
) {
    public static TokenResponse from(IssuedTokens tokens) {
        return new TokenResponse(tokens.accessToken(), "Bearer", tokens.accessTokenExpiresAt(),
                tokens.refreshToken(), tokens.refreshTokenExpiresAt());
    }
}

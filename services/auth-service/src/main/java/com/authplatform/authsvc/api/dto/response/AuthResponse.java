package com.authplatform.authsvc.api.dto.response;

import com.authplatform.authsvc.domain.model.User;
import com.authplatform.authsvc.domain.session.IssuedTokens;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthResponse(
        UserResponse user,
        String accessToken,
        String tokenType,
        Instant expiresAt,
        String sessionToken,
        String refreshToken,
        Instant refreshTokenExpiresAt,
        Boolean newUser
) {
    public static AuthResponse of(User user, IssuedTokens tokens) {
        return of(user, tokens, null);
    }

    public static AuthResponse of(User user, IssuedTokens tokens, Boolean newUser) {
        return new AuthResponse(UserResponse.from(user), tokens.accessToken(), "Bearer",
                tokens.accessTokenExpiresAt(), tokens.sessionToken(), tokens.refreshToken(),
                tokens.refreshTokenExpiresAt(), newUser);
    }
}

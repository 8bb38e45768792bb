package com.authplatform.authsvc.domain.hook;

import com.authplatform.authsvc.domain.model.User;
import com.authplatform.authsvc.domain.session.AuthSession;
import com.authplatform.authsvc.shared.crypto.TokenClaims;

import java.util.List;
import java.util.Objects;

/**
 * Runs every registered {@link AuthCallbacks} in order, each one receiving the previous
 * one's output. Exceptions propagate to the caller.
 */
public class AuthCallbackChain {

    private final List<AuthCallbacks> callbacks;

    public AuthCallbackChain(List<AuthCallbacks> callbacks) {
        this.callbacks = List.copyOf(callbacks);
    }

    public static AuthCallbackChain none() {
        return new AuthCallbackChain(List.of());
    }

    public TokenClaims shapeClaims(TokenClaims claims, User user) {
        TokenClaims shaped = claims;
        for (AuthCallbacks callback : callbacks) {
            shaped = Objects.requireNonNull(callback.shapeClaims(shaped, user),
                    () -> callback.getClass().getSimpleName() + ".shapeClaims returned null");
        }
        return shaped;
    }

    public AuthSession shapeSession(AuthSession session, TokenClaims claims) {
        AuthSession shaped = session;
        for (AuthCallbacks callback : callbacks) {
            shaped = Objects.requireNonNull(callback.shapeSession(shaped, claims),
                    () -> callback.getClass().getSimpleName() + ".shapeSession returned null");
        }
        return shaped;
    }
}

package com.authplatform.authsvc.domain.hook;

import com.authplatform.authsvc.domain.model.User;
import com.authplatform.authsvc.domain.session.AuthSession;
import com.authplatform.authsvc.shared.crypto.TokenClaims;

/**
 * Value-shaping hooks. Each must return a payload, possibly modified; an exception thrown
 * here fails the operation.
 */
public interface AuthCallbacks {

    /**
     * Shapes the claims before they are signed.
     */
    default TokenClaims shapeClaims(TokenClaims claims, User user) {
        return claims;
    }

    /**
     * Shapes the session before it is handed back to the caller.
     */
    default AuthSession shapeSession(AuthSession session, TokenClaims claims) {
        return session;
    }
}

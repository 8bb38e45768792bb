package com.authplatform.authsvc.domain.session;

import com.authplatform.authsvc.domain.engine.AuthEngineSettings;
import com.authplatform.authsvc.domain.hook.AuthCallbackChain;
import com.authplatform.authsvc.domain.model.Session;
import com.authplatform.authsvc.domain.model.User;
import com.authplatform.authsvc.domain.port.AuthStorage;
import com.authplatform.authsvc.shared.crypto.SecretTokenGenerator;
import com.authplatform.authsvc.shared.crypto.SignedTokenCodec;
import com.authplatform.authsvc.shared.crypto.TokenClaims;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Mints signed tokens for a user and, when sessions are persisted, the session row behind them.
 */
@Slf4j
@Component
public class SessionIssuer {

    private final AuthStorage storage;
    private final SignedTokenCodec codec;
    private final SecretTokenGenerator tokenGenerator;
    private final AuthCallbackChain callbacks;
    private final AuthEngineSettings settings;

    public SessionIssuer(
            AuthStorage storage,
            SignedTokenCodec codec,
            SecretTokenGenerator tokenGenerator,
            AuthCallbackChain callbacks,
            AuthEngineSettings settings) {
        this.storage = storage;
        this.codec = codec;
        this.tokenGenerator = tokenGenerator;
        this.callbacks = callbacks;
        this.settings = settings;
    }

    /**
     * Starts a new session for the user and signs a token for it.
     */
    public IssuedTokens issue(User user) {
        if (!settings.persistSessions()) {
            return new IssuedTokens(sign(user, null), accessTokenExpiry(), null, null, null);
        }

        Session.SessionBuilder session = Session.builder()
                .sessionToken(tokenGenerator.generate(settings.tokenByteLength()))
                .userId(user.getId())
                .expires(tokenGenerator.expiryFromNow(settings.sessionMaxAge()))
                .createdAt(tokenGenerator.now());
        if (settings.refreshTokensEnabled()) {
            session.refreshToken(tokenGenerator.generate(settings.tokenByteLength()))
                    .refreshTokenExpires(tokenGenerator.expiryFromNow(settings.refreshTokenMaxAge()));
        }
        Session created = storage.createSession(session.build());
        log.debug("Session created: userId={}, refresh={}", user.getId(), created.getRefreshToken() != null);

        return new IssuedTokens(
                sign(user, created.getSessionToken()),
                accessTokenExpiry(),
                created.getSessionToken(),
                created.getRefreshToken(),
                created.getRefreshTokenExpires());
    }

    /**
     * Signs a token for an existing session (or none), running the claim-shaping callbacks.
     */
    public String sign(User user, String sessionId) {
        TokenClaims claims = TokenClaims.builder()
                .subject(user.getId())
                .email(user.getEmail())
                .name(user.getName())
                .picture(user.getImage())
                .sessionId(sessionId)
                .build();
        TokenClaims shaped = callbacks.shapeClaims(claims, user);
        return codec.encode(shaped, settings.signingKeys(), settings.sessionMaxAge(),
                settings.issuer(), settings.audience());
    }

    /**
     * Decodes a token signed by this deployment. Empty for anything that does not verify.
     */
    public Optional<TokenClaims> verify(String token) {
        return codec.decode(token, settings.signingKeys(), settings.issuer(), settings.audience());
    }

    public Instant accessTokenExpiry() {
        return tokenGenerator.now().truncatedTo(ChronoUnit.SECONDS).plus(settings.sessionMaxAge());
    }
}

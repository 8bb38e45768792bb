package com.authplatform.authsvc.domain.session;

import com.authplatform.authsvc.domain.engine.AuthEngineSettings;
import com.authplatform.authsvc.domain.hook.AuthCallbackChain;
import com.authplatform.authsvc.domain.hook.AuthEventPublisher;
import com.authplatform.authsvc.domain.model.Session;
import com.authplatform.authsvc.domain.model.SessionAndUser;
import com.authplatform.authsvc.domain.model.User;
import com.authplatform.authsvc.domain.port.AuthStorage;
import com.authplatform.authsvc.shared.crypto.SecretTokenGenerator;
import com.authplatform.authsvc.shared.crypto.TokenClaims;
import com.authplatform.authsvc.shared.exception.InvalidOrExpiredTokenException;
import com.authplatform.authsvc.shared.exception.RefreshTokensDisabledException;
import com.authplatform.authsvc.shared.exception.SessionNotFoundException;
import com.authplatform.authsvc.shared.validation.ValidationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Session lookup, refresh-token rotation and sign-out.
 */
@Slf4j
@Service
public class SessionService {

    private final AuthStorage storage;
    private final ValidationService validationService;
    private final SecretTokenGenerator tokenGenerator;
    private final SessionIssuer sessionIssuer;
    private final AuthEventPublisher events;
    private final AuthCallbackChain callbacks;
    private final AuthEngineSettings settings;

    public SessionService(
            AuthStorage storage,
            ValidationService validationService,
            SecretTokenGenerator tokenGenerator,
            SessionIssuer sessionIssuer,
            AuthEventPublisher events,
            AuthCallbackChain callbacks,
            AuthEngineSettings settings) {
        this.storage = storage;
        this.validationService = validationService;
        this.tokenGenerator = tokenGenerator;
        this.sessionIssuer = sessionIssuer;
        this.events = events;
        this.callbacks = callbacks;
        this.settings = settings;
    }

    /**
     * Trades a refresh token for a new access token and a new refresh token. The old refresh
     * token stops working; if two callers race on it only one gets through.
     */
    @Transactional
    public IssuedTokens refresh(String refreshToken) {
        validationService.requireAll("refreshToken", refreshToken);
        if (!settings.refreshTokensEnabled()) {
            throw new RefreshTokensDisabledException();
        }

        Session session = storage.getSessionByRefreshToken(refreshToken)
                .orElseThrow(InvalidOrExpiredTokenException::new);
        User user = storage.getUser(session.getUserId())
                .orElseThrow(InvalidOrExpiredTokenException::new);

        String nextRefreshToken = tokenGenerator.generate(settings.tokenByteLength());
        Instant refreshExpires = tokenGenerator.expiryFromNow(settings.refreshTokenMaxAge());
        Instant sessionExpires = tokenGenerator.expiryFromNow(settings.sessionMaxAge());

        Session rotated = storage.rotateRefreshToken(refreshToken, nextRefreshToken, refreshExpires, sessionExpires)
                .orElseThrow(() -> {
                    log.debug("Refresh token lost rotation race: userId={}", user.getId());
                    return new InvalidOrExpiredTokenException();
                });

        String accessToken = sessionIssuer.sign(user, rotated.getSessionToken());
        return new IssuedTokens(accessToken, sessionIssuer.accessTokenExpiry(), rotated.getSessionToken(),
                rotated.getRefreshToken(), rotated.getRefreshTokenExpires());
    }

    @Transactional
    public void signOut(String sessionToken) {
        validationService.requireAll("sessionToken", sessionToken);

        Session deleted = storage.deleteSession(sessionToken)
                .orElseThrow(SessionNotFoundException::new);
        log.info("Signed out: userId={}", deleted.getUserId());

        events.signedOut(deleted);
    }

    /**
     * @return number of sessions removed
     */
    @Transactional
    public int signOutAll(String userId) {
        validationService.requireAll("userId", userId);

        int deleted = storage.deleteUserSessions(userId);
        log.info("Signed out of all devices: userId={}, sessions={}", userId, deleted);
        return deleted;
    }

    /**
     * Resolves a signed token to a session. Empty when the token does not verify, its user is
     * gone, or (for persisted sessions) the session it names was revoked or has expired.
     */
    public Optional<AuthSession> getSession(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }

        Optional<TokenClaims> decoded = sessionIssuer.verify(token);
        if (decoded.isEmpty() || decoded.get().subject() == null) {
            return Optional.empty();
        }
        TokenClaims claims = decoded.get();

        Optional<User> user = storage.getUser(claims.subject());
        if (user.isEmpty()) {
            log.debug("Token subject no longer exists: userId={}", claims.subject());
            return Optional.empty();
        }

        String sessionId = claims.sessionId();
        if (settings.persistSessions() && sessionId != null && !isLive(sessionId, user.get())) {
            log.debug("Token names a revoked session: userId={}", claims.subject());
            return Optional.empty();
        }

        Instant expires = claims.expiresAt() != null ? claims.expiresAt() : sessionIssuer.accessTokenExpiry();
        AuthSession session = new AuthSession(SessionUser.from(user.get()), expires, sessionId, Map.of());
        return Optional.of(callbacks.shapeSession(session, claims));
    }

    /**
     * Verifies a signed token without touching storage.
     */
    public Optional<TokenClaims> verifyToken(String token) {
        return sessionIssuer.verify(token);
    }

    private boolean isLive(String sessionId, User user) {
        return storage.getSessionAndUser(sessionId)
                .map(SessionAndUser::session)
                .filter(s -> user.getId().equals(s.getUserId()))
                .filter(s -> !s.isExpired(tokenGenerator.now()))
                .isPresent();
    }
}

package com.authplatform.authsvc.domain.port;

import com.authplatform.authsvc.domain.model.Account;
import com.authplatform.authsvc.domain.model.Session;
import com.authplatform.authsvc.domain.model.SessionAndUser;
import com.authplatform.authsvc.domain.model.User;

import java.time.Instant;
import java.util.Optional;

/**
 * Persistence contract for users, linked accounts and sessions.
 *
 * <p>Every lookup by token excludes rows whose token has already expired. Returned entities
 * are detached copies: mutating one has no effect until it is passed to an update method.
 * Failures of the underlying store propagate unchanged.
 */
public interface AuthStorage {

    // Users

    /**
     * Persists a new user. The store assigns the id when none is set.
     */
    User createUser(User user);

    Optional<User> getUser(String id);

    Optional<User> getUserByEmail(String email);

    Optional<User> getUserByResetToken(String resetToken);

    Optional<User> getUserByVerificationToken(String verificationToken);

    User updateUser(User user);

    Optional<User> deleteUser(String id);

    /**
     * Clears the user's reset token if, and only if, it still equals {@code resetToken}.
     * Of two concurrent calls with the same token at most one returns true.
     */
    boolean consumeResetToken(String userId, String resetToken);

    /**
     * Clears the verification token and stamps {@code verifiedAt} if, and only if, the stored
     * token still equals {@code verificationToken}. At most one concurrent caller wins.
     */
    boolean consumeVerificationToken(String userId, String verificationToken, Instant verifiedAt);

    // Accounts

    Account linkAccount(Account account);

    Optional<Account> getAccount(String provider, String providerAccountId);

    Optional<User> getUserByAccount(String provider, String providerAccountId);

    Optional<Account> getAccountByUserAndProvider(String userId, String provider);

    Account updateAccount(Account account);

    Optional<Account> unlinkAccount(String provider, String providerAccountId);

    // Sessions

    Session createSession(Session session);

    /**
     * Session plus owning user; empty when the session is unknown or expired.
     */
    Optional<SessionAndUser> getSessionAndUser(String sessionToken);

    Optional<Session> getSessionByRefreshToken(String refreshToken);

    Optional<Session> updateSession(Session session);

    /**
     * Replaces the refresh token of the session currently holding {@code currentRefreshToken}.
     * The swap is atomic: for any one refresh-token value at most one call succeeds, every
     * other call (and any call on an expired token) returns empty.
     */
    Optional<Session> rotateRefreshToken(String currentRefreshToken, String newRefreshToken,
                                         Instant newRefreshTokenExpires, Instant newSessionExpires);

    Optional<Session> deleteSession(String sessionToken);

    int deleteUserSessions(String userId);
}

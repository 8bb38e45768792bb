package com.authplatform.authsvc.infra.memory;

import com.authplatform.authsvc.domain.model.Account;
import com.authplatform.authsvc.domain.model.Session;
import com.authplatform.authsvc.domain.model.SessionAndUser;
import com.authplatform.authsvc.domain.model.User;
import com.authplatform.authsvc.domain.port.AuthStorage;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Heap-backed {@link AuthStorage} for tests and local runs. Every method holds the instance
 * monitor, which is what makes the compare-and-clear and compare-and-swap operations atomic.
 * Entities go in and out as copies.
 */
@Slf4j
public class InMemoryAuthStorage implements AuthStorage {

    private final Clock clock;
    private final Map<String, User> users = new LinkedHashMap<>();
    private final Map<String, Account> accounts = new LinkedHashMap<>();
    private final Map<String, Session> sessions = new LinkedHashMap<>();

    public InMemoryAuthStorage(Clock clock) {
        this.clock = clock;
    }

    // Users

    @Override
    public synchronized User createUser(User user) {
        User stored = user.toBuilder().build();
        if (stored.getId() == null) {
            stored.setId(UUID.randomUUID().toString());
        }
        if (users.containsKey(stored.getId())) {
            throw new IllegalStateException("User id already exists: " + stored.getId());
        }
        if (findUserByEmail(stored.getEmail()).isPresent()) {
            throw new IllegalStateException("Email already registered");
        }
        Instant now = clock.instant();
        stored.setCreatedAt(now);
        stored.setUpdatedAt(now);
        users.put(stored.getId(), stored);
        return copy(stored);
    }

    @Override
    public synchronized Optional<User> getUser(String id) {
        return Optional.ofNullable(users.get(id)).map(InMemoryAuthStorage::copy);
    }

    @Override
    public synchronized Optional<User> getUserByEmail(String email) {
        return findUserByEmail(email).map(InMemoryAuthStorage::copy);
    }

    @Override
    public synchronized Optional<User> getUserByResetToken(String resetToken) {
        Instant now = clock.instant();
        return users.values().stream()
                .filter(u -> resetToken != null && resetToken.equals(u.getResetToken()))
                .filter(u -> isLive(u.getResetTokenExpiry(), now))
                .findFirst()
                .map(InMemoryAuthStorage::copy);
    }

    @Override
    public synchronized Optional<User> getUserByVerificationToken(String verificationToken) {
        Instant now = clock.instant();
        return users.values().stream()
                .filter(u -> verificationToken != null && verificationToken.equals(u.getVerificationToken()))
                .filter(u -> isLive(u.getVerificationTokenExpiry(), now))
                .findFirst()
                .map(InMemoryAuthStorage::copy);
    }

    @Override
    public synchronized User updateUser(User user) {
        User existing = users.get(user.getId());
        if (existing == null) {
            throw new IllegalStateException("Unknown user: " + user.getId());
        }
        User stored = user.toBuilder()
                .createdAt(existing.getCreatedAt())
                .updatedAt(clock.instant())
                .build();
        users.put(stored.getId(), stored);
        return copy(stored);
    }

    @Override
    public synchronized Optional<User> deleteUser(String id) {
        User removed = users.remove(id);
        if (removed == null) {
            return Optional.empty();
        }
        accounts.values().removeIf(a -> id.equals(a.getUserId()));
        sessions.values().removeIf(s -> id.equals(s.getUserId()));
        return Optional.of(copy(removed));
    }

    @Override
    public synchronized boolean consumeResetToken(String userId, String resetToken) {
        User user = users.get(userId);
        if (user == null || resetToken == null || !resetToken.equals(user.getResetToken())) {
            return false;
        }
        user.clearResetToken();
        user.setUpdatedAt(clock.instant());
        return true;
    }

    @Override
    public synchronized boolean consumeVerificationToken(String userId, String verificationToken, Instant verifiedAt) {
        User user = users.get(userId);
        if (user == null || verificationToken == null || !verificationToken.equals(user.getVerificationToken())) {
            return false;
        }
        user.markEmailVerified(verifiedAt);
        user.setUpdatedAt(clock.instant());
        return true;
    }

    // Accounts

    @Override
    public synchronized Account linkAccount(Account account) {
        if (findAccount(account.getProvider(), account.getProviderAccountId()).isPresent()) {
            throw new IllegalStateException("Account already linked: provider=" + account.getProvider());
        }
        Account stored = account.toBuilder().build();
        if (stored.getId() == null) {
            stored.setId(UUID.randomUUID().toString());
        }
        Instant now = clock.instant();
        stored.setCreatedAt(now);
        stored.setUpdatedAt(now);
        accounts.put(stored.getId(), stored);
        return copy(stored);
    }

    @Override
    public synchronized Optional<Account> getAccount(String provider, String providerAccountId) {
        return findAccount(provider, providerAccountId).map(InMemoryAuthStorage::copy);
    }

    @Override
    public synchronized Optional<User> getUserByAccount(String provider, String providerAccountId) {
        return findAccount(provider, providerAccountId)
                .map(a -> users.get(a.getUserId()))
                .map(InMemoryAuthStorage::copy);
    }

    @Override
    public synchronized Optional<Account> getAccountByUserAndProvider(String userId, String provider) {
        return accounts.values().stream()
                .filter(a -> Objects.equals(userId, a.getUserId()) && Objects.equals(provider, a.getProvider()))
                .findFirst()
                .map(InMemoryAuthStorage::copy);
    }

    @Override
    public synchronized Account updateAccount(Account account) {
        Account existing = accounts.get(account.getId());
        if (existing == null) {
            throw new IllegalStateException("Unknown account: " + account.getId());
        }
        Account stored = account.toBuilder()
                .createdAt(existing.getCreatedAt())
                .updatedAt(clock.instant())
                .build();
        accounts.put(stored.getId(), stored);
        return copy(stored);
    }

    @Override
    public synchronized Optional<Account> unlinkAccount(String provider, String providerAccountId) {
        Optional<Account> account = findAccount(provider, providerAccountId);
        account.ifPresent(a -> accounts.remove(a.getId()));
        return account.map(InMemoryAuthStorage::copy);
    }

    // Sessions

    @Override
    public synchronized Session createSession(Session session) {
        if (sessions.containsKey(session.getSessionToken())) {
            throw new IllegalStateException("Session token already exists");
        }
        Session stored = session.toBuilder().build();
        if (stored.getCreatedAt() == null) {
            stored.setCreatedAt(clock.instant());
        }
        sessions.put(stored.getSessionToken(), stored);
        return copy(stored);
    }

    @Override
    public synchronized Optional<SessionAndUser> getSessionAndUser(String sessionToken) {
        Session session = sessions.get(sessionToken);
        if (session == null || session.isExpired(clock.instant())) {
            return Optional.empty();
        }
        User user = users.get(session.getUserId());
        if (user == null) {
            return Optional.empty();
        }
        return Optional.of(new SessionAndUser(copy(session), copy(user)));
    }

    @Override
    public synchronized Optional<Session> getSessionByRefreshToken(String refreshToken) {
        return findLiveByRefreshToken(refreshToken).map(InMemoryAuthStorage::copy);
    }

    @Override
    public synchronized Optional<Session> updateSession(Session session) {
        Session existing = sessions.get(session.getSessionToken());
        if (existing == null) {
            return Optional.empty();
        }
        Session stored = session.toBuilder().createdAt(existing.getCreatedAt()).build();
        sessions.put(stored.getSessionToken(), stored);
        return Optional.of(copy(stored));
    }

    @Override
    public synchronized Optional<Session> rotateRefreshToken(String currentRefreshToken, String newRefreshToken,
                                                             Instant newRefreshTokenExpires,
                                                             Instant newSessionExpires) {
        Optional<Session> current = findLiveByRefreshToken(currentRefreshToken);
        current.ifPresent(s -> {
            s.setRefreshToken(newRefreshToken);
            s.setRefreshTokenExpires(newRefreshTokenExpires);
            s.setExpires(newSessionExpires);
        });
        return current.map(InMemoryAuthStorage::copy);
    }

    @Override
    public synchronized Optional<Session> deleteSession(String sessionToken) {
        return Optional.ofNullable(sessions.remove(sessionToken)).map(InMemoryAuthStorage::copy);
    }

    @Override
    public synchronized int deleteUserSessions(String userId) {
        int before = sessions.size();
        sessions.values().removeIf(s -> Objects.equals(userId, s.getUserId()));
        int removed = before - sessions.size();
        log.debug("Removed sessions: userId={}, count={}", userId, removed);
        return removed;
    }

    private Optional<User> findUserByEmail(String email) {
        return users.values().stream()
                .filter(u -> u.getEmail() != null && u.getEmail().equals(email))
                .findFirst();
    }

    private Optional<Account> findAccount(String provider, String providerAccountId) {
        return accounts.values().stream()
                .filter(a -> Objects.equals(provider, a.getProvider())
                        && Objects.equals(providerAccountId, a.getProviderAccountId()))
                .findFirst();
    }

    private Optional<Session> findLiveByRefreshToken(String refreshToken) {
        if (refreshToken == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        return sessions.values().stream()
                .filter(s -> refreshToken.equals(s.getRefreshToken()))
                .filter(s -> isLive(s.getRefreshTokenExpires(), now))
                .findFirst();
    }

    private static boolean isLive(Instant expiry, Instant now) {
        return expiry != null && now.isBefore(expiry);
    }

    private static User copy(User user) {
        return user.toBuilder().build();
    }

    private static Account copy(Account account) {
        return account.toBuilder().build();
    }

    private static Session copy(Session session) {
        return session.toBuilder().build();
    }
}

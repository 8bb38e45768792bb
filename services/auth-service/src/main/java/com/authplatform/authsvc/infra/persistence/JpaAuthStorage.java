package com.authplatform.authsvc.infra.persistence;

import com.authplatform.authsvc.domain.model.Account;
import com.authplatform.authsvc.domain.model.Session;
import com.authplatform.authsvc.domain.model.SessionAndUser;
import com.authplatform.authsvc.domain.model.User;
import com.authplatform.authsvc.domain.port.AuthStorage;
import jakarta.persistence.EntityManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * {@link AuthStorage} on Spring Data JPA. Token redemption and refresh rotation are single
 * conditional UPDATE statements, so the database decides which concurrent caller wins.
 */
@Slf4j
@Transactional
public class JpaAuthStorage implements AuthStorage {

    private final UserRepository userRepository;
    private final AccountRepository accountRepository;
    private final SessionRepository sessionRepository;
    private final EntityManager entityManager;
    private final Clock clock;

    public JpaAuthStorage(
            UserRepository userRepository,
            AccountRepository accountRepository,
            SessionRepository sessionRepository,
            EntityManager entityManager,
            Clock clock) {
        this.userRepository = userRepository;
        this.accountRepository = accountRepository;
        this.sessionRepository = sessionRepository;
        this.entityManager = entityManager;
        this.clock = clock;
    }

    // Users

    @Override
    public User createUser(User user) {
        User entity = user.toBuilder().build();
        entityManager.persist(entity);
        entityManager.flush();
        return copy(entity);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<User> getUser(String id) {
        return userRepository.findById(id).map(JpaAuthStorage::copy);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<User> getUserByEmail(String email) {
        return userRepository.findByEmail(email).map(JpaAuthStorage::copy);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<User> getUserByResetToken(String resetToken) {
        return userRepository.findByLiveResetToken(resetToken, clock.instant()).map(JpaAuthStorage::copy);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<User> getUserByVerificationToken(String verificationToken) {
        return userRepository.findByLiveVerificationToken(verificationToken, clock.instant())
                .map(JpaAuthStorage::copy);
    }

    @Override
    public User updateUser(User user) {
        if (!userRepository.existsById(user.getId())) {
            throw new IllegalStateException("Unknown user: " + user.getId());
        }
        return copy(userRepository.saveAndFlush(user.toBuilder().build()));
    }

    @Override
    public Optional<User> deleteUser(String id) {
        Optional<User> user = userRepository.findById(id).map(JpaAuthStorage::copy);
        user.ifPresent(u -> {
            sessionRepository.deleteAllByUserId(id);
            accountRepository.deleteAllByUserId(id);
            userRepository.deleteById(id);
            log.info("User deleted: userId={}", id);
        });
        return user;
    }

    @Override
    public boolean consumeResetToken(String userId, String resetToken) {
        return userRepository.clearResetToken(userId, resetToken, clock.instant()) == 1;
    }

    @Override
    public boolean consumeVerificationToken(String userId, String verificationToken, Instant verifiedAt) {
        return userRepository.clearVerificationToken(userId, verificationToken, verifiedAt, clock.instant()) == 1;
    }

    // Accounts

    @Override
    public Account linkAccount(Account account) {
        Account entity = account.toBuilder().build();
        entityManager.persist(entity);
        entityManager.flush();
        return copy(entity);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> getAccount(String provider, String providerAccountId) {
        return accountRepository.findByProviderAndProviderAccountId(provider, providerAccountId)
                .map(JpaAuthStorage::copy);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<User> getUserByAccount(String provider, String providerAccountId) {
        return accountRepository.findByProviderAndProviderAccountId(provider, providerAccountId)
                .flatMap(a -> userRepository.findById(a.getUserId()))
                .map(JpaAuthStorage::copy);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> getAccountByUserAndProvider(String userId, String provider) {
        return accountRepository.findFirstByUserIdAndProvider(userId, provider).map(JpaAuthStorage::copy);
    }

    @Override
    public Account updateAccount(Account account) {
        if (!accountRepository.existsById(account.getId())) {
            throw new IllegalStateException("Unknown account: " + account.getId());
        }
        return copy(accountRepository.saveAndFlush(account.toBuilder().build()));
    }

    @Override
    public Optional<Account> unlinkAccount(String provider, String providerAccountId) {
        Optional<Account> account = accountRepository.findByProviderAndProviderAccountId(provider, providerAccountId);
        account.ifPresent(accountRepository::delete);
        return account.map(JpaAuthStorage::copy);
    }

    // Sessions

    @Override
    public Session createSession(Session session) {
        Session entity = session.toBuilder().build();
        entityManager.persist(entity);
        entityManager.flush();
        return copy(entity);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<SessionAndUser> getSessionAndUser(String sessionToken) {
        Instant now = clock.instant();
        return sessionRepository.findById(sessionToken)
                .filter(s -> !s.isExpired(now))
                .flatMap(s -> userRepository.findById(s.getUserId())
                        .map(u -> new SessionAndUser(copy(s), copy(u))));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Session> getSessionByRefreshToken(String refreshToken) {
        return sessionRepository.findByLiveRefreshToken(refreshToken, clock.instant()).map(JpaAuthStorage::copy);
    }

    @Override
    public Optional<Session> updateSession(Session session) {
        if (!sessionRepository.existsById(session.getSessionToken())) {
            return Optional.empty();
        }
        return Optional.of(copy(sessionRepository.saveAndFlush(session.toBuilder().build())));
    }

    @Override
    public Optional<Session> rotateRefreshToken(String currentRefreshToken, String newRefreshToken,
                                                Instant newRefreshTokenExpires, Instant newSessionExpires) {
        Optional<Session> current = sessionRepository.findByLiveRefreshToken(currentRefreshToken, clock.instant());
        if (current.isEmpty()) {
            return Optional.empty();
        }
        String sessionToken = current.get().getSessionToken();
        int swapped = sessionRepository.swapRefreshToken(sessionToken, currentRefreshToken, newRefreshToken,
                newRefreshTokenExpires, newSessionExpires);
        if (swapped != 1) {
            return Optional.empty();
        }
        return sessionRepository.findById(sessionToken).map(JpaAuthStorage::copy);
    }

    @Override
    public Optional<Session> deleteSession(String sessionToken) {
        Optional<Session> session = sessionRepository.findById(sessionToken).map(JpaAuthStorage::copy);
        if (session.isEmpty() || sessionRepository.deleteOne(sessionToken) != 1) {
            return Optional.empty();
        }
        return session;
    }

    @Override
    public int deleteUserSessions(String userId) {
        return sessionRepository.deleteAllByUserId(userId);
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

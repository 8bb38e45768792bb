package com.authplatform.authsvc.domain.reset;

import com.authplatform.authsvc.domain.engine.AuthEngineSettings;
import com.authplatform.authsvc.domain.model.Account;
import com.authplatform.authsvc.domain.model.User;
import com.authplatform.authsvc.domain.port.AuthStorage;
import com.authplatform.authsvc.domain.session.IssuedTokens;
import com.authplatform.authsvc.domain.session.SessionIssuer;
import com.authplatform.authsvc.shared.crypto.CredentialHasher;
import com.authplatform.authsvc.shared.crypto.SecretTokenGenerator;
import com.authplatform.authsvc.shared.exception.InvalidOrExpiredTokenException;
import com.authplatform.authsvc.shared.exception.UserNotFoundException;
import com.authplatform.authsvc.shared.validation.ValidationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Forgot-password flow: issue a single-use reset token, then trade it for a new password.
 */
@Slf4j
@Service
public class PasswordResetService {

    private final AuthStorage storage;
    private final ValidationService validationService;
    private final CredentialHasher credentialHasher;
    private final SecretTokenGenerator tokenGenerator;
    private final SessionIssuer sessionIssuer;
    private final AuthEngineSettings settings;

    public PasswordResetService(
            AuthStorage storage,
            ValidationService validationService,
            CredentialHasher credentialHasher,
            SecretTokenGenerator tokenGenerator,
            SessionIssuer sessionIssuer,
            AuthEngineSettings settings) {
        this.storage = storage;
        this.validationService = validationService;
        this.credentialHasher = credentialHasher;
        this.tokenGenerator = tokenGenerator;
        this.sessionIssuer = sessionIssuer;
        this.settings = settings;
    }

    /**
     * Stores a fresh reset token on the user, replacing any earlier one.
     *
     * @throws UserNotFoundException with a message that reads like success, for unknown emails
     */
    @Transactional
    public ResetTicket requestReset(String email) {
        validationService.requireAll("email", email);

        User user = storage.getUserByEmail(validationService.normalizeEmail(email))
                .orElseThrow(UserNotFoundException::new);

        String resetToken = tokenGenerator.generate(settings.tokenByteLength());
        Instant expiresAt = tokenGenerator.expiryFromNow(settings.resetTokenTtl());
        user.setResetToken(resetToken);
        user.setResetTokenExpiry(expiresAt);
        User updated = storage.updateUser(user);
        log.info("Password reset requested: userId={}", updated.getId());

        return new ResetTicket(updated, resetToken, expiresAt);
    }

    /**
     * Returns the owner of a live reset token without consuming it.
     */
    public User verifyResetToken(String resetToken) {
        validationService.requireAll("resetToken", resetToken);
        return resolve(resetToken).orElseThrow(InvalidOrExpiredTokenException::new);
    }

    /**
     * Consumes the reset token, replaces the password and signs the user in.
     */
    @Transactional
    public ResetResult resetPassword(String resetToken, String newPassword) {
        validationService.requireAll("resetToken", resetToken, "newPassword", newPassword);

        User user = resolve(resetToken).orElseThrow(InvalidOrExpiredTokenException::new);
        String passwordHash = credentialHasher.hash(newPassword);

        // Single use: only one caller gets to clear the token
        if (!storage.consumeResetToken(user.getId(), resetToken)) {
            log.debug("Reset token lost a concurrent redemption: userId={}", user.getId());
            throw new InvalidOrExpiredTokenException();
        }

        Optional<Account> existing = storage.getAccountByUserAndProvider(user.getId(), Account.CREDENTIALS_PROVIDER);
        if (existing.isPresent()) {
            Account account = existing.get();
            account.setPasswordHash(passwordHash);
            storage.updateAccount(account);
        } else {
            storage.linkAccount(Account.credentials(user.getId(), passwordHash));
            log.info("Credential account created on reset: userId={}", user.getId());
        }

        User current = storage.getUser(user.getId()).orElseGet(() -> {
            user.clearResetToken();
            return user;
        });
        log.info("Password reset completed: userId={}", current.getId());

        IssuedTokens tokens = sessionIssuer.issue(current);
        return new ResetResult(current, tokens);
    }

    private Optional<User> resolve(String resetToken) {
        return storage.getUserByResetToken(resetToken)
                .filter(user -> !tokenGenerator.isExpired(user.getResetTokenExpiry()));
    }

    public record ResetTicket(User user, String resetToken, Instant expiresAt) {
    }

    public record ResetResult(User user, IssuedTokens tokens) {
    }
}

package com.authplatform.authsvc.domain.verification;

import com.authplatform.authsvc.domain.engine.AuthEngineSettings;
import com.authplatform.authsvc.domain.model.User;
import com.authplatform.authsvc.domain.port.AuthStorage;
import com.authplatform.authsvc.shared.crypto.SecretTokenGenerator;
import com.authplatform.authsvc.shared.exception.EmailAlreadyVerifiedException;
import com.authplatform.authsvc.shared.exception.InvalidOrExpiredTokenException;
import com.authplatform.authsvc.shared.exception.UserNotFoundException;
import com.authplatform.authsvc.shared.validation.ValidationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Service for email verification.
 */
@Slf4j
@Service
public class EmailVerificationService {

    private final AuthStorage storage;
    private final ValidationService validationService;
    private final SecretTokenGenerator tokenGenerator;
    private final AuthEngineSettings settings;

    public EmailVerificationService(
            AuthStorage storage,
            ValidationService validationService,
            SecretTokenGenerator tokenGenerator,
            AuthEngineSettings settings) {
        this.storage = storage;
        this.validationService = validationService;
        this.tokenGenerator = tokenGenerator;
        this.settings = settings;
    }

    /**
     * Issues a new verification token; any earlier one stops working.
     */
    @Transactional
    public VerificationTicket sendVerification(String email) {
        validationService.requireAll("email", email);

        User user = storage.getUserByEmail(validationService.normalizeEmail(email))
                .orElseThrow(UserNotFoundException::new);
        if (user.isEmailVerified()) {
            throw new EmailAlreadyVerifiedException();
        }

        String token = tokenGenerator.generate(settings.tokenByteLength());
        Instant expiresAt = tokenGenerator.expiryFromNow(settings.verificationTokenTtl());
        user.setVerificationToken(token);
        user.setVerificationTokenExpiry(expiresAt);
        User updated = storage.updateUser(user);
        log.info("Verification token issued: userId={}", updated.getId());

        return new VerificationTicket(updated, token, expiresAt);
    }

    @Transactional
    public User verify(String verificationToken) {
        validationService.requireAll("verificationToken", verificationToken);

        User user = storage.getUserByVerificationToken(verificationToken)
                .filter(u -> !tokenGenerator.isExpired(u.getVerificationTokenExpiry()))
                .orElseThrow(InvalidOrExpiredTokenException::new);

        Instant verifiedAt = tokenGenerator.now();
        if (!storage.consumeVerificationToken(user.getId(), verificationToken, verifiedAt)) {
            throw new InvalidOrExpiredTokenException();
        }
        log.info("Email verified: userId={}", user.getId());

        return storage.getUser(user.getId()).orElseGet(() -> {
            user.markEmailVerified(verifiedAt);
            return user;
        });
    }

    public record VerificationTicket(User user, String verificationToken, Instant expiresAt) {
    }
}

package com.authplatform.authsvc.domain.registration;

import com.authplatform.authsvc.domain.engine.AuthEngineSettings;
import com.authplatform.authsvc.domain.hook.AuthEventPublisher;
import com.authplatform.authsvc.domain.model.Account;
import com.authplatform.authsvc.domain.model.User;
import com.authplatform.authsvc.domain.port.AuthStorage;
import com.authplatform.authsvc.domain.session.IssuedTokens;
import com.authplatform.authsvc.domain.session.SessionIssuer;
import com.authplatform.authsvc.shared.crypto.CredentialHasher;
import com.authplatform.authsvc.shared.crypto.SecretTokenGenerator;
import com.authplatform.authsvc.shared.exception.DuplicateUserException;
import com.authplatform.authsvc.shared.validation.ValidationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Creates a user with a credential account and signs them in straight away.
 */
@Slf4j
@Service
public class RegistrationService {

    private final AuthStorage storage;
    private final ValidationService validationService;
    private final CredentialHasher credentialHasher;
    private final SecretTokenGenerator tokenGenerator;
    private final SessionIssuer sessionIssuer;
    private final AuthEventPublisher events;
    private final AuthEngineSettings settings;

    public RegistrationService(
            AuthStorage storage,
            ValidationService validationService,
            CredentialHasher credentialHasher,
            SecretTokenGenerator tokenGenerator,
            SessionIssuer sessionIssuer,
            AuthEventPublisher events,
            AuthEngineSettings settings) {
        this.storage = storage;
        this.validationService = validationService;
        this.credentialHasher = credentialHasher;
        this.tokenGenerator = tokenGenerator;
        this.sessionIssuer = sessionIssuer;
        this.events = events;
        this.settings = settings;
    }

    @Transactional
    public RegistrationResult register(String email, String password, String name) {
        // Validate input
        validationService.validateRegistration(email, password, name).throwIfInvalid();
        String normalizedEmail = validationService.normalizeEmail(email);

        // Check email uniqueness
        if (storage.getUserByEmail(normalizedEmail).isPresent()) {
            throw new DuplicateUserException();
        }

        String passwordHash = credentialHasher.hash(password);
        String verificationToken = tokenGenerator.generate(settings.tokenByteLength());
        Instant verificationExpiry = tokenGenerator.expiryFromNow(settings.verificationTokenTtl());

        // Create user and credential account
        User user = storage.createUser(User.builder()
                .email(normalizedEmail)
                .name(validationService.normalizeDisplayName(name))
                .verificationToken(verificationToken)
                .verificationTokenExpiry(verificationExpiry)
                .build());
        storage.linkAccount(Account.credentials(user.getId(), passwordHash));
        log.info("User registered: userId={}", user.getId());

        events.userCreated(user);

        IssuedTokens tokens = sessionIssuer.issue(user);
        return new RegistrationResult(user, tokens, verificationToken, verificationExpiry);
    }

    /**
     * @param verificationToken raw token to deliver out of band; it is only ever returned here
     */
    public record RegistrationResult(User user, IssuedTokens tokens, String verificationToken,
                                     Instant verificationTokenExpiresAt) {
    }
}

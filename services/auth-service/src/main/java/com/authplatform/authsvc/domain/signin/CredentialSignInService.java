package com.authplatform.authsvc.domain.signin;

import com.authplatform.authsvc.domain.hook.AuthEventPublisher;
import com.authplatform.authsvc.domain.model.Account;
import com.authplatform.authsvc.domain.model.User;
import com.authplatform.authsvc.domain.port.AuthStorage;
import com.authplatform.authsvc.domain.session.IssuedTokens;
import com.authplatform.authsvc.domain.session.SessionIssuer;
import com.authplatform.authsvc.shared.crypto.CredentialHasher;
import com.authplatform.authsvc.shared.exception.InvalidCredentialsException;
import com.authplatform.authsvc.shared.validation.ValidationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Email and password sign-in.
 *
 * <p>An unknown email, a user without a credential account and a wrong password all fail
 * with the same {@link InvalidCredentialsException}. Unknown emails are still run through the
 * hasher so the three cases take comparable time.
 */
@Slf4j
@Service
public class CredentialSignInService {

    private static final String TIMING_PLACEHOLDER = "timing-placeholder-password";

    private final AuthStorage storage;
    private final ValidationService validationService;
    private final CredentialHasher credentialHasher;
    private final SessionIssuer sessionIssuer;
    private final AuthEventPublisher events;

    private volatile String placeholderHash;

    public CredentialSignInService(
            AuthStorage storage,
            ValidationService validationService,
            CredentialHasher credentialHasher,
            SessionIssuer sessionIssuer,
            AuthEventPublisher events) {
        this.storage = storage;
        this.validationService = validationService;
        this.credentialHasher = credentialHasher;
        this.sessionIssuer = sessionIssuer;
        this.events = events;
    }

    @Transactional
    public SignInResult signIn(String email, String password) {
        validationService.requireAll("email", email, "password", password);
        String normalizedEmail = validationService.normalizeEmail(email);

        Optional<User> user = storage.getUserByEmail(normalizedEmail);
        Optional<Account> account = user.flatMap(u ->
                storage.getAccountByUserAndProvider(u.getId(), Account.CREDENTIALS_PROVIDER));

        String passwordHash = account.map(Account::getPasswordHash).orElse(null);
        if (passwordHash == null) {
            credentialHasher.verify(password, placeholderHash());
            log.debug("Sign-in rejected: no credential account");
            throw new InvalidCredentialsException();
        }
        if (!credentialHasher.verify(password, passwordHash)) {
            log.debug("Sign-in rejected: password mismatch, userId={}", user.get().getId());
            throw new InvalidCredentialsException();
        }

        events.signedIn(user.get(), account.get());

        IssuedTokens tokens = sessionIssuer.issue(user.get());
        return new SignInResult(user.get(), tokens);
    }

    private String placeholderHash() {
        String hash = placeholderHash;
        if (hash == null) {
            hash = credentialHasher.hash(TIMING_PLACEHOLDER);
            placeholderHash = hash;
        }
        return hash;
    }

    public record SignInResult(User user, IssuedTokens tokens) {
    }
}

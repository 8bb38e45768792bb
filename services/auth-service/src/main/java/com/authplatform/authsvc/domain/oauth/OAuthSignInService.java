package com.authplatform.authsvc.domain.oauth;

import com.authplatform.authsvc.domain.engine.AuthEngineSettings;
import com.authplatform.authsvc.domain.hook.AuthEventPublisher;
import com.authplatform.authsvc.domain.model.Account;
import com.authplatform.authsvc.domain.model.AccountType;
import com.authplatform.authsvc.domain.model.User;
import com.authplatform.authsvc.domain.port.AuthStorage;
import com.authplatform.authsvc.domain.port.IdentityProvider;
import com.authplatform.authsvc.domain.port.OAuthProfile;
import com.authplatform.authsvc.domain.port.ProviderTokens;
import com.authplatform.authsvc.domain.session.IssuedTokens;
import com.authplatform.authsvc.domain.session.SessionIssuer;
import com.authplatform.authsvc.shared.crypto.SecretTokenGenerator;
import com.authplatform.authsvc.shared.exception.CsrfStateMismatchException;
import com.authplatform.authsvc.shared.exception.IdentityProviderException;
import com.authplatform.authsvc.shared.validation.ValidationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * OAuth2 authorization-code sign-in: builds the redirect, then on callback finds, links or
 * creates the local user.
 */
@Slf4j
@Service
public class OAuthSignInService {

    private final AuthStorage storage;
    private final IdentityProviderRegistry providers;
    private final ValidationService validationService;
    private final SecretTokenGenerator tokenGenerator;
    private final SessionIssuer sessionIssuer;
    private final AuthEventPublisher events;
    private final AuthEngineSettings settings;

    public OAuthSignInService(
            AuthStorage storage,
            IdentityProviderRegistry providers,
            ValidationService validationService,
            SecretTokenGenerator tokenGenerator,
            SessionIssuer sessionIssuer,
            AuthEventPublisher events,
            AuthEngineSettings settings) {
        this.storage = storage;
        this.providers = providers;
        this.validationService = validationService;
        this.tokenGenerator = tokenGenerator;
        this.sessionIssuer = sessionIssuer;
        this.events = events;
        this.settings = settings;
    }

    public AuthorizationRequest authorizationUrl(String providerId) {
        validationService.requireAll("provider", providerId);
        IdentityProvider provider = providers.resolve(providerId);

        String state = tokenGenerator.generate(settings.tokenByteLength());
        return new AuthorizationRequest(provider.authorizationUrl(state), state);
    }

    /**
     * Completes the flow. When {@code expectedState} is given it must be non-blank and match
     * {@code receivedState}; that check happens before anything else.
     */
    @Transactional
    public OAuthSignInResult handleCallback(String providerId, String code, String expectedState,
                                            String receivedState) {
        // CSRF check first, before any provider call
        if (expectedState != null
                && (expectedState.isBlank() || !tokenGenerator.matches(expectedState, receivedState))) {
            log.warn("OAuth state mismatch: provider={}", providerId);
            throw new CsrfStateMismatchException();
        }

        validationService.requireAll("provider", providerId, "code", code);
        IdentityProvider provider = providers.resolve(providerId);

        OAuthProfile profile = provider.exchangeCode(code);
        if (profile == null || profile.externalId() == null || profile.externalId().isBlank()) {
            throw new IdentityProviderException(providerId, "Provider returned no account id");
        }

        boolean isNewUser = false;
        User user;
        Account account;

        Optional<User> linked = storage.getUserByAccount(provider.id(), profile.externalId());
        if (linked.isPresent()) {
            user = linked.get();
            account = refreshProviderTokens(provider.id(), profile);
        } else {
            String email = validationService.normalizeEmail(profile.email());
            if (email == null || email.isBlank()) {
                throw new IdentityProviderException(providerId, "Provider returned no email address");
            }

            Optional<User> existing = storage.getUserByEmail(email);
            if (existing.isPresent()) {
                user = existing.get();
            } else {
                user = storage.createUser(User.builder()
                        .email(email)
                        .name(validationService.normalizeDisplayName(profile.name()))
                        .image(validationService.normalizeImageUrl(profile.avatarUrl()))
                        .emailVerified(tokenGenerator.now())
                        .build());
                isNewUser = true;
                log.info("User created from OAuth profile: userId={}, provider={}", user.getId(), provider.id());
                events.userCreated(user);
            }

            account = storage.linkAccount(oauthAccount(user.getId(), provider.id(), profile));
            log.info("OAuth account linked: userId={}, provider={}", user.getId(), provider.id());
            events.accountLinked(user, account);
        }

        events.signedIn(user, account);

        IssuedTokens tokens = sessionIssuer.issue(user);
        return new OAuthSignInResult(user, tokens, isNewUser);
    }

    private Account refreshProviderTokens(String providerId, OAuthProfile profile) {
        Optional<Account> account = storage.getAccount(providerId, profile.externalId());
        if (account.isEmpty() || profile.tokens() == null) {
            return account.orElse(null);
        }
        Account updated = account.get();
        applyTokens(updated, profile.tokens());
        return storage.updateAccount(updated);
    }

    private static Account oauthAccount(String userId, String providerId, OAuthProfile profile) {
        Account account = Account.builder()
                .userId(userId)
                .type(AccountType.OAUTH)
                .provider(providerId)
                .providerAccountId(profile.externalId())
                .build();
        if (profile.tokens() != null) {
            applyTokens(account, profile.tokens());
        }
        return account;
    }

    private static void applyTokens(Account account, ProviderTokens tokens) {
        account.setAccessToken(tokens.accessToken());
        if (tokens.refreshToken() != null) {
            account.setRefreshToken(tokens.refreshToken());
        }
        account.setExpiresAt(tokens.expiresAt());
        account.setTokenType(tokens.tokenType());
        account.setScope(tokens.scope());
        account.setIdToken(tokens.idToken());
    }

    public record AuthorizationRequest(String url, String state) {
    }

    public record OAuthSignInResult(User user, IssuedTokens tokens, boolean isNewUser) {
    }
}

package com.authplatform.authsvc.domain.port;

/**
 * A third-party identity provider speaking the OAuth2 authorization-code flow.
 */
public interface IdentityProvider {

    /**
     * Unique identifier, e.g. {@code google}.
     */
    String id();

    default ProviderType type() {
        return ProviderType.OAUTH;
    }

    /**
     * URL the user is redirected to, carrying {@code state} for CSRF protection.
     */
    String authorizationUrl(String state);

    /**
     * Exchanges an authorization code for the user's profile. Blocks on the network; timeouts
     * and retries are the implementation's concern.
     */
    OAuthProfile exchangeCode(String code);
}

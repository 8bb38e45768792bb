package com.authplatform.authsvc.domain.port;

/**
 * User profile normalized from a provider's user-info payload.
 *
 * @param externalId provider-scoped account id
 * @param tokens     provider tokens from the exchange, or null when the provider keeps them
 */
public record OAuthProfile(
        String externalId,
        String email,
        String name,
        String avatarUrl,
        ProviderTokens tokens
) {

    public OAuthProfile(String externalId, String email, String name, String avatarUrl) {
        this(externalId, email, name, avatarUrl, null);
    }
}

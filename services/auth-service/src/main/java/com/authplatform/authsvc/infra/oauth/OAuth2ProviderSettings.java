package com.authplatform.authsvc.infra.oauth;

import lombok.Builder;

import java.time.Duration;
import java.util.Objects;

/**
 * Endpoints and client credentials of one OAuth2 authorization-code provider.
 */
@Builder(toBuilder = true)
public record OAuth2ProviderSettings(
        String id,
        String clientId,
        String clientSecret,
        String authorizationUri,
        String tokenUri,
        String userInfoUri,
        String scope,
        String callbackUri,
        Duration connectTimeout,
        Duration requestTimeout
) {

    public OAuth2ProviderSettings {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(clientId, () -> "clientId is required for provider " + id);
        Objects.requireNonNull(clientSecret, () -> "clientSecret is required for provider " + id);
        Objects.requireNonNull(authorizationUri, () -> "authorizationUri is required for provider " + id);
        Objects.requireNonNull(tokenUri, () -> "tokenUri is required for provider " + id);
        Objects.requireNonNull(userInfoUri, () -> "userInfoUri is required for provider " + id);
        if (scope == null) scope = "";
        if (callbackUri == null) callbackUri = "http://localhost:8080/api/v1/auth/oauth/" + id + "/callback";
        if (connectTimeout == null) connectTimeout = Duration.ofSeconds(5);
        if (requestTimeout == null) requestTimeout = Duration.ofSeconds(10);
    }
}

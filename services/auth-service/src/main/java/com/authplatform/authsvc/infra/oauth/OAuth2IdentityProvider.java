package com.authplatform.authsvc.infra.oauth;

import com.authplatform.authsvc.domain.port.IdentityProvider;
import com.authplatform.authsvc.domain.port.OAuthProfile;
import com.authplatform.authsvc.domain.port.ProviderTokens;
import com.authplatform.authsvc.shared.exception.IdentityProviderException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Generic OAuth2 authorization-code provider: form-encoded POST to the token endpoint, then a
 * bearer GET on the user-info endpoint. Both calls run inside the provider's circuit breaker.
 */
@Slf4j
public class OAuth2IdentityProvider implements IdentityProvider {

    private static final String USER_AGENT = "auth-service";

    private final OAuth2ProviderSettings settings;
    private final ProfileMapper profileMapper;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;
    private final Clock clock;

    public OAuth2IdentityProvider(
            OAuth2ProviderSettings settings,
            ProfileMapper profileMapper,
            HttpClient httpClient,
            ObjectMapper objectMapper,
            CircuitBreaker circuitBreaker,
            Clock clock) {
        this.settings = settings;
        this.profileMapper = profileMapper;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.circuitBreaker = circuitBreaker;
        this.clock = clock;
    }

    @Override
    public String id() {
        return settings.id();
    }

    @Override
    public String authorizationUrl(String state) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", settings.clientId());
        params.put("redirect_uri", settings.callbackUri());
        params.put("response_type", "code");
        params.put("scope", settings.scope());
        if (state != null) {
            params.put("state", state);
        }
        String separator = settings.authorizationUri().contains("?") ? "&" : "?";
        return settings.authorizationUri() + separator + formEncode(params);
    }

    @Override
    public OAuthProfile exchangeCode(String code) {
        try {
            return circuitBreaker.executeSupplier(() -> fetchProfile(code));
        } catch (CallNotPermittedException e) {
            log.warn("Identity provider circuit open: provider={}", id());
            throw new IdentityProviderException(id(), "Identity provider temporarily unavailable", e);
        }
    }

    private OAuthProfile fetchProfile(String code) {
        ProviderTokens tokens = exchangeCodeForTokens(code);
        JsonNode userInfo = fetchUserInfo(tokens.accessToken());
        OAuthProfile profile = profileMapper.map(userInfo, tokens);
        log.debug("Profile fetched: provider={}, externalId={}", id(), profile.externalId());
        return profile;
    }

    private ProviderTokens exchangeCodeForTokens(String code) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "authorization_code");
        form.put("code", code);
        form.put("redirect_uri", settings.callbackUri());
        form.put("client_id", settings.clientId());
        form.put("client_secret", settings.clientSecret());

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(settings.tokenUri()))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Accept", "application/json")
                .header("User-Agent", USER_AGENT)
                .POST(HttpRequest.BodyPublishers.ofString(formEncode(form)))
                .timeout(settings.requestTimeout())
                .build();

        JsonNode json = send(request, "Failed to exchange authorization code");
        String accessToken = ProfileMapper.text(json, "access_token");
        if (accessToken == null) {
            throw new IdentityProviderException(id(), "No access token received from identity provider");
        }

        Instant expiresAt = null;
        if (json.path("expires_in").canConvertToLong()) {
            expiresAt = clock.instant().plusSeconds(json.path("expires_in").asLong());
        }
        return new ProviderTokens(
                accessToken,
                ProfileMapper.text(json, "refresh_token"),
                expiresAt,
                ProfileMapper.text(json, "token_type"),
                ProfileMapper.text(json, "scope"),
                ProfileMapper.text(json, "id_token"));
    }

    private JsonNode fetchUserInfo(String accessToken) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(settings.userInfoUri()))
                .header("Authorization", "Bearer " + accessToken)
                .header("Accept", "application/json")
                .header("User-Agent", USER_AGENT)
                .GET()
                .timeout(settings.requestTimeout())
                .build();
        return send(request, "Failed to get user profile");
    }

    private JsonNode send(HttpRequest request, String failureMessage) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new IdentityProviderException(id(), failureMessage + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IdentityProviderException(id(), failureMessage + ": interrupted", e);
        }

        if (response.statusCode() / 100 != 2) {
            log.error("Identity provider returned {}: provider={}, uri={}", response.statusCode(), id(),
                    request.uri());
            throw new IdentityProviderException(id(), failureMessage + " (HTTP " + response.statusCode() + ")");
        }

        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new IdentityProviderException(id(), failureMessage + ": malformed response", e);
        }
    }

    private static String formEncode(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }
}

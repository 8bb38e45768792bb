package com.authplatform.authsvc.config;

import com.authplatform.authsvc.domain.oauth.IdentityProviderRegistry;
import com.authplatform.authsvc.domain.port.IdentityProvider;
import com.authplatform.authsvc.infra.oauth.OAuth2IdentityProvider;
import com.authplatform.authsvc.infra.oauth.OAuth2ProviderSettings;
import com.authplatform.authsvc.infra.oauth.ProfileMapper;
import com.authplatform.authsvc.infra.oauth.ProviderPreset;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds one {@link OAuth2IdentityProvider} per entry under {@code app.auth.oauth.providers},
 * plus any {@link IdentityProvider} beans declared elsewhere.
 */
@Slf4j
@Configuration
public class OAuthConfig {

    @Bean
    public CircuitBreakerRegistry oauthCircuitBreakerRegistry() {
        return CircuitBreakerRegistry.of(CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .build());
    }

    @Bean
    public HttpClient oauthHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Bean
    public IdentityProviderRegistry identityProviderRegistry(
            AuthProperties properties,
            HttpClient oauthHttpClient,
            ObjectMapper objectMapper,
            CircuitBreakerRegistry oauthCircuitBreakerRegistry,
            Clock clock,
            ObjectProvider<IdentityProvider> customProviders) {
        List<IdentityProvider> providers = new ArrayList<>();
        for (Map.Entry<String, AuthProperties.Provider> entry : properties.oauth().providers().entrySet()) {
            String id = entry.getKey();
            AuthProperties.Provider config = entry.getValue();
            Optional<ProviderPreset> preset = ProviderPreset.fromName(config.preset() != null ? config.preset() : id);

            OAuth2ProviderSettings settings = toSettings(id, config, preset);
            ProfileMapper mapper = preset.map(ProviderPreset::profileMapper).orElseGet(ProfileMapper::standard);
            providers.add(new OAuth2IdentityProvider(settings, mapper, oauthHttpClient, objectMapper,
                    oauthCircuitBreakerRegistry.circuitBreaker("oauth-" + id), clock));
            log.info("OAuth provider registered: id={}, preset={}", id, preset.map(Enum::name).orElse("none"));
        }
        customProviders.orderedStream().forEach(providers::add);
        return new IdentityProviderRegistry(providers);
    }

    static OAuth2ProviderSettings toSettings(String id, AuthProperties.Provider config,
                                             Optional<ProviderPreset> preset) {
        OAuth2ProviderSettings.OAuth2ProviderSettingsBuilder builder = preset
                .map(p -> p.settings(id, config.clientId(), config.clientSecret(), config.tenant()))
                .orElseGet(() -> OAuth2ProviderSettings.builder()
                        .id(id)
                        .clientId(config.clientId())
                        .clientSecret(config.clientSecret()));
        if (config.authorizationUri() != null) builder.authorizationUri(config.authorizationUri());
        if (config.tokenUri() != null) builder.tokenUri(config.tokenUri());
        if (config.userInfoUri() != null) builder.userInfoUri(config.userInfoUri());
        if (config.scope() != null) builder.scope(config.scope());
        if (config.callbackUri() != null) builder.callbackUri(config.callbackUri());
        return builder.build();
    }
}

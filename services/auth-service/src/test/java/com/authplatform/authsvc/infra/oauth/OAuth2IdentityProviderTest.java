package com.authplatform.authsvc.infra.oauth;

import com.authplatform.authsvc.domain.port.OAuthProfile;
import com.authplatform.authsvc.shared.exception.IdentityProviderException;
import com.authplatform.authsvc.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OAuth2IdentityProviderTest {

    private final MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
    private final AtomicReference<String> tokenRequestBody = new AtomicReference<>();
    private final AtomicReference<String> userInfoAuthorization = new AtomicReference<>();
    private final AtomicInteger tokenCalls = new AtomicInteger();

    private HttpServer server;
    private volatile int tokenStatus = 200;
    private volatile String tokenResponse =
            "{\"access_token\":\"gho_abc\",\"token_type\":\"bearer\",\"scope\":\"read:user\",\"expires_in\":3600}";
    private volatile String userInfoResponse =
            "{\"id\":4242,\"login\":\"erin\",\"email\":\"erin@example.com\",\"avatar_url\":\"https://a.example.com/e.png\"}";

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/token", exchange -> {
            tokenCalls.incrementAndGet();
            tokenRequestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, tokenStatus, tokenResponse);
        });
        server.createContext("/user", exchange -> {
            userInfoAuthorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            respond(exchange, 200, userInfoResponse);
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private OAuth2IdentityProvider github(CircuitBreaker circuitBreaker) {
        String base = "http://127.0.0.1:" + server.getAddress().getPort();
        OAuth2ProviderSettings settings = ProviderPreset.GITHUB.settings("github", "client-1", "s3cret", null)
                .tokenUri(base + "/token")
                .userInfoUri(base + "/user")
                .callbackUri("https://app.example.com/cb")
                .build();
        return new OAuth2IdentityProvider(settings, ProviderPreset.GITHUB.profileMapper(),
                HttpClient.newHttpClient(), new ObjectMapper(), circuitBreaker, clock);
    }

    private OAuth2IdentityProvider github() {
        return github(CircuitBreaker.ofDefaults("test"));
    }

    @Test
    void authorizationUrlCarriesClientRedirectScopeAndState() {
        String url = github().authorizationUrl("st4te");

        assertThat(url).startsWith("https://github.com/login/oauth/authorize?")
                .contains("client_id=client-1")
                .contains("redirect_uri=https%3A%2F%2Fapp.example.com%2Fcb")
                .contains("response_type=code")
                .contains("scope=read%3Auser+user%3Aemail")
                .endsWith("state=st4te");
    }

    @Test
    void exchangesCodeAndMapsTheProfile() {
        OAuthProfile profile = github().exchangeCode("the-code");

        assertThat(tokenRequestBody.get())
                .contains("grant_type=authorization_code")
                .contains("code=the-code")
                .contains("client_secret=s3cret");
        assertThat(userInfoAuthorization.get()).isEqualTo("Bearer gho_abc");

        assertThat(profile.externalId()).isEqualTo("4242");
        assertThat(profile.email()).isEqualTo("erin@example.com");
        assertThat(profile.name()).isEqualTo("erin");
        assertThat(profile.avatarUrl()).isEqualTo("https://a.example.com/e.png");
        assertThat(profile.tokens().accessToken()).isEqualTo("gho_abc");
        assertThat(profile.tokens().expiresAt()).isEqualTo(Instant.parse("2024-01-01T01:00:00Z"));
    }

    @Test
    void tokenEndpointErrorsBecomeProviderFailures() {
        tokenStatus = 401;
        tokenResponse = "{\"error\":\"bad_verification_code\"}";

        assertThatThrownBy(() -> github().exchangeCode("stale"))
                .isInstanceOf(IdentityProviderException.class)
                .hasMessageContaining("HTTP 401");
    }

    @Test
    void missingAccessTokenIsAProviderFailure() {
        tokenResponse = "{\"error\":\"bad_verification_code\"}";

        assertThatThrownBy(() -> github().exchangeCode("stale"))
                .isInstanceOf(IdentityProviderException.class)
                .hasMessageContaining("No access token");
    }

    @Test
    void openCircuitStopsCallingTheProvider() {
        tokenStatus = 500;
        CircuitBreaker breaker = CircuitBreaker.of("github", CircuitBreakerConfig.custom()
                .slidingWindowSize(2)
                .minimumNumberOfCalls(2)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofMinutes(1))
                .build());
        OAuth2IdentityProvider provider = github(breaker);

        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> provider.exchangeCode("c")).isInstanceOf(IdentityProviderException.class);
        }
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);

        assertThatThrownBy(() -> provider.exchangeCode("c"))
                .isInstanceOf(IdentityProviderException.class)
                .hasMessageContaining("temporarily unavailable");
        assertThat(tokenCalls.get()).isEqualTo(2);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}

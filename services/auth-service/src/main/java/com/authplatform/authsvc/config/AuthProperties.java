package com.authplatform.authsvc.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Map;

/**
 * Settings bound from {@code app.auth.*}. Missing sections fall back to their defaults in the
 * compact constructors, which run before bean validation.
 *
 * <pre>
 * app:
 *   auth:
 *     secret: ${AUTH_SECRET}
 *     storage: jpa
 *     session:
 *       strategy: database
 *       refresh-token:
 *         enabled: true
 *     oauth:
 *       providers:
 *         github:
 *           preset: github
 *           client-id: ...
 *           client-secret: ...
 * </pre>
 *
 * @param secret  HMAC signing secret; required unless an RSA algorithm is configured
 * @param storage {@code jpa} or {@code memory}
 */
@ConfigurationProperties(prefix = "app.auth")
@Validated
public record AuthProperties(
        String secret,
        @Pattern(regexp = "jpa|memory") String storage,
        @Valid Session session,
        @Valid Jwt jwt,
        @Valid Password password,
        @Valid Tokens tokens,
        @Valid RateLimit rateLimit,
        @Valid OAuth oauth
) {

    public AuthProperties {
        if (storage == null || storage.isBlank()) storage = "jpa";
        if (session == null) session = new Session(null, null, null);
        if (jwt == null) jwt = new Jwt(null, null, null, null, null);
        if (password == null) password = new Password(null, 0, 0, 0, 0);
        if (tokens == null) tokens = new Tokens(0, null, null);
        if (rateLimit == null) rateLimit = new RateLimit(null, 0, 0, 0, 0);
        if (oauth == null) oauth = new OAuth(null, null, null);
    }

    /**
     * @param strategy {@code jwt} (stateless) or {@code database}
     */
    public record Session(
            @Pattern(regexp = "jwt|database") String strategy,
            Duration maxAge,
            RefreshToken refreshToken
    ) {
        public Session {
            if (strategy == null || strategy.isBlank()) strategy = "jwt";
            if (maxAge == null) maxAge = Duration.ofDays(30);
            if (refreshToken == null) refreshToken = new RefreshToken(false, null);
        }
    }

    public record RefreshToken(boolean enabled, Duration maxAge) {
        public RefreshToken {
            if (maxAge == null) maxAge = Duration.ofDays(30);
        }
    }

    /**
     * @param privateKey PKCS#8 PEM, RSA algorithms only
     * @param publicKey  X.509 PEM, RSA algorithms only
     */
    public record Jwt(
            @Pattern(regexp = "HS256|HS384|HS512|RS256|RS384|RS512") String algorithm,
            String issuer,
            String audience,
            String privateKey,
            String publicKey
    ) {
        public Jwt {
            if (algorithm == null || algorithm.isBlank()) algorithm = "HS256";
            issuer = blankToNull(issuer);
            audience = blankToNull(audience);
            privateKey = blankToNull(privateKey);
            publicKey = blankToNull(publicKey);
        }
    }

    /**
     * OWASP argon2id defaults: 3 iterations, 64 MiB, parallelism 4.
     */
    public record Password(
            @Pattern(regexp = "bcrypt|argon2id") String algorithm,
            @Min(4) int bcryptCost,
            @Min(1) int argon2Iterations,
            @Min(8) int argon2MemoryKb,
            @Min(1) int argon2Parallelism
    ) {
        public Password {
            if (algorithm == null || algorithm.isBlank()) algorithm = "bcrypt";
            if (bcryptCost <= 0) bcryptCost = 10;
            if (argon2Iterations <= 0) argon2Iterations = 3;
            if (argon2MemoryKb <= 0) argon2MemoryKb = 65536;
            if (argon2Parallelism <= 0) argon2Parallelism = 4;
        }
    }

    public record Tokens(@Min(16) @Max(64) int byteLength, Duration resetTtl, Duration verificationTtl) {
        public Tokens {
            if (byteLength <= 0) byteLength = 32;
            if (resetTtl == null) resetTtl = Duration.ofHours(1);
            if (verificationTtl == null) verificationTtl = Duration.ofHours(24);
        }
    }

    public record RateLimit(
            Boolean enabled,
            int registerPerMinute,
            int signInPerMinute,
            int passwordResetPerMinute,
            int verificationSendPerMinute
    ) {
        public RateLimit {
            if (enabled == null) enabled = Boolean.TRUE;
            if (registerPerMinute <= 0) registerPerMinute = 5;
            if (signInPerMinute <= 0) signInPerMinute = 10;
            if (passwordResetPerMinute <= 0) passwordResetPerMinute = 3;
            if (verificationSendPerMinute <= 0) verificationSendPerMinute = 3;
        }
    }

    /**
     * @param stateMaxAge  lifetime of the state cookie set by the authorize endpoint
     * @param secureCookie whether the state cookie is marked Secure
     */
    public record OAuth(Map<String, @Valid Provider> providers, Duration stateMaxAge, Boolean secureCookie) {
        public OAuth {
            providers = providers == null ? Map.of() : Map.copyOf(providers);
            if (stateMaxAge == null) stateMaxAge = Duration.ofMinutes(10);
            if (secureCookie == null) secureCookie = Boolean.TRUE;
        }
    }

    /**
     * One OAuth2 registration. With a {@code preset} only the client credentials are needed;
     * any endpoint given here overrides the preset's.
     */
    public record Provider(
            String preset,
            String clientId,
            String clientSecret,
            String authorizationUri,
            String tokenUri,
            String userInfoUri,
            String scope,
            String callbackUri,
            String tenant
    ) {
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}

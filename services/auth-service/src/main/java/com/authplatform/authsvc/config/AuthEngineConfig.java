package com.authplatform.authsvc.config;

import com.authplatform.authsvc.domain.engine.AuthEngineSettings;
import com.authplatform.authsvc.domain.engine.SessionStrategy;
import com.authplatform.authsvc.domain.hook.AuthCallbackChain;
import com.authplatform.authsvc.domain.hook.AuthCallbacks;
import com.authplatform.authsvc.domain.hook.AuthEventPublisher;
import com.authplatform.authsvc.domain.hook.AuthEvents;
import com.authplatform.authsvc.domain.port.TokenDelivery;
import com.authplatform.authsvc.infra.delivery.LoggingTokenDelivery;
import com.authplatform.authsvc.shared.crypto.Argon2idCredentialHasher;
import com.authplatform.authsvc.shared.crypto.BcryptCredentialHasher;
import com.authplatform.authsvc.shared.crypto.CredentialHasher;
import com.authplatform.authsvc.shared.crypto.JwtAlgorithm;
import com.authplatform.authsvc.shared.crypto.SigningKeys;
import com.authplatform.authsvc.shared.security.SecurityUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Locale;

/**
 * Turns {@link AuthProperties} into the engine's collaborators.
 */
@Slf4j
@Configuration
public class AuthEngineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CredentialHasher credentialHasher(AuthProperties properties) {
        AuthProperties.Password password = properties.password();
        if ("argon2id".equals(password.algorithm())) {
            log.info("Password hashing: argon2id (iterations={}, memoryKb={}, parallelism={})",
                    password.argon2Iterations(), password.argon2MemoryKb(), password.argon2Parallelism());
            return new Argon2idCredentialHasher(password.argon2Iterations(), password.argon2MemoryKb(),
                    password.argon2Parallelism());
        }
        log.info("Password hashing: bcrypt (cost={})", password.bcryptCost());
        return new BcryptCredentialHasher(password.bcryptCost());
    }

    @Bean
    public AuthEngineSettings authEngineSettings(AuthProperties properties) {
        return toSettings(properties);
    }

    @Bean
    public AuthEventPublisher authEventPublisher(ObjectProvider<AuthEvents> listeners) {
        return new AuthEventPublisher(listeners.orderedStream().toList());
    }

    @Bean
    public AuthCallbackChain authCallbackChain(ObjectProvider<AuthCallbacks> callbacks) {
        return new AuthCallbackChain(callbacks.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean(TokenDelivery.class)
    public TokenDelivery tokenDelivery(SecurityUtils securityUtils) {
        return new LoggingTokenDelivery(securityUtils);
    }

    /**
     * Validates the bound properties and builds the immutable engine settings. Fails at startup
     * on a missing or short secret, or on missing RSA keys.
     */
    static AuthEngineSettings toSettings(AuthProperties properties) {
        AuthProperties.Jwt jwt = properties.jwt();
        JwtAlgorithm algorithm = JwtAlgorithm.valueOf(jwt.algorithm());

        SigningKeys keys;
        if (algorithm.isHmac()) {
            if (properties.secret() == null || properties.secret().isBlank()) {
                throw new IllegalStateException("app.auth.secret is required for " + algorithm);
            }
            keys = SigningKeys.hmac(algorithm, properties.secret());
        } else {
            keys = SigningKeys.rsa(algorithm, jwt.privateKey(), jwt.publicKey());
        }

        AuthProperties.Session session = properties.session();
        AuthProperties.Tokens tokens = properties.tokens();
        return AuthEngineSettings.builder()
                .signingKeys(keys)
                .sessionStrategy(SessionStrategy.valueOf(session.strategy().toUpperCase(Locale.ROOT)))
                .sessionMaxAge(session.maxAge())
                .refreshTokensEnabled(session.refreshToken().enabled())
                .refreshTokenMaxAge(session.refreshToken().maxAge())
                .issuer(jwt.issuer())
                .audience(jwt.audience())
                .tokenByteLength(tokens.byteLength())
                .resetTokenTtl(tokens.resetTtl())
                .verificationTokenTtl(tokens.verificationTtl())
                .build();
    }
}

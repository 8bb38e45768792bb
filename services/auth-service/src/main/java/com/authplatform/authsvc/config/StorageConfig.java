package com.authplatform.authsvc.config;

import com.authplatform.authsvc.domain.port.AuthStorage;
import com.authplatform.authsvc.infra.memory.InMemoryAuthStorage;
import com.authplatform.authsvc.infra.persistence.AccountRepository;
import com.authplatform.authsvc.infra.persistence.JpaAuthStorage;
import com.authplatform.authsvc.infra.persistence.SessionRepository;
import com.authplatform.authsvc.infra.persistence.UserRepository;
import jakarta.persistence.EntityManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Picks the {@link AuthStorage} binding from {@code app.auth.storage}.
 */
@Slf4j
@Configuration
public class StorageConfig {

    @Bean
    @ConditionalOnProperty(name = "app.auth.storage", havingValue = "jpa", matchIfMissing = true)
    public AuthStorage jpaAuthStorage(
            UserRepository userRepository,
            AccountRepository accountRepository,
            SessionRepository sessionRepository,
            EntityManager entityManager,
            Clock clock) {
        log.info("Auth storage: jpa");
        return new JpaAuthStorage(userRepository, accountRepository, sessionRepository, entityManager, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "app.auth.storage", havingValue = "memory")
    public AuthStorage inMemoryAuthStorage(Clock clock) {
        log.warn("Auth storage: in-memory; all users and sessions are lost on restart");
        return new InMemoryAuthStorage(clock);
    }
}

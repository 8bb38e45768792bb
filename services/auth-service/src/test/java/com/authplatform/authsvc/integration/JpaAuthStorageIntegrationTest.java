package com.authplatform.authsvc.integration;

import com.authplatform.authsvc.domain.model.User;
import com.authplatform.authsvc.domain.port.AuthStorage;
import com.authplatform.authsvc.infra.AuthStorageContract;
import com.authplatform.authsvc.infra.persistence.AccountRepository;
import com.authplatform.authsvc.infra.persistence.JpaAuthStorage;
import com.authplatform.authsvc.infra.persistence.SessionRepository;
import com.authplatform.authsvc.infra.persistence.UserRepository;
import com.authplatform.authsvc.shared.validation.ValidationService;
import com.authplatform.authsvc.support.MutableClock;
import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the storage contract against PostgreSQL with the Flyway schema.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Testcontainers(disabledWithoutDocker = true)
@Import(JpaAuthStorageIntegrationTest.StorageTestConfig.class)
class JpaAuthStorageIntegrationTest extends AuthStorageContract {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(
            DockerImageName.parse("postgres:16-alpine"))
            .withDatabaseName("auth_service_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.flyway.enabled", () -> "true");
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "none");
    }

    @Autowired
    private AuthStorage storage;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void resetClock() {
        clock.set(START);
    }

    @Override
    protected AuthStorage storage() {
        return storage;
    }

    @Override
    protected MutableClock clock() {
        return clock;
    }

    @Test
    void persistsLongestNormalizedNames() {
        ValidationService validation = new ValidationService();
        String quotes = validation.normalizeDisplayName("'".repeat(100));
        String providerName = validation.normalizeDisplayName("P".repeat(150));

        User typed = storage.createUser(User.builder().email("quotes@example.com").name(quotes).build());
        User linked = storage.createUser(User.builder().email("provider@example.com").name(providerName)
                .image(validation.normalizeImageUrl("https://img.example.com/" + "a".repeat(2100))).build());

        assertThat(storage.getUser(typed.getId())).get()
                .satisfies(u -> assertThat(u.getName()).isEqualTo("'".repeat(100)));
        assertThat(storage.getUser(linked.getId())).get()
                .satisfies(u -> {
                    assertThat(u.getName()).isEqualTo("P".repeat(100));
                    assertThat(u.getImage()).isNull();
                });
    }

    @TestConfiguration
    static class StorageTestConfig {

        @Bean
        MutableClock clock() {
            return new MutableClock(START);
        }

        @Bean
        AuthStorage jpaAuthStorage(UserRepository users, AccountRepository accounts, SessionRepository sessions,
                                   EntityManager entityManager, MutableClock clock) {
            return new JpaAuthStorage(users, accounts, sessions, entityManager, clock);
        }
    }
}

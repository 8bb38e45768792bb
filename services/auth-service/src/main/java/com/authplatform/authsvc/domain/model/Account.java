package com.authplatform.authsvc.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Links a {@link User} to one way of signing in. A credential account holds the password
 * hash; an OAuth account holds whatever tokens the provider handed back on code exchange.
 */
@Entity
@Table(name = "accounts", uniqueConstraints = @UniqueConstraint(
        name = "uk_accounts_provider_account", columnNames = {"provider", "provider_account_id"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Account {

    public static final String CREDENTIALS_PROVIDER = "credentials";

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AccountType type;

    @Column(nullable = false, length = 50)
    private String provider;

    @Column(name = "provider_account_id", nullable = false)
    private String providerAccountId;

    @Column(name = "password_hash")
    private String passwordHash;

    @Column(name = "access_token", length = 4096)
    private String accessToken;

    @Column(name = "refresh_token", length = 4096)
    private String refreshToken;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "token_type", length = 50)
    private String tokenType;

    @Column(length = 1024)
    private String scope;

    @Column(name = "id_token", length = 8192)
    private String idToken;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isCredentials() {
        return type == AccountType.CREDENTIALS;
    }

    public static Account credentials(String userId, String passwordHash) {
        return Account.builder()
                .userId(userId)
                .type(AccountType.CREDENTIALS)
                .provider(CREDENTIALS_PROVIDER)
                .providerAccountId(userId)
                .passwordHash(passwordHash)
                .build();
    }
}

package com.authplatform.authsvc.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "sessions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Session {

    @Id
    @Column(name = "session_token", length = 128)
    private String sessionToken;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(name = "expires_at", nullable = false)
    private Instant expires;

    @Column(name = "refresh_token", unique = true, length = 128)
    private String refreshToken;

    @Column(name = "refresh_token_expires_at")
    private Instant refreshTokenExpires;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    /**
     * Expired from the {@code expires} instant onward.
     */
    public boolean isExpired(Instant now) {
        return expires == null || !now.isBefore(expires);
    }
}

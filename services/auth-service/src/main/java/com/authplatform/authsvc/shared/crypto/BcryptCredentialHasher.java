package com.authplatform.authsvc.shared.crypto;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

/**
 * BCrypt with a per-deployment cost factor (default 10).
 */
@Slf4j
public class BcryptCredentialHasher implements CredentialHasher {

    public static final int DEFAULT_COST = 10;

    private final BCryptPasswordEncoder encoder;

    public BcryptCredentialHasher() {
        this(DEFAULT_COST);
    }

    public BcryptCredentialHasher(int cost) {
        this.encoder = new BCryptPasswordEncoder(cost);
    }

    @Override
    public String hash(String plainPassword) {
        if (plainPassword == null || plainPassword.isEmpty()) {
            throw new IllegalArgumentException("Password cannot be null or empty");
        }
        return encoder.encode(plainPassword);
    }

    @Override
    public boolean verify(String plainPassword, String hash) {
        if (plainPassword == null || hash == null) {
            return false;
        }
        try {
            return encoder.matches(plainPassword, hash);
        } catch (IllegalArgumentException e) {
            log.debug("BCrypt verification rejected input: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String algorithm() {
        return "bcrypt";
    }
}

package com.authplatform.authsvc.shared.crypto;

import de.mkammerer.argon2.Argon2;
import de.mkammerer.argon2.Argon2Factory;
import lombok.extern.slf4j.Slf4j;

/**
 * Argon2id with OWASP-recommended parameters.
 */
@Slf4j
public class Argon2idCredentialHasher implements CredentialHasher {

    private final Argon2 argon2;
    private final int iterations;
    private final int memoryKb;
    private final int parallelism;

    public Argon2idCredentialHasher(int iterations, int memoryKb, int parallelism) {
        this.argon2 = Argon2Factory.create(Argon2Factory.Argon2Types.ARGON2id);
        this.iterations = iterations;
        this.memoryKb = memoryKb;
        this.parallelism = parallelism;
    }

    /**
     * Returns a string starting with $argon2id$ containing algorithm parameters.
     */
    @Override
    public String hash(String plainPassword) {
        if (plainPassword == null || plainPassword.isEmpty()) {
            throw new IllegalArgumentException("Password cannot be null or empty");
        }
        return argon2.hash(iterations, memoryKb, parallelism, plainPassword.toCharArray());
    }

    @Override
    public boolean verify(String plainPassword, String hash) {
        if (plainPassword == null || hash == null || !isArgon2idHash(hash)) {
            return false;
        }
        try {
            return argon2.verify(hash, plainPassword.toCharArray());
        } catch (RuntimeException e) {
            log.debug("Argon2 verification rejected hash: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String algorithm() {
        return "argon2id";
    }

    public boolean isArgon2idHash(String hash) {
        return hash != null && hash.startsWith("$argon2id$");
    }
}

package com.authplatform.authsvc.shared.crypto;

/**
 * One-way salted password hashing.
 */
public interface CredentialHasher {

    /**
     * @throws IllegalArgumentException if the password is null or empty
     */
    String hash(String plainPassword);

    /**
     * Constant-time check of a password against a stored hash. Never throws; a malformed
     * or missing hash simply does not verify.
     */
    boolean verify(String plainPassword, String hash);

    /**
     * Algorithm identifier, e.g. {@code bcrypt} or {@code argon2id}.
     */
    String algorithm();
}

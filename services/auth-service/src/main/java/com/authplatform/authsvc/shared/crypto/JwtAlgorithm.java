package com.authplatform.authsvc.shared.crypto;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.SecureDigestAlgorithm;

import java.util.Arrays;
import java.util.Optional;

/**
 * Signing algorithms accepted for session tokens.
 */
public enum JwtAlgorithm {

    HS256(Jwts.SIG.HS256, "HmacSHA256", 256),
    HS384(Jwts.SIG.HS384, "HmacSHA384", 384),
    HS512(Jwts.SIG.HS512, "HmacSHA512", 512),
    RS256(Jwts.SIG.RS256, "RSA", 2048),
    RS384(Jwts.SIG.RS384, "RSA", 2048),
    RS512(Jwts.SIG.RS512, "RSA", 2048);

    private final SecureDigestAlgorithm<?, ?> signatureAlgorithm;
    private final String jcaName;
    private final int minKeyBits;

    JwtAlgorithm(SecureDigestAlgorithm<?, ?> signatureAlgorithm, String jcaName, int minKeyBits) {
        this.signatureAlgorithm = signatureAlgorithm;
        this.jcaName = jcaName;
        this.minKeyBits = minKeyBits;
    }

    public SecureDigestAlgorithm<?, ?> signatureAlgorithm() {
        return signatureAlgorithm;
    }

    public String jcaName() {
        return jcaName;
    }

    public int minKeyBits() {
        return minKeyBits;
    }

    public boolean isHmac() {
        return name().startsWith("HS");
    }

    /**
     * Looks up an algorithm by its JWA header name ({@code "HS256"} etc.).
     */
    public static Optional<JwtAlgorithm> fromHeader(String alg) {
        if (alg == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(a -> a.name().equals(alg))
                .findFirst();
    }
}

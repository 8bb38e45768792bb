package com.authplatform.authsvc.shared.crypto;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.KeyFactory;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import javax.crypto.spec.SecretKeySpec;

/**
 * The key pair used to sign and verify session tokens. For HMAC both halves are the same
 * secret key.
 */
public record SigningKeys(JwtAlgorithm algorithm, Key signingKey, Key verificationKey) {

    public static SigningKeys hmac(JwtAlgorithm algorithm, String secret) {
        if (!algorithm.isHmac()) {
            throw new IllegalArgumentException(algorithm + " is not an HMAC algorithm");
        }
        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length * 8 < algorithm.minKeyBits()) {
            throw new IllegalArgumentException("Secret must be at least " + algorithm.minKeyBits() / 8
                    + " bytes for " + algorithm);
        }
        Key key = new SecretKeySpec(bytes, algorithm.jcaName());
        return new SigningKeys(algorithm, key, key);
    }

    /**
     * Builds RSA keys from a PKCS#8 private key and an X.509 public key, both PEM encoded.
     */
    public static SigningKeys rsa(JwtAlgorithm algorithm, String privateKeyPem, String publicKeyPem) {
        if (algorithm.isHmac()) {
            throw new IllegalArgumentException(algorithm + " is not an RSA algorithm");
        }
        try {
            KeyFactory keyFactory = KeyFactory.getInstance("RSA");
            Key privateKey = keyFactory.generatePrivate(new PKCS8EncodedKeySpec(pemBody(privateKeyPem)));
            Key publicKey = keyFactory.generatePublic(new X509EncodedKeySpec(pemBody(publicKeyPem)));
            return new SigningKeys(algorithm, privateKey, publicKey);
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("Invalid RSA key material", e);
        }
    }

    private static byte[] pemBody(String pem) {
        if (pem == null || pem.isBlank()) {
            throw new IllegalArgumentException("PEM key is required for RSA signing");
        }
        String body = pem.replaceAll("-----(BEGIN|END)[A-Z ]+-----", "").replaceAll("\\s", "");
        return Base64.getDecoder().decode(body);
    }
}

package com.authplatform.authsvc.shared.crypto;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Header;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.SecureDigestAlgorithm;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Compact JWS encoding of {@link TokenClaims}.
 *
 * <p>Decoding never throws: a bad signature, a disallowed algorithm, an expired token or an
 * issuer/audience mismatch all come back as an empty result. The cause is logged at debug.
 */
@Slf4j
@Component
public class SignedTokenCodec {

    private final Clock clock;

    public SignedTokenCodec(Clock clock) {
        this.clock = clock;
    }

    /**
     * Signs the claims, stamping {@code iat} = now and {@code exp} = now + maxAge.
     */
    public String encode(TokenClaims claims, Key signingKey, Duration maxAge, JwtAlgorithm algorithm,
                         String issuer, String audience) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);

        Map<String, Object> custom = new HashMap<>();
        claims.customClaims().forEach((name, value) -> {
            if (value != null && !TokenClaims.RESERVED.contains(name)) {
                custom.put(name, value);
            }
        });

        JwtBuilder builder = Jwts.builder()
                .claims(custom)
                .subject(claims.subject())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(maxAge)));

        putIfPresent(builder, TokenClaims.EMAIL, claims.email());
        putIfPresent(builder, TokenClaims.NAME, claims.name());
        putIfPresent(builder, TokenClaims.PICTURE, claims.picture());
        putIfPresent(builder, TokenClaims.SESSION_ID, claims.sessionId());

        if (issuer != null) {
            builder.issuer(issuer);
        }
        if (audience != null) {
            builder.audience().add(audience).and();
        }

        return builder.signWith(signingKey, keyed(algorithm)).compact();
    }

    public String encode(TokenClaims claims, SigningKeys keys, Duration maxAge, String issuer, String audience) {
        return encode(claims, keys.signingKey(), maxAge, keys.algorithm(), issuer, audience);
    }

    /**
     * Verifies and decodes a token. The header algorithm is checked against
     * {@code allowedAlgorithms} before the signature is looked at.
     */
    public Optional<TokenClaims> decode(String token, Key verificationKey, Set<JwtAlgorithm> allowedAlgorithms,
                                        String issuer, String audience) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            JwtParserBuilder parser = Jwts.parser()
                    .keyLocator(header -> locateKey(header, verificationKey, allowedAlgorithms))
                    .clock(() -> Date.from(clock.instant()));
            if (issuer != null) {
                parser.requireIssuer(issuer);
            }
            if (audience != null) {
                parser.requireAudience(audience);
            }

            Claims claims = parser.build().parseSignedClaims(token).getPayload();
            return Optional.of(toTokenClaims(claims));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Signed token rejected: {}: {}", e.getClass().getSimpleName(), e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<TokenClaims> decode(String token, SigningKeys keys, String issuer, String audience) {
        return decode(token, keys.verificationKey(), Set.of(keys.algorithm()), issuer, audience);
    }

    private Key locateKey(Header header, Key verificationKey, Set<JwtAlgorithm> allowedAlgorithms) {
        String alg = header.getAlgorithm();
        JwtAlgorithm algorithm = JwtAlgorithm.fromHeader(alg)
                .filter(allowedAlgorithms::contains)
                .orElseThrow(() -> new UnsupportedJwtException("Algorithm not allowed: " + alg));
        log.trace("Verifying token signed with {}", algorithm);
        return verificationKey;
    }

    private TokenClaims toTokenClaims(Claims claims) {
        Map<String, Object> custom = new HashMap<>();
        claims.forEach((name, value) -> {
            if (!TokenClaims.RESERVED.contains(name)) {
                custom.put(name, value);
            }
        });

        Set<String> audience = claims.getAudience();
        return TokenClaims.builder()
                .subject(claims.getSubject())
                .email(claims.get(TokenClaims.EMAIL, String.class))
                .name(claims.get(TokenClaims.NAME, String.class))
                .picture(claims.get(TokenClaims.PICTURE, String.class))
                .sessionId(claims.get(TokenClaims.SESSION_ID, String.class))
                .issuedAt(toInstant(claims.getIssuedAt()))
                .expiresAt(toInstant(claims.getExpiration()))
                .issuer(claims.getIssuer())
                .audience(audience == null || audience.isEmpty() ? null : audience.iterator().next())
                .customClaims(custom)
                .build();
    }

    private static void putIfPresent(JwtBuilder builder, String name, String value) {
        if (value != null) {
            builder.claim(name, value);
        }
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }

    @SuppressWarnings("unchecked")
    private static SecureDigestAlgorithm<Key, ?> keyed(JwtAlgorithm algorithm) {
        return (SecureDigestAlgorithm<Key, ?>) algorithm.signatureAlgorithm();
    }
}

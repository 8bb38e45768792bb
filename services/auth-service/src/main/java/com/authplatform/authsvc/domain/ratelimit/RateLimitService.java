package com.authplatform.authsvc.domain.ratelimit;

import com.authplatform.authsvc.config.AuthProperties;
import com.authplatform.authsvc.shared.exception.RateLimitedException;
import com.authplatform.authsvc.shared.security.SecurityUtils;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.Counter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Per-client sliding-window limits on the endpoints that are worth brute-forcing.
 * State is local to this instance; idle keys are evicted after a few minutes.
 */
@Slf4j
@Service
public class RateLimitService {

    private final Cache<String, Deque<Instant>> windows = Caffeine.newBuilder()
            .maximumSize(100_000)
            .expireAfterAccess(Duration.ofMinutes(5))
            .build();
    private final AuthProperties.RateLimit limits;
    private final SecurityUtils securityUtils;
    private final Counter rateLimitCounter;
    private final Clock clock;

    public RateLimitService(
            AuthProperties properties,
            SecurityUtils securityUtils,
            @Qualifier("rateLimitCounter") Counter rateLimitCounter,
            Clock clock) {
        this.limits = properties.rateLimit();
        this.securityUtils = securityUtils;
        this.rateLimitCounter = rateLimitCounter;
        this.clock = clock;
    }

    public void checkRegistration(String ipAddress) {
        check("register", ipAddress, limits.registerPerMinute());
    }

    public void checkSignIn(String ipAddress) {
        check("signin", ipAddress, limits.signInPerMinute());
    }

    public void checkPasswordReset(String ipAddress) {
        check("password-reset", ipAddress, limits.passwordResetPerMinute());
    }

    public void checkVerificationSend(String ipAddress) {
        check("verification-send", ipAddress, limits.verificationSendPerMinute());
    }

    /**
     * Records one hit on {@code key} and fails once more than {@code maxRequests} hits fall
     * inside the trailing window.
     *
     * @throws RateLimitedException carrying the time until the oldest hit leaves the window
     */
    public void checkLimit(String key, int maxRequests, Duration window) {
        if (!limits.enabled()) {
            return;
        }
        Instant now = clock.instant();
        Instant windowStart = now.minus(window);
        Duration[] retryAfter = new Duration[1];

        windows.asMap().compute(key, (k, hits) -> {
            Deque<Instant> recent = hits == null ? new ArrayDeque<>() : hits;
            while (!recent.isEmpty() && !recent.peekFirst().isAfter(windowStart)) {
                recent.pollFirst();
            }
            if (recent.size() >= maxRequests) {
                retryAfter[0] = Duration.between(now, recent.peekFirst().plus(window));
            } else {
                recent.addLast(now);
            }
            return recent;
        });

        if (retryAfter[0] != null) {
            rateLimitCounter.increment();
            throw new RateLimitedException(retryAfter[0].isNegative() || retryAfter[0].isZero()
                    ? Duration.ofSeconds(1) : retryAfter[0]);
        }
    }

    private void check(String action, String ipAddress, int perMinute) {
        try {
            checkLimit(action + ":ip:" + ipAddress, perMinute, Duration.ofMinutes(1));
        } catch (RateLimitedException e) {
            log.warn("Rate limit exceeded: action={}, ip={}", action, securityUtils.maskIp(ipAddress));
            throw e;
        }
    }
}

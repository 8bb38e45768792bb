package com.authplatform.authsvc.shared.exception;

import java.time.Duration;

public final class RateLimitedException extends AuthException {

    private final Duration retryAfter;

    public RateLimitedException(Duration retryAfter) {
        super("Rate limit exceeded");
        this.retryAfter = retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    public long getRetryAfterSeconds() {
        return Math.max(1, (retryAfter.toMillis() + 999) / 1000);
    }

    @Override
    public String getErrorCode() {
        return "RATE_LIMITED";
    }

    @Override
    public int getHttpStatus() {
        return 429;
    }
}

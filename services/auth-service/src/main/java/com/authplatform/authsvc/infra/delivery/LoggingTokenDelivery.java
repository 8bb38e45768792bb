package com.authplatform.authsvc.infra.delivery;

import com.authplatform.authsvc.domain.model.User;
import com.authplatform.authsvc.domain.port.TokenDelivery;
import com.authplatform.authsvc.shared.security.SecurityUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;

/**
 * Fallback used when no mail integration is registered: records that a token was issued
 * without writing the token itself.
 */
@Slf4j
public class LoggingTokenDelivery implements TokenDelivery {

    private final SecurityUtils securityUtils;

    public LoggingTokenDelivery(SecurityUtils securityUtils) {
        this.securityUtils = securityUtils;
    }

    @Override
    public void deliverPasswordReset(User user, String resetToken, Instant expiresAt) {
        log.info("Password reset token issued: userId={}, email={}, expiresAt={}",
                user.getId(), securityUtils.maskEmail(user.getEmail()), expiresAt);
    }

    @Override
    public void deliverEmailVerification(User user, String verificationToken, Instant expiresAt) {
        log.info("Verification token issued: userId={}, email={}, expiresAt={}",
                user.getId(), securityUtils.maskEmail(user.getEmail()), expiresAt);
    }
}

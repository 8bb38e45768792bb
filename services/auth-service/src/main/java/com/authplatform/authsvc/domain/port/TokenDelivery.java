package com.authplatform.authsvc.domain.port;

import com.authplatform.authsvc.domain.model.User;

import java.time.Instant;

/**
 * Out-of-band delivery of single-use tokens, typically by email. The HTTP adapter never puts
 * these tokens in a response body.
 */
public interface TokenDelivery {

    void deliverPasswordReset(User user, String resetToken, Instant expiresAt);

    void deliverEmailVerification(User user, String verificationToken, Instant expiresAt);
}

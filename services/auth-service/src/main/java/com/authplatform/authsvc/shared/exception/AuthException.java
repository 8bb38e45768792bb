package com.authplatform.authsvc.shared.exception;

/**
 * Base sealed exception for every failure the auth engine reports.
 * Storage and transport failures are not wrapped and propagate as-is.
 */
public sealed abstract class AuthException extends RuntimeException
        permits ValidationException, DuplicateUserException, InvalidCredentialsException,
                InvalidOrExpiredTokenException, CsrfStateMismatchException, RefreshTokensDisabledException,
                ProviderNotFoundException, SessionNotFoundException, UserNotFoundException,
                EmailAlreadyVerifiedException, IdentityProviderException, RateLimitedException {

    protected AuthException(String message) {
        super(message);
    }

    protected AuthException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String getErrorCode();
    public abstract int getHttpStatus();
}

package com.authplatform.authsvc.shared.exception;

/**
 * Failure talking to a third-party identity provider (token endpoint, user-info endpoint,
 * malformed payload, open circuit).
 */
public final class IdentityProviderException extends AuthException {

    private final String providerId;

    public IdentityProviderException(String providerId, String message) {
        super(message);
        this.providerId = providerId;
    }

    public IdentityProviderException(String providerId, String message, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }

    @Override
    public String getErrorCode() {
        return "IDENTITY_PROVIDER_ERROR";
    }

    @Override
    public int getHttpStatus() {
        return 502;
    }
}

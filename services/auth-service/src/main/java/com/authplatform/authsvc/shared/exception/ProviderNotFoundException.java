package com.authplatform.authsvc.shared.exception;

public final class ProviderNotFoundException extends AuthException {

    private final String providerId;

    public ProviderNotFoundException(String providerId) {
        super("Provider '" + providerId + "' not found");
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }

    @Override
    public String getErrorCode() {
        return "PROVIDER_NOT_FOUND";
    }

    @Override
    public int getHttpStatus() {
        return 404;
    }
}

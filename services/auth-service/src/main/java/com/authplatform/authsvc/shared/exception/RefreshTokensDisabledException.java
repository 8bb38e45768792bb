package com.authplatform.authsvc.shared.exception;

public final class RefreshTokensDisabledException extends AuthException {

    public RefreshTokensDisabledException() {
        super("Refresh tokens are not enabled");
    }

    @Override
    public String getErrorCode() {
        return "REFRESH_TOKENS_DISABLED";
    }

    @Override
    public int getHttpStatus() {
        return 400;
    }
}

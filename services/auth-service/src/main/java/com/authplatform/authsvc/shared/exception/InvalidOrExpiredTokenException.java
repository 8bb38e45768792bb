package com.authplatform.authsvc.shared.exception;

public final class InvalidOrExpiredTokenException extends AuthException {

    public InvalidOrExpiredTokenException() {
        super("Invalid or expired token");
    }

    @Override
    public String getErrorCode() {
        return "INVALID_OR_EXPIRED_TOKEN";
    }

    @Override
    public int getHttpStatus() {
        return 400;
    }
}

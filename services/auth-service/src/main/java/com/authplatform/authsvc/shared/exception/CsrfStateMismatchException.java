package com.authplatform.authsvc.shared.exception;

public final class CsrfStateMismatchException extends AuthException {

    public CsrfStateMismatchException() {
        super("Invalid state parameter");
    }

    @Override
    public String getErrorCode() {
        return "CSRF_STATE_MISMATCH";
    }

    @Override
    public int getHttpStatus() {
        return 403;
    }
}

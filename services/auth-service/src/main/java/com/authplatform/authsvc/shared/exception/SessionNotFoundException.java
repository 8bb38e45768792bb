package com.authplatform.authsvc.shared.exception;

public final class SessionNotFoundException extends AuthException {

    public SessionNotFoundException() {
        super("Session not found");
    }

    @Override
    public String getErrorCode() {
        return "SESSION_NOT_FOUND";
    }

    @Override
    public int getHttpStatus() {
        return 404;
    }
}

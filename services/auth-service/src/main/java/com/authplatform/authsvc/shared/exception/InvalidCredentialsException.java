package com.authplatform.authsvc.shared.exception;

public final class InvalidCredentialsException extends AuthException {

    public InvalidCredentialsException() {
        super("Invalid email or password");
    }

    @Override
    public String getErrorCode() {
        return "INVALID_CREDENTIALS";
    }

    @Override
    public int getHttpStatus() {
        return 401;
    }
}

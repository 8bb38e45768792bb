package com.authplatform.authsvc.shared.exception;

public final class DuplicateUserException extends AuthException {

    public DuplicateUserException() {
        super("User with this email already exists");
    }

    @Override
    public String getErrorCode() {
        return "DUPLICATE_USER";
    }

    @Override
    public int getHttpStatus() {
        return 409;
    }
}

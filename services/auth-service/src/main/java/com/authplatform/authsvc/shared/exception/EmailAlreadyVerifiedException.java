package com.authplatform.authsvc.shared.exception;

public final class EmailAlreadyVerifiedException extends AuthException {

    public EmailAlreadyVerifiedException() {
        super("Email is already verified");
    }

    @Override
    public String getErrorCode() {
        return "EMAIL_ALREADY_VERIFIED";
    }

    @Override
    public int getHttpStatus() {
        return 409;
    }
}

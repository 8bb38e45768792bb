package com.authplatform.authsvc.shared.exception;

/**
 * Raised when an email lookup finds nobody. The message deliberately reads like the
 * success response so that an adapter echoing it cannot be used to discover accounts.
 */
public final class UserNotFoundException extends AuthException {

    public static final String GENERIC_MESSAGE = "If the email exists, a link will be sent";

    public UserNotFoundException() {
        super(GENERIC_MESSAGE);
    }

    @Override
    public String getErrorCode() {
        return "USER_NOT_FOUND";
    }

    @Override
    public int getHttpStatus() {
        return 404;
    }
}

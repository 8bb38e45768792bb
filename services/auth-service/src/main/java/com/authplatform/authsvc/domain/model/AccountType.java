package com.authplatform.authsvc.domain.model;

/**
 * How an {@link Account} authenticates its user.
 */
public enum AccountType {
    CREDENTIALS,
    OAUTH
}

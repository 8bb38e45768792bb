package com.authplatform.authsvc.domain.engine;

public enum SessionStrategy {
    /** The signed token is the session; nothing is persisted. */
    JWT,
    /** Sessions live in storage and can be revoked. */
    DATABASE
}

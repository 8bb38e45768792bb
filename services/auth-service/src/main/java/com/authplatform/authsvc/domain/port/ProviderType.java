package com.authplatform.authsvc.domain.port;

public enum ProviderType {
    OAUTH,
    CREDENTIALS
}

package com.authplatform.authsvc.api.dto.request;

/**
 * @param sessionToken session to end; when absent the session named by the bearer token is used
 */
public record SignOutRequest(String sessionToken) {}

package com.authplatform.authsvc.api.dto.response;

public record SignOutAllResponse(int sessionsDeleted) {}

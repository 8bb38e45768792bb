package com.authplatform.authsvc.api.dto.response;

import com.authplatform.authsvc.domain.session.AuthSession;

import java.time.Instant;
import java.util.Map;

public record SessionResponse(
        UserResponse user,
        Instant expires,
        Map<String, Object> attributes
) {
    public static SessionResponse from(AuthSession session) {
        return new SessionResponse(UserResponse.from(session.user()), session.expires(), session.attributes());
    }
}

package com.authplatform.authsvc.api.dto.response;

import com.authplatform.authsvc.domain.model.User;
import com.authplatform.authsvc.domain.session.SessionUser;

import java.time.Instant;

public record UserResponse(
        String id,
        String email,
        String name,
        String image,
        Instant emailVerified
) {
    public static UserResponse from(User user) {
        return new UserResponse(user.getId(), user.getEmail(), user.getName(), user.getImage(),
                user.getEmailVerified());
    }

    public static UserResponse from(SessionUser user) {
        return new UserResponse(user.id(), user.email(), user.name(), user.image(), user.emailVerified());
    }
}

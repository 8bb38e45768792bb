package com.authplatform.authsvc.domain.session;

import com.authplatform.authsvc.domain.model.User;

import java.time.Instant;

/**
 * The public view of a user as exposed in a session. Never carries token material.
 */
public record SessionUser(String id, String email, String name, String image, Instant emailVerified) {

    public static SessionUser from(User user) {
        return new SessionUser(user.getId(), user.getEmail(), user.getName(), user.getImage(),
                user.getEmailVerified());
    }
}

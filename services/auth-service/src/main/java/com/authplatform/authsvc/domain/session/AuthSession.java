package com.authplatform.authsvc.domain.session;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * A validated session as returned to callers.
 *
 * @param sessionId  the persisted session token, null for stateless sessions
 * @param attributes extra values added by session-shaping callbacks
 */
public record AuthSession(SessionUser user, Instant expires, String sessionId, Map<String, Object> attributes) {

    public AuthSession {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public AuthSession withAttribute(String name, Object value) {
        Map<String, Object> copy = new HashMap<>(attributes);
        copy.put(name, value);
        return new AuthSession(user, expires, sessionId, copy);
    }
}

package com.authplatform.authsvc.shared.security;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Request-scoped helpers: masking of personal data before it reaches a log line, bearer and
 * client-address extraction, and the correlation id kept in the MDC.
 */
@Component
public class SecurityUtils {

    public static final String CORRELATION_ID_KEY = "correlationId";
    public static final String USER_ID_KEY = "userId";

    private static final String BEARER_PREFIX = "Bearer ";
    private static final Pattern IPV4_PATTERN = Pattern.compile("^(\\d{1,3}\\.\\d{1,3}\\.\\d{1,3})\\.\\d{1,3}$");
    private static final Pattern EMAIL_PATTERN = Pattern.compile("^(.{1,2})[^@]*(@.+)$");

    /**
     * 203.0.113.42 becomes 203.0.113.***; anything else keeps at most six characters.
     */
    public String maskIp(String ip) {
        if (ip == null || ip.isBlank()) {
            return "***";
        }
        var matcher = IPV4_PATTERN.matcher(ip.trim());
        if (matcher.matches()) {
            return matcher.group(1) + ".***";
        }
        return ip.length() > 6 ? ip.substring(0, 6) + "***" : "***";
    }

    /**
     * alice@example.com becomes al***@example.com.
     */
    public String maskEmail(String email) {
        if (email == null || email.isBlank()) {
            return "***";
        }
        var matcher = EMAIL_PATTERN.matcher(email.trim().toLowerCase(Locale.ROOT));
        if (matcher.matches()) {
            return matcher.group(1) + "***" + matcher.group(2);
        }
        return "***";
    }

    /**
     * Token from an {@code Authorization: Bearer ...} header, or null.
     */
    public String extractBearerToken(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0,
                BEARER_PREFIX.length())) {
            return null;
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    public String clientIp(HttpServletRequest request) {
        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            return forwardedFor.split(",")[0].trim();
        }
        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        return request.getRemoteAddr();
    }

    public String getOrCreateCorrelationId(String provided) {
        if (provided != null && !provided.isBlank()) {
            return provided.trim();
        }
        return UUID.randomUUID().toString();
    }

    public void setMdcContext(String correlationId, String userId) {
        if (correlationId != null) {
            MDC.put(CORRELATION_ID_KEY, correlationId);
        }
        if (userId != null) {
            MDC.put(USER_ID_KEY, userId);
        }
    }

    public void clearMdcContext() {
        MDC.remove(CORRELATION_ID_KEY);
        MDC.remove(USER_ID_KEY);
    }

    public String getCurrentCorrelationId() {
        return MDC.get(CORRELATION_ID_KEY);
    }
}

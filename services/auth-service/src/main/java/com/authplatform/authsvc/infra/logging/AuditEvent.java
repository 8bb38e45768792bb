package com.authplatform.authsvc.infra.logging;

import java.time.Instant;
import java.util.Map;

/**
 * One line of the audit trail. Metadata values must already be masked.
 */
public record AuditEvent(
        String eventType,
        String userId,
        String correlationId,
        String description,
        Map<String, String> metadata,
        Instant timestamp
) {

    public AuditEvent {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static AuditEvent of(String eventType, String userId, String correlationId, String description,
                                Map<String, String> metadata, Instant timestamp) {
        return new AuditEvent(eventType, userId, correlationId, description, metadata, timestamp);
    }
}

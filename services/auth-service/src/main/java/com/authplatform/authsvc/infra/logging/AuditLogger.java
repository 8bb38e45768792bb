package com.authplatform.authsvc.infra.logging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes audit events as single-line JSON to the {@code audit} logger.
 */
@Slf4j(topic = "audit")
@Component
public class AuditLogger {

    static final String SERVICE_ID = "auth-service";

    private final ObjectMapper objectMapper;

    public AuditLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void log(AuditEvent event) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("timestamp", event.timestamp() == null ? null : event.timestamp().toString());
        entry.put("eventType", event.eventType());
        entry.put("description", event.description());
        entry.put("serviceId", SERVICE_ID);
        entry.put("correlationId", event.correlationId());
        if (event.userId() != null) {
            entry.put("userId", event.userId());
        }
        if (!event.metadata().isEmpty()) {
            entry.put("metadata", event.metadata());
        }

        try {
            log.info("[AUDIT] {}", objectMapper.writeValueAsString(entry));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize audit event: type={}", event.eventType(), e);
        }
    }
}

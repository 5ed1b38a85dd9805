package com.z254.genesis.common.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.genesis.common.error.StandardError;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Structured logging utility for GENESIS services.
 * Emits one machine-parseable JSON line per domain event, tagged with service and correlation id.
 */
@Slf4j
public class SwarmEventLogger {

    public static final String MDC_CORRELATION_ID = "correlationId";

    private final ObjectMapper objectMapper;
    private final String serviceName;

    public SwarmEventLogger(ObjectMapper objectMapper, String serviceName) {
        this.objectMapper = objectMapper;
        this.serviceName = serviceName;
    }

    public void logEvent(String eventType, String correlationId, Map<String, Object> data) {
        if (correlationId != null) {
            MDC.put(MDC_CORRELATION_ID, correlationId);
        }
        try {
            writeEvent(eventType, correlationId, data);
        } finally {
            MDC.remove(MDC_CORRELATION_ID);
        }
    }

    public void logEvent(String eventType, Map<String, Object> data) {
        logEvent(eventType, null, data);
    }

    public void logError(StandardError error) {
        Map<String, Object> data = new HashMap<>();
        data.put("kind", error.getKind() != null ? error.getKind().wireName() : null);
        data.put("category", error.getCategory() != null ? error.getCategory().wireName() : null);
        data.put("severity", error.getSeverity() != null ? error.getSeverity().wireName() : null);
        data.put("message", error.getMessage());
        if (error.getDetails() != null && !error.getDetails().isEmpty()) {
            data.put("details", error.getDetails());
        }
        logEvent("error", error.getCorrelationId(), data);
    }

    private void writeEvent(String eventType, String correlationId, Map<String, Object> data) {
        Map<String, Object> event = new HashMap<>(data);
        event.put("event", eventType);
        event.put("timestamp", Instant.now().toString());
        event.put("service", serviceName);
        if (correlationId != null) event.put("correlationId", correlationId);

        try {
            log.info(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.info("event={} correlationId={} data={}", eventType, correlationId, data);
        }
    }
}

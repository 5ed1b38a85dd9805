package com.z254.genesis.common.error;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wire representation of every externally visible failure.
 * <p>
 * Use {@link #of(ErrorKind, String)} so that category and severity always follow the kind;
 * the builder is kept for deserialization and for callers that escalate severity.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class StandardError {

    private ErrorKind kind;
    private String message;
    @Builder.Default
    private Map<String, Object> details = new LinkedHashMap<>();
    private ErrorCategory category;
    private ErrorSeverity severity;
    private Instant timestamp;
    private String correlationId;

    public static StandardError of(ErrorKind kind, String message) {
        return StandardError.builder()
                .kind(kind)
                .message(message)
                .category(kind.getCategory())
                .severity(kind.getDefaultSeverity())
                .timestamp(Instant.now())
                .build();
    }

    public StandardError withDetail(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(details != null ? details : Map.of());
        copy.put(key, value);
        return toBuilder().details(copy).build();
    }

    public StandardError withCorrelationId(String id) {
        return toBuilder().correlationId(id).build();
    }

    public StandardError withSeverity(ErrorSeverity escalated) {
        return toBuilder().severity(escalated).build();
    }

    /**
     * Whether a caller may recover by retrying elsewhere.
     */
    @JsonIgnore
    public boolean isTransient() {
        return kind != null && kind.isTransientFailure();
    }
}

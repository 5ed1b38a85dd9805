package com.z254.genesis.common.error;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;

/**
 * Closed set of failure kinds every GENESIS component reports with.
 * <p>
 * Each kind carries its category, its default severity and whether a caller may recover
 * by retrying against another instance.
 */
@Getter
@AllArgsConstructor
public enum ErrorKind {
    INVALID_INPUT("invalid-input", ErrorCategory.VALIDATION, ErrorSeverity.ERROR, false),
    MISSING_FIELD("missing-field", ErrorCategory.VALIDATION, ErrorSeverity.ERROR, false),
    RESOURCE_NOT_FOUND("resource-not-found", ErrorCategory.RESOURCE, ErrorSeverity.ERROR, false),
    RESOURCE_CORRUPTED("resource-corrupted", ErrorCategory.RESOURCE, ErrorSeverity.CRITICAL, false),
    STORAGE_FAILURE("storage-failure", ErrorCategory.RESOURCE, ErrorSeverity.ERROR, false),
    SERVICE_UNAVAILABLE("service-unavailable", ErrorCategory.SERVICE, ErrorSeverity.ERROR, true),
    DEPENDENCY_FAILURE("dependency-failure", ErrorCategory.DEPENDENCY, ErrorSeverity.ERROR, false),
    NETWORK_ERROR("network-error", ErrorCategory.NETWORK, ErrorSeverity.ERROR, true),
    TIMEOUT("timeout", ErrorCategory.TIMEOUT, ErrorSeverity.WARNING, true),
    INTERNAL_ERROR("internal-error", ErrorCategory.INTERNAL, ErrorSeverity.CRITICAL, false);

    private final String code;
    private final ErrorCategory category;
    private final ErrorSeverity defaultSeverity;
    private final boolean transientFailure;

    @JsonValue
    public String wireName() {
        return code;
    }

    @JsonCreator
    public static ErrorKind fromWireName(String value) {
        return Arrays.stream(values())
                .filter(k -> k.code.equalsIgnoreCase(value) || k.name().equalsIgnoreCase(value))
                .findFirst()
                .orElse(INTERNAL_ERROR);
    }
}

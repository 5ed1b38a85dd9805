package com.z254.genesis.common.error;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Coarse classification of a {@link StandardError}, used for HTTP status mapping and alerting.
 */
public enum ErrorCategory {
    VALIDATION,
    AUTHENTICATION,
    AUTHORIZATION,
    RESOURCE,
    SERVICE,
    DEPENDENCY,
    NETWORK,
    TIMEOUT,
    INTERNAL,
    UNKNOWN;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ErrorCategory fromWireName(String value) {
        return Arrays.stream(values())
                .filter(c -> c.wireName().equalsIgnoreCase(value))
                .findFirst()
                .orElse(UNKNOWN);
    }
}

package com.z254.genesis.common.error;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ErrorSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ErrorSeverity fromWireName(String value) {
        return Arrays.stream(values())
                .filter(s -> s.wireName().equalsIgnoreCase(value))
                .findFirst()
                .orElse(ERROR);
    }
}

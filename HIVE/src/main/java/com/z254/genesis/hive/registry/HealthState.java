package com.z254.genesis.hive.registry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.z254.genesis.common.error.SwarmException;

import java.util.Arrays;

public enum HealthState {
    UNKNOWN,
    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    /**
     * Unhealthy instances are never routed to; unknown and degraded ones still are.
     */
    public boolean isRoutable() {
        return this != UNHEALTHY;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static HealthState fromWireName(String value) {
        return Arrays.stream(values())
                .filter(s -> s.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> SwarmException.invalidInput("Unknown health state: " + value));
    }
}

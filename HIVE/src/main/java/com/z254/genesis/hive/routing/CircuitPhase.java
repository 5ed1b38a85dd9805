package com.z254.genesis.hive.routing;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CircuitPhase {
    CLOSED,
    OPEN,
    HALF_OPEN;

    @JsonValue
    public String wireName() {
        return name().toLowerCase().replace('_', '-');
    }
}

package com.z254.genesis.hive.routing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Point-in-time view of an instance's circuit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CircuitState {

    private String instanceId;
    private CircuitPhase phase;
    /** Failures inside the current rolling window. */
    private int failureCount;
    /** When an open circuit admits its half-open trial; null unless open. */
    private Instant openUntil;
    /** Consecutive openings without an intervening close. */
    private int openAttempts;
}

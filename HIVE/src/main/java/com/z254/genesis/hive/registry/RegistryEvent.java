package com.z254.genesis.hive.registry;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A state transition published on the registry change feed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegistryEvent {

    public enum Type {
        REGISTERED,
        HEALTH_CHANGED,
        DEREGISTERED
    }

    private Type type;
    private String instanceId;
    private String role;
    private HealthState previousHealth;
    private HealthState health;
    private String reason;
    private Instant timestamp;
}

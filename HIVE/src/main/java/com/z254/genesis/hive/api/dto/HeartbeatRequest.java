package com.z254.genesis.hive.api.dto;

import com.z254.genesis.hive.registry.HealthState;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Heartbeat body. A missing status means healthy.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HeartbeatRequest {

    private HealthState status;
}

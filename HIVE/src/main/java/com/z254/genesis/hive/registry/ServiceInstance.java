package com.z254.genesis.hive.registry;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A registered worker instance. Readers always receive copies; only {@link ServiceRegistry}
 * holds the live entries.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ServiceInstance {

    private String id;
    private String role;
    private String address;
    @Builder.Default
    private List<String> capabilities = new ArrayList<>();
    @Builder.Default
    private HealthState health = HealthState.UNKNOWN;
    private Instant lastHeartbeat;
    private Instant registeredAt;

    public ServiceInstance copy() {
        return toBuilder()
                .capabilities(capabilities != null ? new ArrayList<>(capabilities) : new ArrayList<>())
                .build();
    }
}

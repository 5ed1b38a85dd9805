package com.z254.genesis.hive.health;

import com.z254.genesis.hive.config.HiveProperties;
import com.z254.genesis.hive.registry.HealthState;
import com.z254.genesis.hive.registry.ServiceInstance;
import com.z254.genesis.hive.registry.ServiceRegistry;
import com.z254.genesis.hive.routing.CircuitBreakerManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Health indicator for HIVE service.
 * Reports registry population by health state and open circuits.
 */
@Component
@Slf4j
public class HiveHealthIndicator implements ReactiveHealthIndicator {

    private final ServiceRegistry registry;
    private final CircuitBreakerManager circuits;
    private final HiveProperties hiveProperties;

    public HiveHealthIndicator(ServiceRegistry registry, CircuitBreakerManager circuits,
                               HiveProperties hiveProperties) {
        this.registry = registry;
        this.circuits = circuits;
        this.hiveProperties = hiveProperties;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(() -> {
                    List<ServiceInstance> instances = registry.list(null);
                    Map<HealthState, Long> byHealth = instances.stream()
                            .collect(Collectors.groupingBy(ServiceInstance::getHealth, Collectors.counting()));
                    Map<String, Long> byRole = instances.stream()
                            .collect(Collectors.groupingBy(ServiceInstance::getRole, Collectors.counting()));

                    return Health.up()
                            .withDetail("registeredInstances", instances.size())
                            .withDetail("byHealth", byHealth.entrySet().stream()
                                    .collect(Collectors.toMap(e -> e.getKey().wireName(), Map.Entry::getValue)))
                            .withDetail("byRole", byRole)
                            .withDetail("openCircuits", circuits.openCount())
                            .withDetail("stalenessThreshold", hiveProperties.getRegistry().getStalenessThreshold().toString())
                            .withDetail("retryBudget", hiveProperties.getRouter().getRetryBudget())
                            .build();
                })
                .onErrorResume(e -> {
                    log.error("Health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }
}

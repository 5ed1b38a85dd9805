package com.z254.genesis.hive.registry;

import com.z254.genesis.common.error.SwarmException;
import com.z254.genesis.hive.config.HiveProperties;
import com.z254.genesis.hive.observability.HiveMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Periodic health sweep over the registry.
 * <p>
 * Instances silent for longer than the staleness threshold become unhealthy; instances silent
 * for longer than the deregistration threshold are removed. With probing enabled, a timely
 * successful liveness probe counts as a heartbeat before staleness is evaluated.
 */
@Component
@Slf4j
public class HealthSweeper {

    private final ServiceRegistry registry;
    private final HealthProbeClient probeClient;
    private final HiveProperties.RegistryProperties config;
    private final HiveMetrics metrics;
    private final Clock clock;

    public HealthSweeper(ServiceRegistry registry, HealthProbeClient probeClient, HiveProperties hiveProperties,
                         HiveMetrics metrics, Clock clock) {
        this.registry = registry;
        this.probeClient = probeClient;
        this.config = hiveProperties.getRegistry();
        this.metrics = metrics;
        this.clock = clock;

        if (config.getDeregistrationThreshold().compareTo(config.getStalenessThreshold()) <= 0) {
            throw new IllegalStateException("hive.registry.deregistration-threshold ("
                    + config.getDeregistrationThreshold() + ") must exceed hive.registry.staleness-threshold ("
                    + config.getStalenessThreshold() + ")");
        }
    }

    @Scheduled(fixedDelayString = "${hive.registry.sweep-interval-ms:5000}")
    public void scheduledSweep() {
        SweepResult result = sweep();
        if (result.markedUnhealthy() > 0 || result.expired() > 0) {
            log.info("Health sweep: probed={}, markedUnhealthy={}, expired={}",
                    result.probed(), result.markedUnhealthy(), result.expired());
        }
    }

    public SweepResult sweep() {
        int probed = config.getProbe().isEnabled() ? probeAll() : 0;

        Instant now = clock.instant();
        Instant staleBefore = now.minus(config.getStalenessThreshold());
        Instant expireBefore = now.minus(config.getDeregistrationThreshold());
        int marked = 0;
        int expired = 0;

        for (ServiceInstance instance : registry.list(null)) {
            if (instance.getLastHeartbeat().isBefore(expireBefore)) {
                if (registry.expire(instance.getId(), expireBefore)) {
                    expired++;
                }
            } else if (instance.getLastHeartbeat().isBefore(staleBefore)
                    && instance.getHealth() != HealthState.UNHEALTHY) {
                if (registry.markStale(instance.getId(), staleBefore)) {
                    marked++;
                }
            }
        }

        metrics.recordSweep(marked, expired);
        return new SweepResult(probed, marked, expired);
    }

    private int probeAll() {
        List<ServiceInstance> targets = registry.list(null);
        if (targets.isEmpty()) {
            return 0;
        }
        Duration budget = config.getProbe().getTimeout().plusSeconds(1);
        Long answered = Flux.fromIterable(targets)
                .flatMap(instance -> probeClient.probe(instance)
                        .flatMap(state -> recordProbe(instance, state)))
                .count()
                .timeout(budget, Mono.just(0L))
                .block();
        return answered != null ? answered.intValue() : 0;
    }

    private Mono<Boolean> recordProbe(ServiceInstance instance, HealthState state) {
        try {
            registry.heartbeat(instance.getId(), state);
            return Mono.just(true);
        } catch (SwarmException e) {
            log.debug("Instance {} left the registry while being probed", instance.getId());
            return Mono.empty();
        }
    }

    public record SweepResult(int probed, int markedUnhealthy, int expired) {
    }
}

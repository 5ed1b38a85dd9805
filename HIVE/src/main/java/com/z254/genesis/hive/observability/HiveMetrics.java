package com.z254.genesis.hive.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for HIVE service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Registry size, heartbeats and change events</li>
 *     <li>Health sweep outcomes</li>
 *     <li>Routed requests, retries and latency per role</li>
 *     <li>Circuit state transitions</li>
 * </ul>
 */
@Component
public class HiveMetrics {

    private final MeterRegistry meterRegistry;

    @Getter
    private final Counter heartbeats;
    @Getter
    private final Counter instancesMarkedUnhealthy;
    @Getter
    private final Counter instancesExpired;
    @Getter
    private final Counter probeFailures;

    public HiveMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.heartbeats = Counter.builder("hive.registry.heartbeats")
                .description("Heartbeats received")
                .register(meterRegistry);
        this.instancesMarkedUnhealthy = Counter.builder("hive.sweep.marked_unhealthy")
                .description("Instances marked unhealthy after missing heartbeats")
                .register(meterRegistry);
        this.instancesExpired = Counter.builder("hive.sweep.expired")
                .description("Instances deregistered after the deregistration threshold")
                .register(meterRegistry);
        this.probeFailures = Counter.builder("hive.probe.failures")
                .description("Liveness probes that failed or timed out")
                .register(meterRegistry);
    }

    public void registerInstanceGauge(Supplier<Number> size) {
        Gauge.builder("hive.registry.instances", size)
                .description("Currently registered instances")
                .register(meterRegistry);
    }

    public void recordHeartbeat() {
        heartbeats.increment();
    }

    public void recordRegistryEvent(String type) {
        meterRegistry.counter("hive.registry.events", "type", type).increment();
    }

    public void recordSweep(int markedUnhealthy, int expired) {
        instancesMarkedUnhealthy.increment(markedUnhealthy);
        instancesExpired.increment(expired);
    }

    public void recordProbeFailure() {
        probeFailures.increment();
    }

    public void recordRoute(String role, String outcome, Duration latency) {
        meterRegistry.counter("hive.route.requests", "role", role, "outcome", outcome).increment();
        Timer.builder("hive.route.latency")
                .description("End-to-end routed request latency")
                .tag("role", role)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(latency);
    }

    public void recordRetry(String role, String reason) {
        meterRegistry.counter("hive.route.retries", "role", role, "reason", reason).increment();
    }

    public void recordCircuitTransition(String toState) {
        meterRegistry.counter("hive.circuit.transitions", "to", toState).increment();
    }

    public double count(String name, String... tags) {
        Counter counter = meterRegistry.find(name).tags(tags).counter();
        return counter != null ? counter.count() : 0.0;
    }
}

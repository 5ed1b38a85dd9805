package com.z254.genesis.hive.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.genesis.common.observability.SwarmEventLogger;
import com.z254.genesis.hive.config.HiveProperties;
import com.z254.genesis.hive.observability.HiveMetrics;
import com.z254.genesis.testing.fixtures.TestDataFactories;
import com.z254.genesis.testing.time.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HealthSweeper}.
 */
class HealthSweeperTest {

    private MutableClock clock;
    private HiveProperties properties;
    private HiveMetrics metrics;
    private ServiceRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestDataFactories.EPOCH);
        properties = new HiveProperties();
        properties.getRegistry().setStalenessThreshold(Duration.ofSeconds(30));
        properties.getRegistry().setDeregistrationThreshold(Duration.ofSeconds(120));
        metrics = new HiveMetrics(new SimpleMeterRegistry());
        registry = new ServiceRegistry(clock, metrics,
                new SwarmEventLogger(new ObjectMapper().findAndRegisterModules(), "hive-test"));

        for (String id : new String[]{"a", "b"}) {
            registry.register(ServiceInstance.builder()
                    .id(id)
                    .role("memory")
                    .address(TestDataFactories.workerAddress(id.equals("a") ? 8101 : 8102))
                    .build());
            registry.heartbeat(id, HealthState.HEALTHY);
        }
    }

    private HealthSweeper sweeper(HealthProbeClient probeClient) {
        return new HealthSweeper(registry, probeClient, properties, metrics, clock);
    }

    @Test
    @DisplayName("should mark silent instances unhealthy, then deregister them")
    void marksThenExpires() {
        HealthSweeper sweeper = sweeper(instance -> Mono.empty());

        clock.advance(Duration.ofSeconds(20));
        registry.heartbeat("b", HealthState.HEALTHY);
        clock.advance(Duration.ofSeconds(15));

        HealthSweeper.SweepResult first = sweeper.sweep();
        assertThat(first.markedUnhealthy()).isEqualTo(1);
        assertThat(registry.get("a").getHealth()).isEqualTo(HealthState.UNHEALTHY);
        assertThat(registry.get("b").getHealth()).isEqualTo(HealthState.HEALTHY);

        clock.advance(Duration.ofSeconds(100));
        HealthSweeper.SweepResult second = sweeper.sweep();

        assertThat(second.expired()).isEqualTo(1);
        assertThat(second.markedUnhealthy()).isEqualTo(1);
        assertThat(registry.list(null)).extracting(ServiceInstance::getId).containsExactly("b");
        assertThat(registry.get("b").getHealth()).isEqualTo(HealthState.UNHEALTHY);
    }

    @Test
    @DisplayName("a second sweep should not re-mark an already unhealthy instance")
    void sweepIsStable() {
        HealthSweeper sweeper = sweeper(instance -> Mono.empty());
        clock.advance(Duration.ofSeconds(45));

        assertThat(sweeper.sweep().markedUnhealthy()).isEqualTo(2);
        assertThat(sweeper.sweep().markedUnhealthy()).isZero();
    }

    @Test
    @DisplayName("a successful probe should count as a heartbeat")
    void probeCountsAsHeartbeat() {
        properties.getRegistry().getProbe().setEnabled(true);
        HealthSweeper sweeper = sweeper(instance -> instance.getId().equals("a")
                ? Mono.just(HealthState.HEALTHY)
                : Mono.empty());
        clock.advance(Duration.ofSeconds(45));

        HealthSweeper.SweepResult result = sweeper.sweep();

        assertThat(result.probed()).isEqualTo(1);
        assertThat(registry.get("a").getHealth()).isEqualTo(HealthState.HEALTHY);
        assertThat(registry.get("a").getLastHeartbeat()).isEqualTo(clock.instant());
        assertThat(registry.get("b").getHealth()).isEqualTo(HealthState.UNHEALTHY);
    }

    @Test
    void rejectsDeregistrationThresholdBelowStaleness() {
        properties.getRegistry().setDeregistrationThreshold(Duration.ofSeconds(10));

        assertThatThrownBy(() -> sweeper(instance -> Mono.empty()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("deregistration-threshold");
    }
}

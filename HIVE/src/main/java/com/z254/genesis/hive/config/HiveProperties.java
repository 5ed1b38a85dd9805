package com.z254.genesis.hive.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for HIVE service.
 */
@Data
@Component
@ConfigurationProperties(prefix = "hive")
public class HiveProperties {

    private RegistryProperties registry = new RegistryProperties();
    private RouterProperties router = new RouterProperties();

    @Data
    public static class RegistryProperties {
        /** Interval workers are expected to heartbeat at. */
        private Duration heartbeatInterval = Duration.ofSeconds(10);
        /** Silence after which an instance is marked unhealthy. */
        private Duration stalenessThreshold = Duration.ofSeconds(30);
        /** Silence after which an instance is deregistered. Must exceed the staleness threshold. */
        private Duration deregistrationThreshold = Duration.ofMinutes(2);
        private long sweepIntervalMs = 5000;
        private ProbeProperties probe = new ProbeProperties();

        @Data
        public static class ProbeProperties {
            private boolean enabled = false;
            private String path = "/actuator/health";
            private Duration timeout = Duration.ofSeconds(2);
        }
    }

    @Data
    public static class RouterProperties {
        /** Failures within the failure window that open an instance's circuit. */
        private int failureThreshold = 5;
        private Duration failureWindow = Duration.ofMinutes(1);
        private Duration coolDown = Duration.ofSeconds(30);
        /** Growth factor applied to the cool-down each time a half-open trial fails. */
        private double coolDownMultiplier = 2.0;
        private Duration maxCoolDown = Duration.ofMinutes(5);
        /** Retries on alternate instances after the first attempt. */
        private int retryBudget = 2;
        private Duration callTimeout = Duration.ofSeconds(5);
        private Duration requestTimeout = Duration.ofSeconds(15);
        private Duration maxRequestTimeout = Duration.ofMinutes(1);
        private String invokePath = "/api/v1/invoke";
    }
}

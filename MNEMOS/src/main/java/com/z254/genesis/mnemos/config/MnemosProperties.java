package com.z254.genesis.mnemos.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for MNEMOS.
 */
@Data
@Component
@ConfigurationProperties(prefix = "mnemos")
public class MnemosProperties {

    private StoreProperties store = new StoreProperties();
    private CacheProperties cache = new CacheProperties();
    private RetrievalProperties retrieval = new RetrievalProperties();
    private HiveClientProperties hive = new HiveClientProperties();

    @Data
    public static class StoreProperties {
        /**
         * Root directory holding {@code records/} and {@code backups/}.
         */
        private String root = "./data/mnemos";
        private int backupRetention = 10;
        private boolean scheduledBackups = true;
        private long backupIntervalMs = 3_600_000L;
        /**
         * Bound on every call from the service layer into the store.
         */
        private Duration callTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class CacheProperties {
        private Duration recentTtl = Duration.ofSeconds(30);
        private long recentMaxSize = 256;
        private Duration resultTtl = Duration.ofMinutes(5);
        private long resultMaxSize = 1024;
    }

    @Data
    public static class RetrievalProperties {
        private int defaultPageSize = 20;
        private int maxPageSize = 100;
        private Duration recentWindow = Duration.ofHours(24);
        private long frequentAccessThreshold = 10;
        private ScoringProperties scoring = new ScoringProperties();
    }

    @Data
    public static class ScoringProperties {
        private double textWeight = 0.6;
        private double recencyWeight = 0.25;
        private double referenceWeight = 0.15;
        private Duration recencyHalfLife = Duration.ofDays(7);
        /**
         * Reference count at which the reference component reaches one half.
         */
        private long referenceSaturation = 10;
    }

    @Data
    public static class HiveClientProperties {
        /**
         * HIVE base URL. Self-registration is disabled when empty.
         */
        private String baseUrl = "";
        private String instanceId = "";
        private String role = "memory";
        /**
         * Address HIVE should route to; derived from the local port when empty.
         */
        private String advertisedAddress = "";
        private long heartbeatIntervalMs = 10_000L;
        private Duration timeout = Duration.ofSeconds(3);
    }
}

package com.z254.genesis.mnemos;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * MNEMOS - memory worker of the GENESIS swarm.
 * <p>
 * Serves a crash-safe record store with checksum-verified recovery, a two-level cache and
 * paginated, ranked retrieval. Registers itself with HIVE when a hub address is configured.
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class MnemosApplication {

    public static void main(String[] args) {
        SpringApplication.run(MnemosApplication.class, args);
    }
}

package com.z254.genesis.hive;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * HIVE - orchestration hub of the GENESIS swarm.
 *
 * <p>HIVE provides:
 * <ul>
 *   <li>Service Registry - worker registration, heartbeats and a change feed</li>
 *   <li>Health Monitor - scheduled staleness sweep with optional liveness probing</li>
 *   <li>Request Router - per-role round-robin with retries on alternate instances</li>
 *   <li>Circuit Breaking - per-instance breakers with a single half-open trial</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class HiveApplication {

    public static void main(String[] args) {
        SpringApplication.run(HiveApplication.class, args);
    }
}

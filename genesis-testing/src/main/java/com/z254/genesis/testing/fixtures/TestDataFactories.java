package com.z254.genesis.testing.fixtures;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Factory utilities for generating test data across GENESIS services.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * String id = TestDataFactories.uniqueId("memory");        // "memory-a1b2c3d4"
 * String address = TestDataFactories.workerAddress(8101);  // "http://localhost:8101"
 * Instant earlier = TestDataFactories.daysAgo(TestDataFactories.EPOCH, 3);
 * }</pre>
 */
public final class TestDataFactories {

    /** Fixed epoch used by deterministic clocks in tests. */
    public static final Instant EPOCH = Instant.parse("2024-05-01T10:00:00Z");

    private static final List<String> THEMES = List.of(
            "family", "work", "travel", "music", "learning", "health"
    );

    private TestDataFactories() {
    }

    // ==========================================================================
    // Identifiers
    // ==========================================================================

    public static String uniqueId(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    // ==========================================================================
    // Swarm instances
    // ==========================================================================

    public static String workerAddress(int port) {
        return "http://localhost:" + port;
    }

    public static List<String> capabilities(String role) {
        return List.of(role + ".read", role + ".write");
    }

    // ==========================================================================
    // Memory content
    // ==========================================================================

    public static String randomTheme() {
        return THEMES.get(ThreadLocalRandom.current().nextInt(THEMES.size()));
    }

    public static Map<String, Double> emotions(String emotion, double score) {
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put(emotion, score);
        return scores;
    }

    // ==========================================================================
    // Timestamps
    // ==========================================================================

    public static Instant daysAgo(Instant reference, long days) {
        return reference.minus(days, ChronoUnit.DAYS);
    }
}

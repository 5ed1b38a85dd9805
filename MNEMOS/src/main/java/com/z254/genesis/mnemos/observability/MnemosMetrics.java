package com.z254.genesis.mnemos.observability;

import com.github.benmanes.caffeine.cache.Cache;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for MNEMOS service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Store writes, reads and their latency</li>
 *     <li>Checksum failures and recoveries from backup</li>
 *     <li>Backups taken and failed</li>
 *     <li>Cache hit ratios via the Caffeine binder</li>
 * </ul>
 */
@Component
public class MnemosMetrics {

    private final MeterRegistry meterRegistry;

    @Getter
    private final Counter writes;
    @Getter
    private final Counter reads;
    @Getter
    private final Counter corruptions;
    @Getter
    private final Counter recoveries;
    @Getter
    private final Counter backups;
    @Getter
    private final Counter backupFailures;

    private final Timer writeLatency;

    public MnemosMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.writes = Counter.builder("mnemos.store.writes")
                .description("Records written atomically")
                .register(meterRegistry);
        this.reads = Counter.builder("mnemos.store.reads")
                .description("Records loaded from disk")
                .register(meterRegistry);
        this.corruptions = Counter.builder("mnemos.store.corruptions")
                .description("Records whose checksum did not verify on load")
                .register(meterRegistry);
        this.recoveries = Counter.builder("mnemos.store.recoveries")
                .description("Corrupted records repaired from a backup")
                .register(meterRegistry);
        this.backups = Counter.builder("mnemos.backups.created")
                .description("Backups taken")
                .register(meterRegistry);
        this.backupFailures = Counter.builder("mnemos.backups.failed")
                .description("Backups that failed")
                .register(meterRegistry);
        this.writeLatency = Timer.builder("mnemos.store.write.latency")
                .description("Latency of atomic record writes")
                .register(meterRegistry);
    }

    public void recordWrite(Duration elapsed) {
        writes.increment();
        writeLatency.record(elapsed);
    }

    public void recordRead() {
        reads.increment();
    }

    public void recordCorruption() {
        corruptions.increment();
    }

    public void recordRecovery() {
        recoveries.increment();
    }

    public void recordBackup(boolean success) {
        (success ? backups : backupFailures).increment();
    }

    public void recordQuery(String type, boolean cached) {
        meterRegistry.counter("mnemos.retrieval.queries", "type", type, "cached", String.valueOf(cached))
                .increment();
    }

    public void monitorCache(Cache<?, ?> cache, String name) {
        CaffeineCacheMetrics.monitor(meterRegistry, cache, name);
    }
}

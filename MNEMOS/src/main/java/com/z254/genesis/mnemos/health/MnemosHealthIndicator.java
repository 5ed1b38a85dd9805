package com.z254.genesis.mnemos.health;

import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.z254.genesis.mnemos.registration.HiveRegistrationClient;
import com.z254.genesis.mnemos.retrieval.MemoryRetrievalEngine;
import com.z254.genesis.mnemos.store.BackupInfo;
import com.z254.genesis.mnemos.store.MemoryStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Health indicator for MNEMOS service.
 * Down when the record directory is not writable; reports store size, backups and cache hit rates.
 */
@Component
@Slf4j
public class MnemosHealthIndicator implements ReactiveHealthIndicator {

    private final MemoryStore store;
    private final MemoryRetrievalEngine engine;
    private final HiveRegistrationClient registrationClient;

    public MnemosHealthIndicator(MemoryStore store, MemoryRetrievalEngine engine,
                                 HiveRegistrationClient registrationClient) {
        this.store = store;
        this.engine = engine;
        this.registrationClient = registrationClient;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(() -> {
                    boolean writable = store.isWritable();
                    List<BackupInfo> backups = store.listBackups();
                    CacheStats recent = engine.recentStats();
                    CacheStats results = engine.resultStats();

                    Health.Builder builder = writable ? Health.up() : Health.down();
                    return builder
                            .withDetail("writable", writable)
                            .withDetail("records", store.count())
                            .withDetail("backups", backups.size())
                            .withDetail("latestBackup", backups.isEmpty() ? "none" : backups.get(0).id())
                            .withDetail("recentCacheHitRate", recent.hitRate())
                            .withDetail("resultCacheHitRate", results.hitRate())
                            .withDetail("hiveRegistration", registrationClient.isEnabled() ? "enabled" : "disabled")
                            .build();
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    log.error("Health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }
}

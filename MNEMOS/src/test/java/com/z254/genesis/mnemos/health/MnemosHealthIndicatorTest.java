package com.z254.genesis.mnemos.health;

import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.z254.genesis.mnemos.registration.HiveRegistrationClient;
import com.z254.genesis.mnemos.retrieval.MemoryRetrievalEngine;
import com.z254.genesis.mnemos.store.BackupInfo;
import com.z254.genesis.mnemos.store.MemoryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MnemosHealthIndicatorTest {

    @Mock
    private MemoryStore store;

    @Mock
    private MemoryRetrievalEngine engine;

    @Mock
    private HiveRegistrationClient registrationClient;

    private MnemosHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        indicator = new MnemosHealthIndicator(store, engine, registrationClient);
    }

    private void cachesEmpty() {
        when(engine.recentStats()).thenReturn(CacheStats.empty());
        when(engine.resultStats()).thenReturn(CacheStats.empty());
    }

    @Test
    void upWhileWritable() {
        when(store.isWritable()).thenReturn(true);
        when(store.count()).thenReturn(4L);
        when(store.listBackups()).thenReturn(List.of(
                new BackupInfo("20240501T110000000Z", Instant.parse("2024-05-01T11:00:00Z"), 4),
                new BackupInfo("20240501T100000000Z", Instant.parse("2024-05-01T10:00:00Z"), 3)));
        when(registrationClient.isEnabled()).thenReturn(false);
        cachesEmpty();

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails())
                            .containsEntry("records", 4L)
                            .containsEntry("backups", 2)
                            .containsEntry("latestBackup", "20240501T110000000Z")
                            .containsEntry("hiveRegistration", "disabled");
                })
                .verifyComplete();
    }

    @Test
    void downWhenNotWritable() {
        when(store.isWritable()).thenReturn(false);
        when(store.listBackups()).thenReturn(List.of());
        when(registrationClient.isEnabled()).thenReturn(true);
        cachesEmpty();

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails()).containsEntry("latestBackup", "none");
                })
                .verifyComplete();
    }

    @Test
    void downWhenTheStoreCannotBeInspected() {
        when(store.isWritable()).thenThrow(new IllegalStateException("root vanished"));

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails()).containsEntry("error", "root vanished");
                })
                .verifyComplete();
    }
}

package com.z254.genesis.mnemos.store;

import com.z254.genesis.common.error.ErrorKind;
import com.z254.genesis.common.error.ErrorSeverity;
import com.z254.genesis.common.error.ErrorTranslator;
import com.z254.genesis.common.error.SwarmException;
import com.z254.genesis.mnemos.config.MnemosProperties;
import com.z254.genesis.mnemos.domain.MemoryRecord;
import com.z254.genesis.mnemos.observability.MnemosMetrics;
import com.z254.genesis.testing.fixtures.TestDataFactories;
import com.z254.genesis.testing.time.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FileSystemMemoryStore} against a temporary directory.
 */
class FileSystemMemoryStoreTest {

    @TempDir
    Path root;

    private MutableClock clock;
    private MnemosProperties properties;
    private MnemosMetrics metrics;
    private RecordCodec codec;
    private FileSystemMemoryStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestDataFactories.EPOCH);
        properties = new MnemosProperties();
        properties.getStore().setRoot(root.toString());
        properties.getStore().setBackupRetention(3);
        metrics = new MnemosMetrics(new SimpleMeterRegistry());
        codec = new RecordCodec();
        store = new FileSystemMemoryStore(codec, properties, new ErrorTranslator(), metrics, clock);
    }

    private MemoryRecord memory(String id, String content) {
        return MemoryRecord.builder()
                .id(id)
                .content(content)
                .themes(Set.of("Travel"))
                .emotions(TestDataFactories.emotions("joy", 0.8))
                .build();
    }

    private void corrupt(Path file) throws IOException {
        String text = Files.readString(file, StandardCharsets.UTF_8);
        Files.writeString(file, text.replace("content", "kontent"), StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("Writing")
    class WriteTests {

        @Test
        @DisplayName("should assign an id and checksum and persist the header line")
        void putAssignsIdAndChecksum() throws IOException {
            MemoryRecord stored = store.put(memory(null, "hello"));

            assertThat(stored.getId()).isNotBlank();
            assertThat(stored.getChecksum()).hasSize(64);
            assertThat(stored.getCreatedAt()).isEqualTo(TestDataFactories.EPOCH);
            assertThat(stored.getThemes()).containsExactly("travel");

            String onDisk = Files.readString(store.recordPath(stored.getId()), StandardCharsets.UTF_8);
            assertThat(onDisk).startsWith("sha256:" + stored.getChecksum() + "\n");
        }

        @Test
        @DisplayName("put then get should return a record whose checksum matches")
        void putThenGet() {
            MemoryRecord stored = store.put(memory("m-1", "hello"));

            MemoryRecord loaded = store.get("m-1");

            assertThat(loaded.getContent()).isEqualTo("hello");
            assertThat(loaded.getChecksum()).isEqualTo(stored.getChecksum());
            assertThat(loaded.getEmotions()).containsEntry("joy", 0.8);
        }

        @Test
        @DisplayName("replacing a record should keep its creation time and reference statistics")
        void replaceKeepsHistory() {
            store.put(memory("m-1", "first"));
            clock.advance(Duration.ofMinutes(5));
            store.reference("m-1");
            clock.advance(Duration.ofMinutes(5));

            MemoryRecord replaced = store.put(memory("m-1", "second"));

            assertThat(replaced.getContent()).isEqualTo("second");
            assertThat(replaced.getCreatedAt()).isEqualTo(TestDataFactories.EPOCH);
            assertThat(replaced.getReferenceCount()).isEqualTo(1);
            assertThat(replaced.getLastReferencedAt()).isEqualTo(TestDataFactories.EPOCH.plus(Duration.ofMinutes(5)));
        }

        @Test
        void rejectsIdsOutsideTheAllowedAlphabet() {
            assertThatThrownBy(() -> store.put(memory("../escape", "x")))
                    .isInstanceOf(SwarmException.class)
                    .satisfies(e -> assertThat(((SwarmException) e).getKind()).isEqualTo(ErrorKind.INVALID_INPUT));
            assertThat(root.getParent().resolve("escape.json")).doesNotExist();
        }

        @Test
        void rejectsMissingContent() {
            assertThatThrownBy(() -> store.put(memory("m-1", null)))
                    .isInstanceOf(SwarmException.class)
                    .satisfies(e -> assertThat(((SwarmException) e).getKind()).isEqualTo(ErrorKind.MISSING_FIELD));
        }

        @Test
        void rejectsEmotionScoresOutOfRange() {
            MemoryRecord record = memory("m-1", "x");
            record.setEmotions(TestDataFactories.emotions("joy", 1.5));

            assertThatThrownBy(() -> store.put(record))
                    .isInstanceOf(SwarmException.class)
                    .satisfies(e -> assertThat(((SwarmException) e).getKind()).isEqualTo(ErrorKind.INVALID_INPUT));
        }

        @Test
        @DisplayName("a failed write should surface storage-failure and leave the prior version intact")
        void failedWriteKeepsPriorVersion() throws IOException {
            store.put(memory("m-1", "original"));
            Path target = store.recordPath("m-1");
            Files.createDirectory(target.resolveSibling(target.getFileName() + ".tmp"));
            Files.writeString(target.resolveSibling(target.getFileName() + ".tmp").resolve("blocker"), "x");

            assertThatThrownBy(() -> store.put(memory("m-1", "replacement")))
                    .isInstanceOf(SwarmException.class)
                    .satisfies(e -> assertThat(((SwarmException) e).getKind()).isEqualTo(ErrorKind.STORAGE_FAILURE));

            assertThat(store.get("m-1").getContent()).isEqualTo("original");
        }

        @Test
        @DisplayName("reference should increment the count and stamp the reference time")
        void referenceCounts() {
            store.put(memory("m-1", "x"));
            clock.advance(Duration.ofSeconds(30));

            store.reference("m-1");
            MemoryRecord referenced = store.reference("m-1");

            assertThat(referenced.getReferenceCount()).isEqualTo(2);
            assertThat(referenced.getLastReferencedAt()).isEqualTo(TestDataFactories.EPOCH.plusSeconds(30));
            assertThat(store.get("m-1").getReferenceCount()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Reading and recovery")
    class RecoveryTests {

        @Test
        void unknownIdIsNotFound() {
            assertThatThrownBy(() -> store.get("nobody"))
                    .isInstanceOf(SwarmException.class)
                    .satisfies(e -> assertThat(((SwarmException) e).getKind()).isEqualTo(ErrorKind.RESOURCE_NOT_FOUND));
        }

        @Test
        @DisplayName("a corrupted record should be restored from the last good backup and repaired on disk")
        void recoversFromBackup() throws IOException {
            store.put(memory("m-1", "hello"));
            store.backup();
            corrupt(store.recordPath("m-1"));

            MemoryRecord recovered = store.get("m-1");

            assertThat(recovered.getContent()).isEqualTo("hello");
            assertThat(codec.decode(Files.readAllBytes(store.recordPath("m-1")))).isPresent();
            assertThat(metrics.getCorruptions().count()).isEqualTo(1.0);
            assertThat(metrics.getRecoveries().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("recovery should skip newer backups whose copy is also corrupted")
        void skipsCorruptedBackups() throws IOException {
            store.put(memory("m-1", "version one"));
            store.backup();
            store.put(memory("m-1", "version two"));
            BackupInfo newer = store.backup();

            corrupt(store.backupsDir().resolve(newer.id()).resolve("m-1.json"));
            corrupt(store.recordPath("m-1"));

            assertThat(store.get("m-1").getContent()).isEqualTo("version one");
        }

        @Test
        @DisplayName("without a valid backup, corruption should surface as critical resource-corrupted")
        void unrecoverable() throws IOException {
            store.put(memory("m-1", "hello"));
            corrupt(store.recordPath("m-1"));

            assertThatThrownBy(() -> store.get("m-1"))
                    .isInstanceOf(SwarmException.class)
                    .satisfies(e -> {
                        SwarmException swarm = (SwarmException) e;
                        assertThat(swarm.getKind()).isEqualTo(ErrorKind.RESOURCE_CORRUPTED);
                        assertThat(swarm.getError().getSeverity()).isEqualTo(ErrorSeverity.CRITICAL);
                    });
        }

        @Test
        @DisplayName("replacing a corrupted record should keep the history recovered from backup")
        void putOverCorruptedRecordKeepsRecoveredHistory() throws IOException {
            store.put(memory("m-1", "hello"));
            for (int i = 0; i < 4; i++) {
                store.reference("m-1");
            }
            store.backup();
            corrupt(store.recordPath("m-1"));
            clock.advance(Duration.ofDays(3));

            MemoryRecord replaced = store.put(memory("m-1", "rewritten"));

            assertThat(replaced.getCreatedAt()).isEqualTo(TestDataFactories.EPOCH);
            assertThat(replaced.getReferenceCount()).isEqualTo(4);
            assertThat(store.get("m-1").getContent()).isEqualTo("rewritten");
            assertThat(metrics.getRecoveries().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("replacing an unrecoverable record should store it as new")
        void putOverUnrecoverableRecordStartsFresh() throws IOException {
            store.put(memory("m-1", "hello"));
            store.reference("m-1");
            corrupt(store.recordPath("m-1"));
            clock.advance(Duration.ofDays(3));

            MemoryRecord replaced = store.put(memory("m-1", "rewritten"));

            assertThat(replaced.getCreatedAt()).isEqualTo(TestDataFactories.EPOCH.plus(Duration.ofDays(3)));
            assertThat(replaced.getReferenceCount()).isZero();
            assertThat(store.get("m-1").getContent()).isEqualTo("rewritten");
            assertThat(metrics.getCorruptions().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("listAll should skip unrecoverable records and temp files")
        void listAllSkipsCorrupted() throws IOException {
            store.put(memory("a", "alpha"));
            store.put(memory("b", "beta"));
            corrupt(store.recordPath("b"));
            Files.writeString(store.recordPath("c").resolveSibling("c.json.tmp"), "partial");

            List<MemoryRecord> all = store.listAll();

            assertThat(all).extracting(MemoryRecord::getId).containsExactly("a");
            assertThat(store.count()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Backups and deletion")
    class BackupTests {

        @Test
        @DisplayName("delete should back up first, then remove the record")
        void deleteBacksUpFirst() {
            store.put(memory("m-1", "hello"));

            store.delete("m-1");

            assertThatThrownBy(() -> store.get("m-1"))
                    .isInstanceOf(SwarmException.class)
                    .satisfies(e -> assertThat(((SwarmException) e).getKind()).isEqualTo(ErrorKind.RESOURCE_NOT_FOUND));
            List<BackupInfo> backups = store.listBackups();
            assertThat(backups).hasSize(1);
            assertThat(backups.get(0).recordCount()).isEqualTo(1);
            assertThat(store.backupsDir().resolve(backups.get(0).id()).resolve("m-1.json")).exists();
        }

        @Test
        void deleteUnknownIsNotFound() {
            assertThatThrownBy(() -> store.delete("nobody"))
                    .isInstanceOf(SwarmException.class)
                    .satisfies(e -> assertThat(((SwarmException) e).getKind()).isEqualTo(ErrorKind.RESOURCE_NOT_FOUND));
            assertThat(store.listBackups()).isEmpty();
        }

        @Test
        @DisplayName("backups should be listed newest first and rotated down to the retention count")
        void rotation() {
            store.put(memory("m-1", "x"));
            for (int i = 0; i < 5; i++) {
                store.backup();
                clock.advance(Duration.ofMinutes(1));
            }

            List<BackupInfo> backups = store.listBackups();

            assertThat(backups).hasSize(3);
            assertThat(backups.get(0).createdAt()).isEqualTo(TestDataFactories.EPOCH.plus(Duration.ofMinutes(4)));
            assertThat(backups.get(2).createdAt()).isEqualTo(TestDataFactories.EPOCH.plus(Duration.ofMinutes(2)));
        }

        @Test
        void backupsAtTheSameInstantGetDistinctIds() {
            store.put(memory("m-1", "x"));

            BackupInfo first = store.backup();
            BackupInfo second = store.backup();

            assertThat(second.id()).isNotEqualTo(first.id()).startsWith(first.id());
            assertThat(store.listBackups()).extracting(BackupInfo::id).containsExactly(second.id(), first.id());
        }

        @Test
        void backupCounted() {
            store.put(memory("m-1", "x"));
            store.put(memory("m-2", "y"));

            BackupInfo info = store.backup();

            assertThat(info.recordCount()).isEqualTo(2);
            assertThat(metrics.getBackups().count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Concurrent access")
    class ConcurrencyTests {

        @Test
        @DisplayName("concurrent writers, referencers and readers on one record should never lose a reference or expose a torn file")
        void oneRecordUnderContention() throws Exception {
            store.put(memory("m-1", "v0"));
            int referencers = 4;
            int referencesEach = 25;
            int writers = 2;
            int writesEach = 20;
            ExecutorService pool = Executors.newFixedThreadPool(referencers + writers + 4);
            CountDownLatch start = new CountDownLatch(1);
            AtomicBoolean writing = new AtomicBoolean(true);
            List<Future<?>> mutations = new ArrayList<>();
            List<Future<?>> readers = new ArrayList<>();
            try {
                for (int r = 0; r < referencers; r++) {
                    mutations.add(pool.submit(() -> {
                        start.await();
                        for (int i = 0; i < referencesEach; i++) {
                            store.reference("m-1");
                        }
                        return null;
                    }));
                }
                for (int w = 0; w < writers; w++) {
                    int writer = w;
                    mutations.add(pool.submit(() -> {
                        start.await();
                        for (int i = 0; i < writesEach; i++) {
                            store.put(memory("m-1", "w" + writer + "-" + i));
                        }
                        return null;
                    }));
                }
                for (int r = 0; r < 4; r++) {
                    readers.add(pool.submit(() -> {
                        start.await();
                        while (writing.get()) {
                            MemoryRecord read = store.get("m-1");
                            assertThat(read.getChecksum()).hasSize(64);
                            assertThat(read.getCreatedAt()).isEqualTo(TestDataFactories.EPOCH);
                        }
                        return null;
                    }));
                }

                start.countDown();
                for (Future<?> mutation : mutations) {
                    mutation.get(30, TimeUnit.SECONDS);
                }
                writing.set(false);
                for (Future<?> reader : readers) {
                    reader.get(30, TimeUnit.SECONDS);
                }
            } finally {
                writing.set(false);
                pool.shutdownNow();
            }

            MemoryRecord last = store.get("m-1");
            assertThat(last.getReferenceCount()).isEqualTo(referencers * referencesEach);
            assertThat(last.getContent()).startsWith("w");
            assertThat(codec.decode(Files.readAllBytes(store.recordPath("m-1")))).isPresent();
            assertThat(metrics.getCorruptions().count()).isZero();
        }

        @Test
        @DisplayName("per-record locks should not accumulate for ids that are no longer in use")
        void lockTableDoesNotGrowWithDistinctIds() throws InterruptedException {
            for (int i = 0; i < 10_000; i++) {
                String id = "ghost-" + i;
                assertThatThrownBy(() -> store.reference(id))
                        .isInstanceOf(SwarmException.class)
                        .satisfies(e -> assertThat(((SwarmException) e).getKind()).isEqualTo(ErrorKind.RESOURCE_NOT_FOUND));
            }

            for (int attempt = 0; attempt < 20 && store.lockTableSize() > 0; attempt++) {
                System.gc();
                Thread.sleep(50);
            }

            assertThat(store.lockTableSize()).isLessThan(10_000);
            assertThat(store.count()).isZero();
        }
    }
}

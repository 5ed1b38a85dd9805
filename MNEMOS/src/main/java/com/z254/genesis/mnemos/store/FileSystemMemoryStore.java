package com.z254.genesis.mnemos.store;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.z254.genesis.common.error.ErrorKind;
import com.z254.genesis.common.error.ErrorTranslator;
import com.z254.genesis.common.error.StandardError;
import com.z254.genesis.common.error.SwarmException;
import com.z254.genesis.mnemos.config.MnemosProperties;
import com.z254.genesis.mnemos.domain.MemoryRecord;
import com.z254.genesis.mnemos.observability.MnemosMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * File-per-record store under {@code <root>/records}, with point-in-time copies under
 * {@code <root>/backups/<backup-id>}.
 * <p>
 * Writes go to a sibling temp file that is forced to disk and then renamed over the target, so
 * a reader sees either the previous or the new version of a record, never a torn one. Writes to
 * one record are serialized by a per-id lock; reads take no lock until a checksum fails and the
 * record has to be repaired. Locks are weakly held and disappear once no thread uses them. Backups copy files without record locks since every file on disk
 * is always a complete version.
 */
@Component
@Slf4j
public class FileSystemMemoryStore implements MemoryStore {

    public static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9._-]{1,128}");

    private static final String RECORD_SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";
    private static final String PARTIAL_PREFIX = ".partial-";
    private static final DateTimeFormatter BACKUP_ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS'Z'").withZone(ZoneOffset.UTC);
    private static final int BACKUP_TIMESTAMP_LENGTH = 19;

    private final Path recordsDir;
    private final Path backupsDir;
    private final RecordCodec codec;
    private final MnemosProperties.StoreProperties config;
    private final ErrorTranslator translator;
    private final MnemosMetrics metrics;
    private final Clock clock;
    private final LoadingCache<String, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build(id -> new ReentrantLock());
    private final ReentrantLock backupLock = new ReentrantLock();

    public FileSystemMemoryStore(RecordCodec codec, MnemosProperties mnemosProperties, ErrorTranslator translator,
                                 MnemosMetrics metrics, Clock clock) {
        this.codec = codec;
        this.config = mnemosProperties.getStore();
        this.translator = translator;
        this.metrics = metrics;
        this.clock = clock;

        Path root = Paths.get(config.getRoot()).toAbsolutePath().normalize();
        this.recordsDir = root.resolve("records");
        this.backupsDir = root.resolve("backups");
        try {
            Files.createDirectories(recordsDir);
            Files.createDirectories(backupsDir);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot initialize memory store at " + root, e);
        }
        log.info("Memory store initialized at {} (backup retention {})", root, config.getBackupRetention());
    }

    @Override
    public MemoryRecord put(MemoryRecord record) {
        if (record == null) {
            throw SwarmException.missingField("record");
        }
        String id = record.getId() == null || record.getId().isBlank()
                ? UUID.randomUUID().toString()
                : validateId(record.getId());
        if (record.getContent() == null) {
            throw SwarmException.missingField("content");
        }
        Set<String> themes = normalizeThemes(record.getThemes());
        Map<String, Double> emotions = normalizeEmotions(record.getEmotions());

        return withLock(id, () -> {
            MemoryRecord existing = loadExisting(id).orElse(null);
            MemoryRecord toStore = MemoryRecord.builder()
                    .id(id)
                    .content(record.getContent())
                    .themes(themes)
                    .emotions(emotions)
                    .createdAt(existing != null ? existing.getCreatedAt() : clock.instant())
                    .lastReferencedAt(existing != null ? existing.getLastReferencedAt() : null)
                    .referenceCount(existing != null ? existing.getReferenceCount() : 0)
                    .build();
            MemoryRecord stored = write(toStore);
            log.debug("Stored memory {} ({})", id, existing != null ? "replaced" : "created");
            return stored;
        });
    }

    @Override
    public MemoryRecord get(String id) {
        validateId(id);
        byte[] raw = readPrimary(id);
        metrics.recordRead();
        Optional<MemoryRecord> decoded = verify(id, raw);
        if (decoded.isPresent()) {
            return decoded.get();
        }
        return withLock(id, () -> recover(id));
    }

    @Override
    public MemoryRecord reference(String id) {
        validateId(id);
        return withLock(id, () -> {
            MemoryRecord current = get(id);
            MemoryRecord referenced = current.toBuilder()
                    .referenceCount(current.getReferenceCount() + 1)
                    .lastReferencedAt(clock.instant())
                    .checksum(null)
                    .build();
            return write(referenced);
        });
    }

    @Override
    public void delete(String id) {
        validateId(id);
        withLock(id, () -> {
            Path path = recordPath(id);
            if (!Files.exists(path)) {
                throw SwarmException.notFound("Memory", id);
            }
            BackupInfo backup = backup();
            try {
                Files.delete(path);
            } catch (NoSuchFileException e) {
                throw SwarmException.notFound("Memory", id);
            } catch (IOException e) {
                throw storageFailure("delete", id, e);
            }
            log.info("Deleted memory {} after backup {}", id, backup.id());
            return null;
        });
    }

    @Override
    public BackupInfo backup() {
        backupLock.lock();
        Path partial = null;
        try {
            String backupId = nextBackupId();
            partial = backupsDir.resolve(PARTIAL_PREFIX + backupId);
            Files.createDirectories(partial);

            int copied = 0;
            for (Path file : recordFiles()) {
                try {
                    Files.copy(file, partial.resolve(file.getFileName()), StandardCopyOption.REPLACE_EXISTING);
                    copied++;
                } catch (NoSuchFileException e) {
                    log.debug("{} was removed while backing up", file.getFileName());
                }
            }

            Path target = backupsDir.resolve(backupId);
            move(partial, target);
            partial = null;
            rotateBackups();

            metrics.recordBackup(true);
            BackupInfo info = new BackupInfo(backupId, parseBackupTime(backupId), copied);
            log.info("Backup {} created with {} record(s)", backupId, copied);
            return info;
        } catch (IOException e) {
            metrics.recordBackup(false);
            throw storageFailure("backup", null, e);
        } finally {
            if (partial != null) {
                deleteQuietly(partial);
            }
            backupLock.unlock();
        }
    }

    @Override
    public List<BackupInfo> listBackups() {
        List<BackupInfo> backups = new ArrayList<>();
        for (Path dir : backupDirsNewestFirst()) {
            String backupId = dir.getFileName().toString();
            backups.add(new BackupInfo(backupId, parseBackupTime(backupId), countRecordFiles(dir)));
        }
        return backups;
    }

    @Override
    public List<MemoryRecord> listAll() {
        List<MemoryRecord> records = new ArrayList<>();
        for (Path file : recordFiles()) {
            String id = idOf(file);
            try {
                records.add(get(id));
            } catch (SwarmException e) {
                if (e.getKind() == ErrorKind.RESOURCE_NOT_FOUND) {
                    log.debug("Memory {} removed during listing", id);
                } else if (e.getKind() == ErrorKind.RESOURCE_CORRUPTED) {
                    log.error("Skipping unrecoverable memory {}: {}", id, e.getMessage());
                } else {
                    throw e;
                }
            }
        }
        return records;
    }

    @Override
    public long count() {
        return recordFiles().size();
    }

    @Override
    public boolean isWritable() {
        return Files.isDirectory(recordsDir) && Files.isWritable(recordsDir);
    }

    Path recordPath(String id) {
        Path resolved = recordsDir.resolve(id + RECORD_SUFFIX).normalize();
        if (!resolved.getParent().equals(recordsDir)) {
            throw SwarmException.invalidInput("Invalid memory id: " + id);
        }
        return resolved;
    }

    Path backupsDir() {
        return backupsDir;
    }

    long lockTableSize() {
        locks.cleanUp();
        return locks.estimatedSize();
    }

    // ========== Reading and recovery ==========

    private byte[] readPrimary(String id) {
        try {
            return Files.readAllBytes(recordPath(id));
        } catch (NoSuchFileException e) {
            throw SwarmException.notFound("Memory", id);
        } catch (IOException e) {
            throw storageFailure("read", id, e);
        }
    }

    /**
     * Current version of a record about to be replaced, recovered from backup when the primary
     * copy is corrupted. Empty when the record is new or nothing recoverable is left of it.
     * Caller holds the record lock.
     */
    private Optional<MemoryRecord> loadExisting(String id) {
        Path path = recordPath(id);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        byte[] raw;
        try {
            raw = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw storageFailure("read", id, e);
        }
        Optional<MemoryRecord> current = verify(id, raw);
        if (current.isPresent()) {
            return current;
        }
        try {
            return Optional.of(recover(id));
        } catch (SwarmException e) {
            if (e.getKind() != ErrorKind.RESOURCE_CORRUPTED) {
                throw e;
            }
            log.warn("Overwriting unrecoverable memory {} as a new record", id);
            return Optional.empty();
        }
    }

    private Optional<MemoryRecord> verify(String id, byte[] raw) {
        return codec.decode(raw).filter(record -> id.equals(record.getId()));
    }

    private MemoryRecord recover(String id) {
        // another reader may have repaired it while we waited for the lock
        Optional<MemoryRecord> current = verify(id, readPrimary(id));
        if (current.isPresent()) {
            return current.get();
        }

        metrics.recordCorruption();
        log.warn("Checksum mismatch for memory {}, searching backups", id);

        int checked = 0;
        for (Path dir : backupDirsNewestFirst()) {
            Path copy = dir.resolve(id + RECORD_SUFFIX);
            if (!Files.exists(copy)) {
                continue;
            }
            checked++;
            try {
                byte[] raw = Files.readAllBytes(copy);
                Optional<MemoryRecord> restored = verify(id, raw);
                if (restored.isPresent()) {
                    atomicWrite(recordPath(id), raw);
                    metrics.recordRecovery();
                    log.warn("Recovered memory {} from backup {}", id, dir.getFileName());
                    return restored.get();
                }
                log.warn("Backup {} holds a corrupted copy of memory {}", dir.getFileName(), id);
            } catch (NoSuchFileException e) {
                log.debug("Backup {} was rotated out during recovery of {}", dir.getFileName(), id);
            } catch (IOException e) {
                throw storageFailure("recover", id, e);
            }
        }

        log.error("Memory {} is corrupted and no valid backup exists ({} copies checked)", id, checked);
        throw SwarmException.of(ErrorKind.RESOURCE_CORRUPTED,
                "Memory " + id + " failed checksum verification and could not be recovered",
                Map.of("id", id, "backupsChecked", checked));
    }

    // ========== Writing ==========

    private MemoryRecord write(MemoryRecord record) {
        RecordCodec.Encoded encoded = codec.encode(record);
        long start = System.nanoTime();
        try {
            atomicWrite(recordPath(record.getId()), encoded.bytes());
        } catch (IOException e) {
            throw storageFailure("write", record.getId(), e);
        }
        metrics.recordWrite(Duration.ofNanos(System.nanoTime() - start));
        return encoded.record();
    }

    private void atomicWrite(Path target, byte[] bytes) throws IOException {
        Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
        try {
            try (FileChannel channel = FileChannel.open(temp,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            move(temp, target);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                log.warn("Failed to clean up temp file {}: {}", temp, cleanup.getMessage());
            }
            throw e;
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, using regular move", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    // ========== Backups ==========

    private String nextBackupId() {
        String base = BACKUP_ID_FORMAT.format(clock.instant());
        String candidate = base;
        for (int n = 1; Files.exists(backupsDir.resolve(candidate)); n++) {
            candidate = String.format(Locale.ROOT, "%s-%03d", base, n);
        }
        return candidate;
    }

    private void rotateBackups() {
        int retention = Math.max(1, config.getBackupRetention());
        List<Path> backups = backupDirsNewestFirst();
        for (Path stale : backups.subList(Math.min(retention, backups.size()), backups.size())) {
            deleteQuietly(stale);
            log.debug("Rotated out backup {}", stale.getFileName());
        }
    }

    private List<Path> backupDirsNewestFirst() {
        try (Stream<Path> dirs = Files.list(backupsDir)) {
            return dirs.filter(Files::isDirectory)
                    .filter(dir -> !dir.getFileName().toString().startsWith("."))
                    .sorted(Comparator.comparing((Path dir) -> dir.getFileName().toString()).reversed())
                    .toList();
        } catch (IOException e) {
            throw storageFailure("list-backups", null, e);
        }
    }

    private static Instant parseBackupTime(String backupId) {
        try {
            return Instant.from(BACKUP_ID_FORMAT.parse(backupId.substring(0,
                    Math.min(BACKUP_TIMESTAMP_LENGTH, backupId.length()))));
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private void deleteQuietly(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", dir, e.getMessage());
        }
    }

    // ========== Helpers ==========

    private List<Path> recordFiles() {
        return listRecordFiles(recordsDir);
    }

    private int countRecordFiles(Path dir) {
        return listRecordFiles(dir).size();
    }

    private List<Path> listRecordFiles(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile)
                    .filter(file -> file.getFileName().toString().endsWith(RECORD_SUFFIX))
                    .sorted()
                    .toList();
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw storageFailure("list", null, e);
        }
    }

    private static String idOf(Path file) {
        String name = file.getFileName().toString();
        return name.substring(0, name.length() - RECORD_SUFFIX.length());
    }

    private <T> T withLock(String id, Supplier<T> action) {
        ReentrantLock lock = locks.get(id);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private static String validateId(String id) {
        if (id == null || id.isBlank()) {
            throw SwarmException.missingField("id");
        }
        if (!ID_PATTERN.matcher(id).matches()) {
            throw SwarmException.of(ErrorKind.INVALID_INPUT,
                    "Memory id must match " + ID_PATTERN.pattern(), Map.of("id", id));
        }
        return id;
    }

    private static Set<String> normalizeThemes(Set<String> themes) {
        Set<String> normalized = new LinkedHashSet<>();
        if (themes != null) {
            themes.stream()
                    .filter(Objects::nonNull)
                    .map(theme -> theme.trim().toLowerCase(Locale.ROOT))
                    .filter(theme -> !theme.isEmpty())
                    .forEach(normalized::add);
        }
        return normalized;
    }

    private static Map<String, Double> normalizeEmotions(Map<String, Double> emotions) {
        Map<String, Double> normalized = new TreeMap<>();
        if (emotions == null) {
            return normalized;
        }
        emotions.forEach((name, score) -> {
            if (name == null || name.isBlank()) {
                throw SwarmException.invalidInput("Emotion names must not be blank");
            }
            if (score == null || score.isNaN() || score < 0.0 || score > 1.0) {
                throw SwarmException.of(ErrorKind.INVALID_INPUT,
                        "Emotion scores must be between 0 and 1",
                        Map.of("emotion", name, "score", String.valueOf(score)));
            }
            normalized.put(name.trim().toLowerCase(Locale.ROOT), score);
        });
        return normalized;
    }

    private SwarmException storageFailure(String operation, String id, IOException cause) {
        StandardError error = translator.translate(cause)
                .withDetail("operation", operation);
        if (id != null) {
            error = error.withDetail("id", id);
        }
        log.error("Store {} failed{}: {}", operation, id != null ? " for " + id : "", cause.toString());
        return new SwarmException(error, cause);
    }
}

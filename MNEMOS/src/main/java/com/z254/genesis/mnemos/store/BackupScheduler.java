package com.z254.genesis.mnemos.store;

import com.z254.genesis.common.error.SwarmException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic store backups. A failed run is logged and retried on the next tick; it never
 * affects writes.
 */
@Component
@ConditionalOnProperty(prefix = "mnemos.store", name = "scheduled-backups", havingValue = "true", matchIfMissing = true)
@Slf4j
public class BackupScheduler {

    private final MemoryStore store;

    public BackupScheduler(MemoryStore store) {
        this.store = store;
    }

    @Scheduled(fixedDelayString = "${mnemos.store.backup-interval-ms:3600000}",
            initialDelayString = "${mnemos.store.backup-interval-ms:3600000}")
    public void scheduledBackup() {
        try {
            BackupInfo backup = store.backup();
            log.debug("Scheduled backup {} completed", backup.id());
        } catch (SwarmException e) {
            log.error("Scheduled backup failed: {}", e.getMessage());
        }
    }
}

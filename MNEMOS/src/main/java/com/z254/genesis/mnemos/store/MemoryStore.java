package com.z254.genesis.mnemos.store;

import com.z254.genesis.mnemos.domain.MemoryRecord;

import java.util.List;

/**
 * Durable record storage. Every failure crosses this boundary as a
 * {@link com.z254.genesis.common.error.SwarmException}.
 */
public interface MemoryStore {

    /**
     * Write a record, assigning an id when absent. Replacing an existing record keeps its
     * creation time and reference statistics.
     *
     * @return the stored record with id and checksum
     */
    MemoryRecord put(MemoryRecord record);

    /**
     * Load a verified record, repairing it from the newest valid backup when its checksum fails.
     */
    MemoryRecord get(String id);

    /**
     * Count a read-reference: increments the reference count and stamps the reference time.
     */
    MemoryRecord reference(String id);

    /**
     * Back up the store, then remove the record.
     */
    void delete(String id);

    BackupInfo backup();

    /**
     * Retained backups, newest first.
     */
    List<BackupInfo> listBackups();

    /**
     * Every record that verifies or could be recovered; unrecoverable records are skipped.
     */
    List<MemoryRecord> listAll();

    long count();

    boolean isWritable();
}

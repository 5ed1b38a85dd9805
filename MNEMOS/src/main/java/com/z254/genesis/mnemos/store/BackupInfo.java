package com.z254.genesis.mnemos.store;

import java.time.Instant;

/**
 * A retained point-in-time copy of the store.
 */
public record BackupInfo(String id, Instant createdAt, int recordCount) {
}

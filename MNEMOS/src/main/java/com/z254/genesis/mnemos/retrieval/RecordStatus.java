package com.z254.genesis.mnemos.retrieval;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Read-time classification of a record; never stored.
 */
public enum RecordStatus {
    NEW("new"),
    FREQUENTLY_ACCESSED("frequently-accessed");

    private final String wireName;

    RecordStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}

package com.z254.genesis.mnemos.retrieval;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.z254.genesis.common.error.ErrorKind;
import com.z254.genesis.common.error.SwarmException;
import com.z254.genesis.mnemos.domain.MemoryRecord;

import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;
import java.util.Map;

/**
 * Page orderings. Every ordering falls back to ascending id so pages are deterministic.
 */
public enum SortKey {

    CREATED("created", Comparator.comparing(MemoryRecord::getCreatedAt,
            Comparator.nullsLast(Comparator.<Instant>reverseOrder()))),
    REFERENCED("referenced", Comparator.comparing(MemoryRecord::getLastReferencedAt,
            Comparator.nullsLast(Comparator.<Instant>reverseOrder()))),
    REFERENCES("references", Comparator.comparingLong(MemoryRecord::getReferenceCount).reversed()),
    ID("id", (a, b) -> 0);

    private final String wireName;
    private final Comparator<MemoryRecord> comparator;

    SortKey(String wireName, Comparator<MemoryRecord> primary) {
        this.wireName = wireName;
        this.comparator = primary.thenComparing(MemoryRecord::getId);
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public Comparator<MemoryRecord> comparator() {
        return comparator;
    }

    @JsonCreator
    public static SortKey fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return CREATED;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(key -> key.wireName.equals(normalized))
                .findFirst()
                .orElseThrow(() -> SwarmException.of(ErrorKind.INVALID_INPUT,
                        "Unknown sort key: " + value,
                        Map.of("field", "sort", "allowed", "created, referenced, references, id")));
    }
}

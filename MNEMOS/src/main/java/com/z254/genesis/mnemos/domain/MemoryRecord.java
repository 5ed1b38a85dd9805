package com.z254.genesis.mnemos.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * A stored memory. The checksum covers the serialized form of every other field.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MemoryRecord {

    private String id;
    private String content;
    private Instant createdAt;
    private Instant lastReferencedAt;
    private long referenceCount;
    @Builder.Default
    private Set<String> themes = new LinkedHashSet<>();
    @Builder.Default
    private Map<String, Double> emotions = new TreeMap<>();
    private String checksum;

    public MemoryRecord copy() {
        return toBuilder()
                .themes(themes != null ? new LinkedHashSet<>(themes) : new LinkedHashSet<>())
                .emotions(emotions != null ? new TreeMap<>(emotions) : new TreeMap<>())
                .build();
    }
}

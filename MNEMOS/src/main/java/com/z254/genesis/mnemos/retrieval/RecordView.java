package com.z254.genesis.mnemos.retrieval;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.z254.genesis.mnemos.domain.MemoryRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * A record as returned to callers: the stored fields plus derived status and, for search
 * results, the relevance score.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecordView {

    private String id;
    private String content;
    private Instant createdAt;
    private Instant lastReferencedAt;
    private long referenceCount;
    private Set<String> themes;
    private Map<String, Double> emotions;
    private String checksum;
    private List<RecordStatus> status;
    private Double score;

    public static RecordView of(MemoryRecord record, List<RecordStatus> status, Double score) {
        return RecordView.builder()
                .id(record.getId())
                .content(record.getContent())
                .createdAt(record.getCreatedAt())
                .lastReferencedAt(record.getLastReferencedAt())
                .referenceCount(record.getReferenceCount())
                .themes(record.getThemes() != null ? new LinkedHashSet<>(record.getThemes()) : new LinkedHashSet<>())
                .emotions(record.getEmotions() != null ? new TreeMap<>(record.getEmotions()) : new TreeMap<>())
                .checksum(record.getChecksum())
                .status(new ArrayList<>(status))
                .score(score)
                .build();
    }
}

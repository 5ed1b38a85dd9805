package com.z254.genesis.mnemos.api.dto;

import com.z254.genesis.mnemos.domain.MemoryRecord;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Request DTO for storing a memory. Content presence is checked by the store so it can
 * report missing-field.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryRequest {

    @Size(max = 128, message = "Memory id must be at most 128 characters")
    @Pattern(regexp = "[A-Za-z0-9._-]*", message = "Memory id may only contain letters, digits, '.', '_' and '-'")
    private String id;

    @Size(max = 65536, message = "Content must be at most 65536 characters")
    private String content;

    private Set<String> themes;

    private Map<String, Double> emotions;

    public MemoryRecord toRecord() {
        return MemoryRecord.builder()
                .id(id)
                .content(content)
                .themes(themes != null ? new LinkedHashSet<>(themes) : new LinkedHashSet<>())
                .emotions(emotions != null ? new TreeMap<>(emotions) : new TreeMap<>())
                .build();
    }
}

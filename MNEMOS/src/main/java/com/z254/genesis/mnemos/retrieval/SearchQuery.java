package com.z254.genesis.mnemos.retrieval;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Set;

/**
 * Search criteria. A blank query matches every record that passes the filters.
 * <p>
 * {@code themes} matches records carrying at least one of the given themes. {@code minScore} and
 * {@code maxScore} bound the score of {@code emotion}, or of any emotion when none is named.
 * {@code createdFrom} is inclusive, {@code createdTo} exclusive.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SearchQuery {

    @Size(max = 1024, message = "Query must be at most 1024 characters")
    private String query;
    private Set<String> themes;
    private String emotion;
    private Double minScore;
    private Double maxScore;
    private Instant createdFrom;
    private Instant createdTo;
    private Integer page;
    private Integer pageSize;
}

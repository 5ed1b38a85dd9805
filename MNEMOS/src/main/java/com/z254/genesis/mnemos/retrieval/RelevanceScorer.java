package com.z254.genesis.mnemos.retrieval;

import com.z254.genesis.mnemos.domain.MemoryRecord;

import java.time.Instant;
import java.util.List;

/**
 * Ranking strategy for search results. Higher scores rank first.
 */
public interface RelevanceScorer {

    /**
     * Binds a query once so that scoring each candidate does no per-query setup.
     *
     * @param terms lower-cased query terms; empty for a blank query
     * @param now   evaluation time for recency
     */
    QueryScorer prepare(List<String> terms, Instant now);

    /** Scores candidates against one prepared query. */
    @FunctionalInterface
    interface QueryScorer {
        double score(MemoryRecord record);
    }
}

package com.z254.genesis.mnemos.retrieval;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.z254.genesis.common.error.ErrorKind;
import com.z254.genesis.common.error.SwarmException;
import com.z254.genesis.mnemos.config.MnemosProperties;
import com.z254.genesis.mnemos.domain.MemoryRecord;
import com.z254.genesis.mnemos.observability.MnemosMetrics;
import com.z254.genesis.mnemos.store.BackupInfo;
import com.z254.genesis.mnemos.store.MemoryStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Cached read path over the {@link MemoryStore}.
 * <p>
 * Two Caffeine caches: a small short-lived one of individual records, refreshed on every write,
 * and a larger one of computed pages and search results. Result keys carry the store generation
 * current when computation started; every write bumps the generation before it is acknowledged,
 * so a result computed concurrently with a write lands under a key no later lookup uses.
 */
@Service
@Slf4j
public class MemoryRetrievalEngine {

    private final MemoryStore store;
    private final RelevanceScorer scorer;
    private final MnemosProperties.RetrievalProperties config;
    private final MnemosMetrics metrics;
    private final Clock clock;

    private final Cache<String, MemoryRecord> recentCache;
    private final Cache<ResultKey, RankedSlice> resultCache;
    private final AtomicLong generation = new AtomicLong();

    public MemoryRetrievalEngine(MemoryStore store, RelevanceScorer scorer, MnemosProperties mnemosProperties,
                                 MnemosMetrics metrics, Clock clock, Ticker ticker) {
        this.store = store;
        this.scorer = scorer;
        this.config = mnemosProperties.getRetrieval();
        this.metrics = metrics;
        this.clock = clock;

        MnemosProperties.CacheProperties cacheConfig = mnemosProperties.getCache();
        this.recentCache = Caffeine.newBuilder()
                .expireAfterWrite(cacheConfig.getRecentTtl())
                .maximumSize(cacheConfig.getRecentMaxSize())
                .ticker(ticker)
                .recordStats()
                .build();
        this.resultCache = Caffeine.newBuilder()
                .expireAfterWrite(cacheConfig.getResultTtl())
                .maximumSize(cacheConfig.getResultMaxSize())
                .ticker(ticker)
                .recordStats()
                .build();
        metrics.monitorCache(recentCache, "mnemos.recent");
        metrics.monitorCache(resultCache, "mnemos.results");

        log.info("Initialized retrieval caches: recentTtl={}, resultTtl={}, maxPageSize={}",
                cacheConfig.getRecentTtl(), cacheConfig.getResultTtl(), config.getMaxPageSize());
    }

    // ========== Records ==========

    public MemoryRecord get(String id) {
        return recentCache.get(id, store::get).copy();
    }

    public MemoryRecord put(MemoryRecord record) {
        MemoryRecord stored = store.put(record);
        invalidateResults();
        recentCache.put(stored.getId(), stored);
        return stored.copy();
    }

    public MemoryRecord reference(String id) {
        MemoryRecord referenced = store.reference(id);
        invalidateResults();
        recentCache.put(referenced.getId(), referenced);
        return referenced.copy();
    }

    public void delete(String id) {
        try {
            store.delete(id);
        } finally {
            invalidateResults();
            recentCache.invalidate(id);
        }
    }

    public BackupInfo backup() {
        return store.backup();
    }

    public List<BackupInfo> listBackups() {
        return store.listBackups();
    }

    // ========== Pages and search ==========

    public PageResult<RecordView> getPage(int page, int pageSize, SortKey sortKey) {
        validatePaging(page, pageSize);
        SortKey sort = sortKey != null ? sortKey : SortKey.CREATED;
        ResultKey key = new ResultKey(generation.get(), sort, page, pageSize);

        RankedSlice slice = lookup(key, "page", () -> {
            List<MemoryRecord> ordered = store.listAll().stream()
                    .sorted(sort.comparator())
                    .toList();
            return RankedSlice.of(ordered, null, page, pageSize);
        });
        return render(slice);
    }

    public PageResult<RecordView> search(SearchQuery query) {
        SearchQuery criteria = normalize(query);
        ResultKey key = new ResultKey(generation.get(), criteria, criteria.getPage(), criteria.getPageSize());

        RankedSlice slice = lookup(key, "search", () -> {
            List<String> terms = terms(criteria.getQuery());
            RelevanceScorer.QueryScorer scoring = scorer.prepare(terms, clock.instant());
            List<Scored> ranked = store.listAll().stream()
                    .filter(record -> matchesTerms(record, terms) && matchesFilters(record, criteria))
                    .map(record -> new Scored(record, scoring.score(record)))
                    .sorted(Comparator.comparingDouble(Scored::score).reversed()
                            .thenComparing(Comparator.comparingLong((Scored s) -> s.record().getReferenceCount())
                                    .reversed())
                            .thenComparing(s -> s.record().getId()))
                    .toList();
            return RankedSlice.of(ranked.stream().map(Scored::record).toList(),
                    ranked.stream().map(Scored::score).toList(),
                    criteria.getPage(), criteria.getPageSize());
        });
        return render(slice);
    }

    public List<RecordStatus> statusOf(MemoryRecord record, Instant now) {
        List<RecordStatus> status = new ArrayList<>(2);
        if (record.getCreatedAt() != null && !record.getCreatedAt().isBefore(now.minus(config.getRecentWindow()))) {
            status.add(RecordStatus.NEW);
        }
        if (record.getReferenceCount() > config.getFrequentAccessThreshold()) {
            status.add(RecordStatus.FREQUENTLY_ACCESSED);
        }
        return status;
    }

    public RecordView view(MemoryRecord record) {
        return RecordView.of(record, statusOf(record, clock.instant()), null);
    }

    public CacheStats recentStats() {
        return recentCache.stats();
    }

    public CacheStats resultStats() {
        return resultCache.stats();
    }

    public long generation() {
        return generation.get();
    }

    // ========== Internals ==========

    private void invalidateResults() {
        generation.incrementAndGet();
        resultCache.invalidateAll();
    }

    private RankedSlice lookup(ResultKey key, String type, Supplier<RankedSlice> compute) {
        RankedSlice cached = resultCache.getIfPresent(key);
        metrics.recordQuery(type, cached != null);
        if (cached != null) {
            return cached;
        }
        return resultCache.get(key, k -> compute.get());
    }

    private PageResult<RecordView> render(RankedSlice slice) {
        Instant now = clock.instant();
        List<RecordView> items = new ArrayList<>(slice.records().size());
        for (int i = 0; i < slice.records().size(); i++) {
            MemoryRecord record = slice.records().get(i);
            Double score = slice.scores() != null ? slice.scores().get(i) : null;
            items.add(RecordView.of(record, statusOf(record, now), score));
        }
        return PageResult.<RecordView>builder()
                .items(items)
                .metadata(slice.metadata())
                .build();
    }

    private void validatePaging(int page, int pageSize) {
        if (page < 1) {
            throw SwarmException.of(ErrorKind.INVALID_INPUT, "page must be at least 1",
                    Map.of("field", "page", "value", page));
        }
        if (pageSize < 1 || pageSize > config.getMaxPageSize()) {
            throw SwarmException.of(ErrorKind.INVALID_INPUT,
                    "pageSize must be between 1 and " + config.getMaxPageSize(),
                    Map.of("field", "pageSize", "value", pageSize));
        }
    }

    private SearchQuery normalize(SearchQuery query) {
        SearchQuery source = query != null ? query : new SearchQuery();
        int page = source.getPage() != null ? source.getPage() : 1;
        int pageSize = source.getPageSize() != null ? source.getPageSize() : config.getDefaultPageSize();
        validatePaging(page, pageSize);

        if (source.getMinScore() != null && source.getMaxScore() != null
                && source.getMinScore() > source.getMaxScore()) {
            throw SwarmException.of(ErrorKind.INVALID_INPUT, "minScore must not exceed maxScore",
                    Map.of("field", "minScore"));
        }
        if (source.getCreatedFrom() != null && source.getCreatedTo() != null
                && source.getCreatedFrom().isAfter(source.getCreatedTo())) {
            throw SwarmException.of(ErrorKind.INVALID_INPUT, "createdFrom must not be after createdTo",
                    Map.of("field", "createdFrom"));
        }

        Set<String> themes = source.getThemes() == null ? null : source.getThemes().stream()
                .filter(Objects::nonNull)
                .map(theme -> theme.trim().toLowerCase(Locale.ROOT))
                .filter(theme -> !theme.isEmpty())
                .collect(Collectors.toCollection(TreeSet::new));

        return source.toBuilder()
                .query(String.join(" ", terms(source.getQuery())))
                .themes(themes == null || themes.isEmpty() ? null : themes)
                .emotion(source.getEmotion() == null || source.getEmotion().isBlank()
                        ? null : source.getEmotion().trim().toLowerCase(Locale.ROOT))
                .page(page)
                .pageSize(pageSize)
                .build();
    }

    private static List<String> terms(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        return Arrays.stream(query.trim().toLowerCase(Locale.ROOT).split("\\s+"))
                .filter(term -> !term.isEmpty())
                .toList();
    }

    private static boolean matchesTerms(MemoryRecord record, List<String> terms) {
        if (terms.isEmpty()) {
            return true;
        }
        String content = record.getContent() != null ? record.getContent().toLowerCase(Locale.ROOT) : "";
        Set<String> themes = record.getThemes() != null ? record.getThemes() : Set.of();
        return terms.stream().allMatch(term ->
                content.contains(term) || themes.stream().anyMatch(theme -> theme.contains(term)));
    }

    private static boolean matchesFilters(MemoryRecord record, SearchQuery criteria) {
        if (criteria.getThemes() != null) {
            Set<String> themes = record.getThemes() != null ? record.getThemes() : Set.of();
            if (criteria.getThemes().stream().noneMatch(themes::contains)) {
                return false;
            }
        }
        if (criteria.getEmotion() != null || criteria.getMinScore() != null || criteria.getMaxScore() != null) {
            double min = criteria.getMinScore() != null ? criteria.getMinScore() : 0.0;
            double max = criteria.getMaxScore() != null ? criteria.getMaxScore() : 1.0;
            Map<String, Double> emotions = record.getEmotions() != null ? record.getEmotions() : Map.of();
            boolean inRange = criteria.getEmotion() != null
                    ? emotions.containsKey(criteria.getEmotion())
                    && emotions.get(criteria.getEmotion()) >= min && emotions.get(criteria.getEmotion()) <= max
                    : emotions.values().stream().anyMatch(score -> score >= min && score <= max);
            if (!inRange) {
                return false;
            }
        }
        Instant created = record.getCreatedAt();
        if (criteria.getCreatedFrom() != null && (created == null || created.isBefore(criteria.getCreatedFrom()))) {
            return false;
        }
        return criteria.getCreatedTo() == null || (created != null && created.isBefore(criteria.getCreatedTo()));
    }

    private record ResultKey(long generation, Object criteria, int page, int pageSize) {
    }

    private record Scored(MemoryRecord record, double score) {
    }

    private record RankedSlice(List<MemoryRecord> records, List<Double> scores, PageMetadata metadata) {

        static RankedSlice of(List<MemoryRecord> ordered, List<Double> scores, int page, int pageSize) {
            long from = (long) (page - 1) * pageSize;
            if (from >= ordered.size()) {
                return new RankedSlice(List.of(), scores == null ? null : List.of(),
                        PageMetadata.of(page, pageSize, ordered.size()));
            }
            int start = (int) from;
            int end = Math.min(start + pageSize, ordered.size());
            return new RankedSlice(List.copyOf(ordered.subList(start, end)),
                    scores == null ? null : List.copyOf(scores.subList(start, end)),
                    PageMetadata.of(page, pageSize, ordered.size()));
        }
    }
}

package com.z254.genesis.mnemos.retrieval;

import com.z254.genesis.mnemos.config.MnemosProperties;
import com.z254.genesis.mnemos.domain.MemoryRecord;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Weighted sum of text match strength, recency and popularity, each in [0, 1].
 * <ul>
 *     <li>text: per term 1.0 for an exact theme, 0.8 for a whole word in the content, 0.5 for a
 *     substring of content or a theme; averaged over terms</li>
 *     <li>recency: halves every {@code recency-half-life} since the last reference (or creation)</li>
 *     <li>references: {@code n / (n + reference-saturation)}</li>
 * </ul>
 */
@Component
public class DefaultRelevanceScorer implements RelevanceScorer {

    private final MnemosProperties.ScoringProperties config;

    public DefaultRelevanceScorer(MnemosProperties mnemosProperties) {
        this.config = mnemosProperties.getRetrieval().getScoring();
    }

    @Override
    public QueryScorer prepare(List<String> terms, Instant now) {
        List<Term> compiled = compile(terms);
        return record -> config.getTextWeight() * textStrength(record, compiled)
                + config.getRecencyWeight() * recency(record, now)
                + config.getReferenceWeight() * popularity(record);
    }

    static List<Term> compile(List<String> terms) {
        return terms.stream()
                .map(term -> new Term(term, Pattern.compile("\\b" + Pattern.quote(term) + "\\b")))
                .toList();
    }

    double textStrength(MemoryRecord record, List<Term> terms) {
        if (terms.isEmpty()) {
            return 0.0;
        }
        String content = record.getContent() != null ? record.getContent().toLowerCase(Locale.ROOT) : "";
        Set<String> themes = record.getThemes() != null ? record.getThemes() : Set.of();

        double total = 0.0;
        for (Term term : terms) {
            String text = term.text();
            if (themes.contains(text)) {
                total += 1.0;
            } else if (term.wholeWord().matcher(content).find()) {
                total += 0.8;
            } else if (content.contains(text) || themes.stream().anyMatch(theme -> theme.contains(text))) {
                total += 0.5;
            }
        }
        return total / terms.size();
    }

    double recency(MemoryRecord record, Instant now) {
        Instant last = record.getLastReferencedAt() != null ? record.getLastReferencedAt() : record.getCreatedAt();
        if (last == null) {
            return 0.0;
        }
        Duration age = Duration.between(last, now);
        if (age.isNegative()) {
            return 1.0;
        }
        double halfLives = (double) age.toMillis() / Math.max(1, config.getRecencyHalfLife().toMillis());
        return Math.pow(0.5, halfLives);
    }

    double popularity(MemoryRecord record) {
        long references = Math.max(0, record.getReferenceCount());
        return (double) references / (references + Math.max(1, config.getReferenceSaturation()));
    }

    record Term(String text, Pattern wholeWord) {
    }
}

package de.mirkosertic.textmetrics.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Term scores (TF-IDF, WDF-IDF) sorted by descending score.
 *
 * <p>Terms with equal scores keep their insertion order. That order carries no meaning
 * and must not be relied on by consumers.</p>
 */
public final class ScoreTable {

    private static final ScoreTable EMPTY = new ScoreTable(List.of());

    private final List<TermScore> entries;

    private ScoreTable(final List<TermScore> entries) {
        this.entries = entries;
    }

    public static ScoreTable empty() {
        return EMPTY;
    }

    /**
     * Sorts the given scores by descending value.
     *
     * @param scores term scores, iterated in insertion order
     * @return the sorted table
     */
    public static ScoreTable of(final Map<String, Double> scores) {
        if (scores.isEmpty()) {
            return EMPTY;
        }
        final List<TermScore> sorted = new ArrayList<>(scores.size());
        scores.forEach((term, score) -> sorted.add(new TermScore(term, score)));
        sorted.sort(Comparator.comparingDouble(TermScore::score).reversed());
        return new ScoreTable(List.copyOf(sorted));
    }

    public List<TermScore> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public OptionalDouble score(final String term) {
        for (final TermScore entry : entries) {
            if (entry.term().equals(term)) {
                return OptionalDouble.of(entry.score());
            }
        }
        return OptionalDouble.empty();
    }

    /**
     * Returns at most {@code limit} highest scoring entries.
     */
    public ScoreTable top(final int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive, was " + limit);
        }
        if (entries.size() <= limit) {
            return this;
        }
        return new ScoreTable(List.copyOf(entries.subList(0, limit)));
    }

    public Map<String, Double> asMap() {
        final Map<String, Double> map = new LinkedHashMap<>();
        for (final TermScore entry : entries) {
            map.put(entry.term(), entry.score());
        }
        return Collections.unmodifiableMap(map);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ScoreTable other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "ScoreTable" + entries;
    }
}

package de.mirkosertic.textmetrics.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Term occurrence counts of one token sequence, ordered by descending count.
 *
 * <p>Entries with equal counts keep the order in which their term first appeared
 * in the token sequence, so the table is reproducible for a given input.</p>
 */
public final class FrequencyTable {

    private static final FrequencyTable EMPTY = new FrequencyTable(List.of());

    private final List<TermCount> entries;

    private FrequencyTable(final List<TermCount> entries) {
        this.entries = entries;
    }

    public static FrequencyTable empty() {
        return EMPTY;
    }

    /**
     * Counts the given tokens and keeps the {@code topN} most frequent ones.
     *
     * @param tokens the token sequence, in document order
     * @param topN   maximum number of entries to keep, must be positive
     * @return the truncated table
     */
    public static FrequencyTable of(final List<String> tokens, final int topN) {
        return fromCounts(countInOrder(tokens), topN);
    }

    /**
     * Builds a table from counts whose iteration order is the first-appearance order.
     */
    static FrequencyTable fromCounts(final Map<String, Integer> countsInFirstAppearanceOrder, final int topN) {
        if (topN < 1) {
            throw new IllegalArgumentException("topN must be positive, was " + topN);
        }
        if (countsInFirstAppearanceOrder.isEmpty()) {
            return EMPTY;
        }
        final List<TermCount> sorted = new ArrayList<>(countsInFirstAppearanceOrder.size());
        countsInFirstAppearanceOrder.forEach((term, count) -> sorted.add(new TermCount(term, count)));
        // List.sort is stable, ties stay in first-appearance order
        sorted.sort(Comparator.comparingInt(TermCount::count).reversed());
        final List<TermCount> top = sorted.size() > topN ? sorted.subList(0, topN) : sorted;
        return new FrequencyTable(List.copyOf(top));
    }

    /**
     * Counts tokens into a map that iterates in first-appearance order.
     */
    static Map<String, Integer> countInOrder(final List<String> tokens) {
        final Map<String, Integer> counts = new LinkedHashMap<>();
        for (final String token : tokens) {
            counts.merge(token, 1, Integer::sum);
        }
        return counts;
    }

    public List<TermCount> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Returns the count of a term, or 0 if the term is not part of this (truncated) table.
     */
    public int count(final String term) {
        for (final TermCount entry : entries) {
            if (entry.term().equals(term)) {
                return entry.count();
            }
        }
        return 0;
    }

    /**
     * Returns the table as an insertion-ordered, unmodifiable map.
     */
    public Map<String, Integer> asMap() {
        final Map<String, Integer> map = new LinkedHashMap<>();
        for (final TermCount entry : entries) {
            map.put(entry.term(), entry.count());
        }
        return Collections.unmodifiableMap(map);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof FrequencyTable other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "FrequencyTable" + entries;
    }
}

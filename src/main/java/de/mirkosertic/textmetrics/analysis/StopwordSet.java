package de.mirkosertic.textmetrics.analysis;

import java.util.Set;

/**
 * Immutable stopwords of one language.
 *
 * @param language the normalized language code the set was requested for
 * @param words    lower-cased stopwords
 * @param fallback true if the curated list was unavailable and the built-in minimal list is used
 */
public record StopwordSet(String language, Set<String> words, boolean fallback) {

    public StopwordSet {
        words = Set.copyOf(words);
    }

    public boolean contains(final String token) {
        return words.contains(token);
    }

    public int size() {
        return words.size();
    }
}

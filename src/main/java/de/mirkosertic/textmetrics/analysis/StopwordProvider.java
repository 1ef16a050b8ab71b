package de.mirkosertic.textmetrics.analysis;

/**
 * Supplies the stopwords used to filter noise out of salience analysis.
 */
@FunctionalInterface
public interface StopwordProvider {

    /**
     * Returns the stopwords for a language. Implementations never fail for an unknown language,
     * they return a fallback set instead.
     *
     * @param language language code or name
     * @return the stopword set, never null
     */
    StopwordSet stopwords(String language);
}

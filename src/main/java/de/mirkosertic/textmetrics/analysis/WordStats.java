package de.mirkosertic.textmetrics.analysis;

/**
 * Word statistics of one document.
 *
 * @param totalWords   number of tokens, duplicates included
 * @param uniqueWords  number of distinct tokens, independent of the truncation of {@code topFrequency}
 * @param topFrequency the most frequent tokens
 */
public record WordStats(int totalWords, int uniqueWords, FrequencyTable topFrequency) {

    private static final WordStats EMPTY = new WordStats(0, 0, FrequencyTable.empty());

    public static WordStats empty() {
        return EMPTY;
    }
}

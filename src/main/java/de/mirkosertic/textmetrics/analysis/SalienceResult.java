package de.mirkosertic.textmetrics.analysis;

/**
 * Most frequent meaningful (non-stopword) tokens of a document.
 *
 * @param uniqueMeaningfulCount number of distinct tokens left after stopword removal
 * @param topMeaningful         the most frequent of them
 */
public record SalienceResult(int uniqueMeaningfulCount, FrequencyTable topMeaningful) {

    private static final SalienceResult EMPTY = new SalienceResult(0, FrequencyTable.empty());

    public static SalienceResult empty() {
        return EMPTY;
    }
}

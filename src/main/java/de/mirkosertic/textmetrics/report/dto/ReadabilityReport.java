package de.mirkosertic.textmetrics.report.dto;

import de.mirkosertic.textmetrics.analysis.ReadabilityResult;

public record ReadabilityReport(
        double readingEase,
        double gradeLevel,
        String level,
        int sentences,
        int words,
        int syllables
) {

    public static ReadabilityReport from(final ReadabilityResult result) {
        return new ReadabilityReport(result.readingEase(), result.gradeLevel(), result.label(),
                result.sentences(), result.words(), result.syllables());
    }
}

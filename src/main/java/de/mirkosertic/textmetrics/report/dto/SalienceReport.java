package de.mirkosertic.textmetrics.report.dto;

import de.mirkosertic.textmetrics.analysis.SalienceResult;
import de.mirkosertic.textmetrics.analysis.TermCount;

import java.util.List;

public record SalienceReport(int uniqueMeaningfulWords, List<TermCount> topMeaningfulWords) {

    public static SalienceReport from(final SalienceResult result) {
        return new SalienceReport(result.uniqueMeaningfulCount(), result.topMeaningful().entries());
    }
}

package de.mirkosertic.textmetrics.analysis;

import java.util.List;

/**
 * All metrics of one document.
 *
 * @param keywordDensity empty when no keywords were requested
 */
public record DocumentAnalysis(String label,
                               WordStats wordStats,
                               KeywordDensity keywordDensity,
                               ReadabilityResult readability,
                               SalienceResult salience,
                               List<Diagnostic> diagnostics) {

    public DocumentAnalysis {
        diagnostics = List.copyOf(diagnostics);
    }
}

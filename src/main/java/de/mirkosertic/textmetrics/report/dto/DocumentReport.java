package de.mirkosertic.textmetrics.report.dto;

import de.mirkosertic.textmetrics.analysis.Diagnostic;
import de.mirkosertic.textmetrics.analysis.DocumentAnalysis;
import de.mirkosertic.textmetrics.analysis.TermCount;
import de.mirkosertic.textmetrics.ingest.AnalyzedFile;

import java.util.List;
import java.util.Map;

/**
 * Metrics of one file. Absent values (no keywords, no detected language, no diagnostics) are null
 * and left out of the JSON.
 */
public record DocumentReport(
        String file,
        String fileType,
        long fileSize,
        int paragraphs,
        int rawWordCount,
        String detectedLanguage,
        int totalWords,
        int uniqueWords,
        List<TermCount> topWords,
        Map<String, Double> keywordDensity,
        ReadabilityReport readability,
        SalienceReport salience,
        List<String> diagnostics
) {

    public static DocumentReport from(final AnalyzedFile file) {
        final DocumentAnalysis analysis = file.analysis();
        final Map<String, Double> densities = analysis.keywordDensity().densities();
        final List<String> diagnostics = analysis.diagnostics().stream().map(Diagnostic::toString).toList();
        return new DocumentReport(
                file.file().toString(),
                file.fileType(),
                file.fileSize(),
                file.paragraphCount(),
                file.rawWordCount(),
                file.detectedLanguage(),
                analysis.wordStats().totalWords(),
                analysis.wordStats().uniqueWords(),
                analysis.wordStats().topFrequency().entries(),
                densities.isEmpty() ? null : densities,
                ReadabilityReport.from(analysis.readability()),
                SalienceReport.from(analysis.salience()),
                diagnostics.isEmpty() ? null : diagnostics
        );
    }
}

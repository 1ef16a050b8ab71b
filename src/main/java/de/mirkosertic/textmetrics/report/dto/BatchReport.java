package de.mirkosertic.textmetrics.report.dto;

import de.mirkosertic.textmetrics.analysis.CorpusAnalysis;
import de.mirkosertic.textmetrics.analysis.Diagnostic;
import de.mirkosertic.textmetrics.analysis.ScoreTable;
import de.mirkosertic.textmetrics.analysis.TermScore;
import de.mirkosertic.textmetrics.ingest.AnalyzedFile;
import de.mirkosertic.textmetrics.ingest.BatchResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON document of a batch analysis.
 *
 * @param tfIdf            merged TF-IDF scores, truncated to the report's top N
 * @param tfIdfByDocument  file to its TF-IDF scores, null unless per-document scores were requested
 */
public record BatchReport(
        String version,
        String language,
        int documentCount,
        int totalWords,
        List<DocumentReport> documents,
        List<FailureReport> failures,
        List<TermScore> tfIdf,
        List<TermScore> wdfIdf,
        Map<String, List<TermScore>> tfIdfByDocument,
        Map<String, List<TermScore>> wdfIdfByDocument,
        List<String> diagnostics
) {

    public record FailureReport(String file, String error) {
    }

    public static BatchReport from(final BatchResult result, final String version) {
        final int topN = result.options().topN();
        final CorpusAnalysis corpus = result.corpus();
        final List<String> diagnostics = corpus.diagnostics().stream().map(Diagnostic::toString).toList();
        return new BatchReport(
                version,
                result.options().language(),
                result.files().size(),
                result.totalRawWords(),
                result.files().stream().map(DocumentReport::from).toList(),
                result.failures().stream()
                        .map(failure -> new FailureReport(failure.file().toString(), failure.error()))
                        .toList(),
                corpus.tfIdf().top(topN).entries(),
                corpus.wdfIdf().top(topN).entries(),
                byDocument(result.files(), corpus.tfIdfByDocument(), topN),
                byDocument(result.files(), corpus.wdfIdfByDocument(), topN),
                diagnostics.isEmpty() ? null : diagnostics
        );
    }

    private static Map<String, List<TermScore>> byDocument(final List<AnalyzedFile> files,
                                                           final List<ScoreTable> tables,
                                                           final int topN) {
        if (tables.isEmpty()) {
            return null;
        }
        final Map<String, List<TermScore>> result = new LinkedHashMap<>();
        for (int i = 0; i < tables.size() && i < files.size(); i++) {
            result.put(files.get(i).file().toString(), tables.get(i).top(topN).entries());
        }
        return result;
    }
}

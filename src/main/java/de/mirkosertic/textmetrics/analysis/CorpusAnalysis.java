package de.mirkosertic.textmetrics.analysis;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of analyzing a batch of documents.
 *
 * @param documents        per-document metrics, in input order
 * @param tfIdf            merged TF-IDF table
 * @param wdfIdf           merged WDF-IDF table
 * @param tfIdfByDocument  per-document TF-IDF tables, empty unless requested
 * @param wdfIdfByDocument per-document WDF-IDF tables, empty unless requested
 * @param diagnostics      corpus level diagnostics; document level ones live in {@link DocumentAnalysis}
 */
public record CorpusAnalysis(List<DocumentAnalysis> documents,
                             ScoreTable tfIdf,
                             ScoreTable wdfIdf,
                             List<ScoreTable> tfIdfByDocument,
                             List<ScoreTable> wdfIdfByDocument,
                             List<Diagnostic> diagnostics) {

    public CorpusAnalysis {
        documents = List.copyOf(documents);
        tfIdfByDocument = List.copyOf(tfIdfByDocument);
        wdfIdfByDocument = List.copyOf(wdfIdfByDocument);
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Every diagnostic of the batch, corpus level first.
     */
    public List<Diagnostic> allDiagnostics() {
        final List<Diagnostic> all = new ArrayList<>(diagnostics);
        for (final DocumentAnalysis document : documents) {
            all.addAll(document.diagnostics());
        }
        return List.copyOf(all);
    }
}

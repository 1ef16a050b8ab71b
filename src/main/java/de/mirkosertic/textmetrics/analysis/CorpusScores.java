package de.mirkosertic.textmetrics.analysis;

import java.util.List;

/**
 * Scores of one corpus for one {@link TermWeighting}.
 *
 * @param merged      all documents' scores in one table; for a term found in several documents
 *                    the score of the last of those documents wins
 * @param byDocument  one table per input document, in input order
 * @param diagnostics tokenizer fallbacks that happened while scoring
 */
public record CorpusScores(ScoreTable merged, List<ScoreTable> byDocument, List<Diagnostic> diagnostics) {

    public CorpusScores {
        byDocument = List.copyOf(byDocument);
        diagnostics = List.copyOf(diagnostics);
    }

    public static CorpusScores empty() {
        return new CorpusScores(ScoreTable.empty(), List.of(), List.of());
    }
}

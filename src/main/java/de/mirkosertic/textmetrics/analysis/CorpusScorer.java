package de.mirkosertic.textmetrics.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes TF-IDF and WDF-IDF over a corpus of documents.
 *
 * <p>For each distinct term of each document:</p>
 * <pre>
 *   idf    = ln(N / (df + 1))
 *   TF-IDF = count / length * idf
 *   WDF-IDF = ln(1 + count) * idf
 * </pre>
 * <p>where {@code N} is the number of documents and {@code df} the number of documents containing
 * the term. A term contained in every document gets a negative idf ({@code ln(N / (N + 1))}).</p>
 *
 * <p>The merged table keeps one score per term; when a term occurs in several documents the score
 * of the last of those documents overwrites the earlier ones. Per-document tables are available
 * through {@link #tfIdfByDocument(List, String)} and {@link #wdfIdfByDocument(List, String)}.</p>
 */
public class CorpusScorer {

    private static final Logger logger = LoggerFactory.getLogger(CorpusScorer.class);

    private final TextTokenizer tokenizer;

    public CorpusScorer(final TextTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    public ScoreTable tfIdf(final List<String> documents, final String language) {
        return score(documents, language, TermWeighting.TF_IDF, new Diagnostics()).merged();
    }

    public ScoreTable wdfIdf(final List<String> documents, final String language) {
        return score(documents, language, TermWeighting.WDF_IDF, new Diagnostics()).merged();
    }

    public List<ScoreTable> tfIdfByDocument(final List<String> documents, final String language) {
        return score(documents, language, TermWeighting.TF_IDF, new Diagnostics()).byDocument();
    }

    public List<ScoreTable> wdfIdfByDocument(final List<String> documents, final String language) {
        return score(documents, language, TermWeighting.WDF_IDF, new Diagnostics()).byDocument();
    }

    /**
     * Scores a corpus.
     *
     * @param documents   document texts, must not be null or contain null
     * @param language    language used for tokenization
     * @param weighting   within-document weighting
     * @param diagnostics receives tokenizer fallbacks
     * @return merged and per-document scores
     */
    public CorpusScores score(final List<String> documents,
                              final String language,
                              final TermWeighting weighting,
                              final Diagnostics diagnostics) {
        Objects.requireNonNull(documents, "documents");
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(weighting, "weighting");

        if (documents.isEmpty()) {
            return CorpusScores.empty();
        }

        final Diagnostics scoringDiagnostics = new Diagnostics();
        final List<Map<String, Integer>> termCounts = new ArrayList<>(documents.size());
        final List<Integer> lengths = new ArrayList<>(documents.size());
        for (final String document : documents) {
            final Tokenization tokenization = tokenizer.tokenize(Objects.requireNonNull(document, "document"), language);
            scoringDiagnostics.addAll(tokenization.diagnostics());
            termCounts.add(FrequencyTable.countInOrder(tokenization.tokens()));
            lengths.add(tokenization.size());
        }

        final Map<String, Integer> documentFrequencies = new HashMap<>();
        for (final Map<String, Integer> counts : termCounts) {
            for (final String term : counts.keySet()) {
                documentFrequencies.merge(term, 1, Integer::sum);
            }
        }

        final int documentCount = documents.size();
        final Map<String, Double> merged = new LinkedHashMap<>();
        final List<ScoreTable> byDocument = new ArrayList<>(documentCount);
        for (int i = 0; i < documentCount; i++) {
            final int length = lengths.get(i);
            final Map<String, Double> documentScores = new LinkedHashMap<>();
            for (final Map.Entry<String, Integer> entry : termCounts.get(i).entrySet()) {
                final double idf = TermWeighting.inverseDocumentFrequency(
                        documentCount, documentFrequencies.get(entry.getKey()));
                final double score = weighting.weight(entry.getValue(), length) * idf;
                documentScores.put(entry.getKey(), score);
                merged.put(entry.getKey(), score);
            }
            byDocument.add(ScoreTable.of(documentScores));
        }

        logger.debug("Scored {} documents with {}: {} distinct terms", documentCount, weighting, merged.size());
        diagnostics.addAll(scoringDiagnostics.toList());
        return new CorpusScores(ScoreTable.of(merged), byDocument, scoringDiagnostics.toList());
    }
}

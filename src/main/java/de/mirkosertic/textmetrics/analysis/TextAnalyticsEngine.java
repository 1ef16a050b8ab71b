package de.mirkosertic.textmetrics.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Entry point of the text metrics.
 *
 * <p>Word statistics are always computed. Keyword density, readability, salience and the corpus
 * scores are computed best-effort: an unexpected failure of one of them is logged, reported as a
 * {@link Diagnostic} and replaced by that scorer's empty result, the other metrics are unaffected.</p>
 *
 * <p>The engine holds no per-call state and can be shared between threads.</p>
 */
public class TextAnalyticsEngine {

    private static final Logger logger = LoggerFactory.getLogger(TextAnalyticsEngine.class);

    static final String COMPONENT = "engine";

    private final String defaultLanguage;
    private final FrequencyCounter frequencyCounter;
    private final CorpusScorer corpusScorer;
    private final KeywordDensityScorer keywordDensityScorer;
    private final ReadabilityScorer readabilityScorer;
    private final TextTokenizer tokenizer;
    private final StopwordProvider stopwordProvider;

    public TextAnalyticsEngine(final LanguageResourceLoader resourceLoader) {
        this(resourceLoader, AnalysisOptions.DEFAULT_LANGUAGE);
    }

    public TextAnalyticsEngine(final LanguageResourceLoader resourceLoader, final String defaultLanguage) {
        this(TextTokenizer.full(resourceLoader), new DefaultStopwordProvider(resourceLoader), defaultLanguage);
    }

    /**
     * @param tokenizer        the tokenizer used for corpus scoring and salience
     * @param stopwordProvider stopwords for salience
     * @param defaultLanguage  language of the single-argument operations
     */
    public TextAnalyticsEngine(final TextTokenizer tokenizer,
                               final StopwordProvider stopwordProvider,
                               final String defaultLanguage) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        this.stopwordProvider = Objects.requireNonNull(stopwordProvider, "stopwordProvider");
        this.defaultLanguage = Objects.requireNonNull(defaultLanguage, "defaultLanguage");
        this.frequencyCounter = new FrequencyCounter();
        this.corpusScorer = new CorpusScorer(tokenizer);
        this.keywordDensityScorer = new KeywordDensityScorer();
        this.readabilityScorer = new ReadabilityScorer();
    }

    public String getDefaultLanguage() {
        return defaultLanguage;
    }

    public WordStats wordStats(final String text) {
        return frequencyCounter.wordStats(text);
    }

    public ScoreTable tfIdf(final List<String> documents) {
        return tfIdf(documents, defaultLanguage);
    }

    public ScoreTable tfIdf(final List<String> documents, final String language) {
        return corpusScorer.tfIdf(documents, language);
    }

    public ScoreTable wdfIdf(final List<String> documents) {
        return wdfIdf(documents, defaultLanguage);
    }

    public ScoreTable wdfIdf(final List<String> documents, final String language) {
        return corpusScorer.wdfIdf(documents, language);
    }

    public List<ScoreTable> tfIdfByDocument(final List<String> documents, final String language) {
        return corpusScorer.tfIdfByDocument(documents, language);
    }

    public List<ScoreTable> wdfIdfByDocument(final List<String> documents, final String language) {
        return corpusScorer.wdfIdfByDocument(documents, language);
    }

    public KeywordDensity keywordDensity(final String text, final List<String> keywords) {
        return keywordDensityScorer.keywordDensity(text, keywords);
    }

    public ReadabilityResult readability(final String text) {
        return readabilityScorer.readability(text);
    }

    public SalienceResult semanticSalience(final String text, final String language) {
        return new SemanticSalienceAnalyzer(tokenizer, stopwordProvider).semanticSalience(text, language);
    }

    /**
     * Computes every per-document metric of one document.
     */
    public DocumentAnalysis analyzeDocument(final AnalysisDocument document, final AnalysisOptions options) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(options, "options");

        final String text = document.text();
        final Diagnostics diagnostics = new Diagnostics();

        final WordStats wordStats = frequencyCounter.wordStats(text, options.topN(), diagnostics);

        final KeywordDensity density = options.keywords().isEmpty()
                ? KeywordDensity.empty()
                : isolated("keyword density", document.label(), diagnostics, KeywordDensity::empty,
                        () -> keywordDensityScorer.keywordDensity(text, options.keywords(), diagnostics));

        final ReadabilityResult readability = isolated("readability", document.label(), diagnostics,
                ReadabilityResult::unknown,
                () -> readabilityScorer.readability(text, diagnostics));

        // salience keeps its own top 10, independent of the requested report size
        final SemanticSalienceAnalyzer salienceAnalyzer = new SemanticSalienceAnalyzer(tokenizer, stopwordProvider);
        final SalienceResult salience = isolated("salience", document.label(), diagnostics, SalienceResult::empty,
                () -> salienceAnalyzer.semanticSalience(text, options.language(), diagnostics));

        return new DocumentAnalysis(document.label(), wordStats, density, readability, salience, diagnostics.toList());
    }

    /**
     * Analyzes a batch: every document separately, then TF-IDF and WDF-IDF over all of them.
     */
    public CorpusAnalysis analyze(final List<AnalysisDocument> documents, final AnalysisOptions options) {
        Objects.requireNonNull(documents, "documents");
        Objects.requireNonNull(options, "options");

        final List<DocumentAnalysis> results = new ArrayList<>(documents.size());
        for (final AnalysisDocument document : documents) {
            results.add(analyzeDocument(document, options));
        }
        final List<String> texts = documents.stream().map(AnalysisDocument::text).toList();
        return scoreCorpus(results, texts, options);
    }

    /**
     * Runs the corpus scorers over documents whose per-document metrics were computed elsewhere.
     *
     * @param analyses per-document results, in the same order as {@code texts}
     * @param texts    document texts
     */
    public CorpusAnalysis scoreCorpus(final List<DocumentAnalysis> analyses,
                                      final List<String> texts,
                                      final AnalysisOptions options) {
        Objects.requireNonNull(analyses, "analyses");
        Objects.requireNonNull(texts, "texts");
        Objects.requireNonNull(options, "options");

        final Diagnostics diagnostics = new Diagnostics();
        final CorpusScores tfIdf = isolated("tf-idf", "corpus", diagnostics, CorpusScores::empty,
                () -> corpusScorer.score(texts, options.language(), TermWeighting.TF_IDF, diagnostics));
        // both passes tokenize the same texts, their tokenizer diagnostics are identical
        final CorpusScores wdfIdf = isolated("wdf-idf", "corpus", diagnostics, CorpusScores::empty,
                () -> corpusScorer.score(texts, options.language(), TermWeighting.WDF_IDF, new Diagnostics()));

        return new CorpusAnalysis(analyses,
                tfIdf.merged(),
                wdfIdf.merged(),
                options.perDocumentScores() ? tfIdf.byDocument() : List.of(),
                options.perDocumentScores() ? wdfIdf.byDocument() : List.of(),
                diagnostics.toList());
    }

    private static <T> T isolated(final String metric,
                                  final String label,
                                  final Diagnostics diagnostics,
                                  final Supplier<T> fallback,
                                  final Supplier<T> computation) {
        try {
            return computation.get();
        } catch (final RuntimeException e) {
            logger.warn("Computing {} failed for '{}', continuing without it", metric, label, e);
            diagnostics.add(COMPONENT, "Computing " + metric + " failed: " + e.getMessage());
            return fallback.get();
        }
    }
}

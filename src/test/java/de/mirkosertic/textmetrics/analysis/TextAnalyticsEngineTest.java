package de.mirkosertic.textmetrics.analysis;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNullPointerException;
import static org.assertj.core.api.Assertions.offset;

@DisplayName("TextAnalyticsEngine Tests")
class TextAnalyticsEngineTest {

    static TextAnalyticsEngine engine;

    @BeforeAll
    static void setUp() {
        engine = new TextAnalyticsEngine(new LanguageResourceLoader(), "english");
    }

    @Test
    @DisplayName("Should expose the single document operations")
    void shouldExposeOperations() {
        assertThat(engine.wordStats("seo seo content").totalWords()).isEqualTo(3);
        assertThat(engine.keywordDensity("seo seo content", List.of("seo")).density("seo"))
                .isCloseTo(200.0 / 3.0, offset(1e-9));
        assertThat(engine.readability("The cat sat on the mat.").level()).isEqualTo(ComplexityLevel.EASY);
        assertThat(engine.semanticSalience("the cat and the dog", "en").topMeaningful().asMap())
                .containsOnlyKeys("cat", "dog");
    }

    @Test
    @DisplayName("Should score corpora in the default language")
    void shouldScoreCorpusWithDefaultLanguage() {
        final List<String> documents = List.of("Search engines rank pages.", "Pages need content.");

        assertThat(engine.getDefaultLanguage()).isEqualTo("english");
        assertThat(engine.tfIdf(documents)).isEqualTo(engine.tfIdf(documents, "en"));
        assertThat(engine.wdfIdf(documents).score("search")).isPresent();
        assertThat(engine.tfIdfByDocument(documents, "en")).hasSize(2);
        assertThat(engine.wdfIdfByDocument(documents, "en")).hasSize(2);
    }

    @Test
    @DisplayName("Should analyze a batch with per-document metrics and corpus scores")
    void shouldAnalyzeBatch() {
        final List<AnalysisDocument> documents = List.of(
                new AnalysisDocument("first", "The quick brown fox jumps over the lazy dog. The fox is quick."),
                new AnalysisDocument("second", "A lazy afternoon. The dog sleeps."));
        final AnalysisOptions options = AnalysisOptions.defaults()
                .withLanguage("en")
                .withKeywords(List.of("fox"))
                .withTopN(3)
                .withPerDocumentScores(true);

        final CorpusAnalysis result = engine.analyze(documents, options);

        assertThat(result.documents()).extracting(DocumentAnalysis::label).containsExactly("first", "second");
        final DocumentAnalysis first = result.documents().get(0);
        assertThat(first.wordStats().topFrequency().size()).isEqualTo(3);
        assertThat(first.keywordDensity().density("fox")).isPositive();
        assertThat(first.readability().isKnown()).isTrue();
        assertThat(first.salience().topMeaningful().entries().get(0).term()).isIn("quick", "fox");
        assertThat(result.tfIdf().score("fox")).isPresent();
        assertThat(result.tfIdfByDocument()).hasSize(2);
        assertThat(result.wdfIdfByDocument()).hasSize(2);
        assertThat(result.allDiagnostics()).isEmpty();
    }

    @Test
    @DisplayName("Should keep the salience top ten when a smaller top N is requested")
    void shouldKeepSalienceTopTenIndependentOfTopN() {
        final DocumentAnalysis result = engine.analyzeDocument(
                new AnalysisDocument("doc", "The quick brown fox jumps over the lazy dog. The fox is quick."),
                AnalysisOptions.defaults().withLanguage("en").withTopN(1));

        assertThat(result.wordStats().topFrequency().size()).isEqualTo(1);
        assertThat(result.salience().topMeaningful().size()).isGreaterThan(1).isLessThanOrEqualTo(10);
        assertThat(result.salience().uniqueMeaningfulCount())
                .isEqualTo(result.salience().topMeaningful().size());
    }

    @Test
    @DisplayName("Should skip keyword density and per-document scores unless requested")
    void shouldSkipOptionalMetrics() {
        final CorpusAnalysis result = engine.analyze(
                List.of(new AnalysisDocument("doc", "Some words here.")), AnalysisOptions.defaults().withLanguage("en"));

        assertThat(result.documents().get(0).keywordDensity()).isEqualTo(KeywordDensity.empty());
        assertThat(result.tfIdfByDocument()).isEmpty();
        assertThat(result.wdfIdfByDocument()).isEmpty();
    }

    @Test
    @DisplayName("Should keep word statistics when another scorer fails")
    void shouldIsolateScorerFailures() {
        final StopwordProvider failing = language -> {
            throw new IllegalStateException("stopwords exploded");
        };
        final TextAnalyticsEngine fragile = new TextAnalyticsEngine(TextTokenizer.basic(), failing, "en");

        final DocumentAnalysis result = fragile.analyzeDocument(
                new AnalysisDocument("doc", "Words and more words."), AnalysisOptions.defaults());

        assertThat(result.wordStats().totalWords()).isEqualTo(4);
        assertThat(result.readability().isKnown()).isTrue();
        assertThat(result.salience()).isEqualTo(SalienceResult.empty());
        assertThat(result.diagnostics()).anySatisfy(diagnostic ->
                assertThat(diagnostic.message()).contains("stopwords exploded"));
    }

    @Test
    @DisplayName("Should carry tokenizer diagnostics of unsupported languages")
    void shouldReportFallbacks() {
        final CorpusAnalysis result = engine.analyze(
                List.of(new AnalysisDocument("doc", "qapla batlh")),
                AnalysisOptions.defaults().withLanguage("klingon"));

        assertThat(result.diagnostics()).isNotEmpty();
        assertThat(result.documents().get(0).diagnostics())
                .extracting(Diagnostic::component)
                .contains("tokenizer", "salience");
        assertThat(result.allDiagnostics()).hasSizeGreaterThan(result.diagnostics().size());
    }

    @Test
    @DisplayName("Should return empty results for an empty batch")
    void shouldHandleEmptyBatch() {
        final CorpusAnalysis result = engine.analyze(List.of(), AnalysisOptions.defaults());

        assertThat(result.documents()).isEmpty();
        assertThat(result.tfIdf().isEmpty()).isTrue();
        assertThat(result.wdfIdf().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should reject null arguments")
    void shouldRejectNull() {
        assertThatNullPointerException().isThrownBy(() -> engine.analyze(null, AnalysisOptions.defaults()));
        assertThatNullPointerException().isThrownBy(() -> engine.analyze(List.of(), null));
        assertThatNullPointerException().isThrownBy(() -> engine.readability(null));
        assertThatNullPointerException().isThrownBy(() -> new AnalysisDocument("label", null));
    }

    @Test
    @DisplayName("Should be deterministic")
    void shouldBeDeterministic() {
        final List<AnalysisDocument> documents = List.of(new AnalysisDocument("a", "one two two three three three"));
        final AnalysisOptions options = AnalysisOptions.defaults().withLanguage("en").withKeywords(List.of("two"));

        assertThat(engine.analyze(documents, options)).isEqualTo(engine.analyze(documents, options));
    }

    @Test
    @DisplayName("Should use stopwords of the requested language")
    void shouldUseRequestedLanguageStopwords() {
        final StopwordProvider provider = language -> new StopwordSet(language, Set.of("one"), false);
        final TextAnalyticsEngine custom = new TextAnalyticsEngine(TextTokenizer.basic(), provider, "en");

        final SalienceResult result = custom.semanticSalience("one two", "en");

        assertThat(result.topMeaningful().asMap()).containsOnlyKeys("two");
    }
}

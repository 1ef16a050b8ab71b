package de.mirkosertic.textmetrics.analysis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

@DisplayName("CorpusScorer Tests")
class CorpusScorerTest {

    private static final double EPSILON = 1e-9;

    private final CorpusScorer scorer = new CorpusScorer(TextTokenizer.basic());

    @Test
    @DisplayName("Should score a term present in every document with ln(N/(N+1))")
    void shouldScoreUbiquitousTerm() {
        final List<String> documents = List.of("seo content", "seo ranking tips", "seo");

        final ScoreTable tfIdf = scorer.tfIdf(documents, "en");

        // last document wins: tf = 1/1
        assertThat(tfIdf.score("seo").orElseThrow()).isCloseTo(Math.log(3.0 / 4.0), offset(EPSILON));
        assertThat(tfIdf.score("seo").orElseThrow()).isNegative();
    }

    @Test
    @DisplayName("Should compute TF-IDF and WDF-IDF of a rare term")
    void shouldScoreRareTerm() {
        final List<String> documents = List.of("apple apple pear", "kiwi", "kiwi", "kiwi");

        final ScoreTable tfIdf = scorer.tfIdf(documents, "en");
        final ScoreTable wdfIdf = scorer.wdfIdf(documents, "en");

        final double idf = Math.log(4.0 / 2.0);
        assertThat(tfIdf.score("apple").orElseThrow()).isCloseTo(2.0 / 3.0 * idf, offset(EPSILON));
        assertThat(wdfIdf.score("apple").orElseThrow()).isCloseTo(Math.log(3.0) * idf, offset(EPSILON));
        assertThat(tfIdf.entries().get(0).term()).isEqualTo("apple");
    }

    @Test
    @DisplayName("Should let a later document overwrite a shared term in the merged table")
    void shouldOverwriteSharedTerms() {
        final List<String> documents = List.of("seo seo seo filler", "seo other", "unrelated", "more unrelated");

        final ScoreTable merged = scorer.tfIdf(documents, "en");
        final List<ScoreTable> byDocument = scorer.tfIdfByDocument(documents, "en");

        final double idf = Math.log(4.0 / 3.0);
        assertThat(merged.score("seo").orElseThrow()).isCloseTo(0.5 * idf, offset(EPSILON));
        assertThat(byDocument).hasSize(4);
        assertThat(byDocument.get(0).score("seo").orElseThrow()).isCloseTo(0.75 * idf, offset(EPSILON));
        assertThat(byDocument.get(2).score("seo")).isEmpty();
    }

    @Test
    @DisplayName("Should return per-document WDF-IDF tables in input order")
    void shouldScoreWdfIdfByDocument() {
        final List<ScoreTable> tables = scorer.wdfIdfByDocument(List.of("a b", "c"), "en");

        assertThat(tables).hasSize(2);
        assertThat(tables.get(0).asMap()).containsOnlyKeys("a", "b");
        assertThat(tables.get(1).asMap()).containsOnlyKeys("c");
    }

    @Test
    @DisplayName("Should return an empty table for an empty corpus and skip empty documents")
    void shouldHandleDegenerateCorpus() {
        assertThat(scorer.tfIdf(List.of(), "en").isEmpty()).isTrue();
        assertThat(scorer.wdfIdf(List.of(), "en").isEmpty()).isTrue();

        final ScoreTable scores = scorer.tfIdf(List.of("", "  ", "word"), "en");
        assertThat(scores.asMap()).containsOnlyKeys("word");
        assertThat(scores.entries()).allMatch(entry -> Double.isFinite(entry.score()));
    }

    @Test
    @DisplayName("Should order scores non-increasingly and be deterministic")
    void shouldOrderScores() {
        final List<String> documents = List.of(
                "search engine optimization improves search ranking",
                "content marketing and search",
                "ranking factors for content");

        final ScoreTable first = scorer.wdfIdf(documents, "en");
        final ScoreTable second = scorer.wdfIdf(documents, "en");

        assertThat(first).isEqualTo(second);
        assertThat(first.entries().stream().map(TermScore::score).toList())
                .isSortedAccordingTo((a, b) -> Double.compare(b, a));
    }

    @Test
    @DisplayName("Should pass tokenizer diagnostics to the caller")
    void shouldCollectDiagnostics() {
        final CorpusScorer fullScorer = new CorpusScorer(TextTokenizer.full(new LanguageResourceLoader()));
        final Diagnostics diagnostics = new Diagnostics();

        final CorpusScores scores = fullScorer.score(List.of("one two", "three"), "klingon",
                TermWeighting.TF_IDF, diagnostics);

        assertThat(scores.merged().size()).isEqualTo(3);
        assertThat(diagnostics.toList()).hasSize(2);
        assertThat(scores.diagnostics()).hasSize(2);
    }
}

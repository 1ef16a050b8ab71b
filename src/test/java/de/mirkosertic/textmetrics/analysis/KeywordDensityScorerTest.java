package de.mirkosertic.textmetrics.analysis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNullPointerException;
import static org.assertj.core.api.Assertions.offset;

@DisplayName("KeywordDensityScorer Tests")
class KeywordDensityScorerTest {

    private final KeywordDensityScorer scorer = new KeywordDensityScorer();

    @Test
    @DisplayName("Should compute density in percent of the token count")
    void shouldComputeDensity() {
        final KeywordDensity density = scorer.keywordDensity("seo seo content", List.of("seo"));

        assertThat(density.tokenCount()).isEqualTo(3);
        assertThat(density.density("seo")).isCloseTo(200.0 / 3.0, offset(1e-9));
    }

    @Test
    @DisplayName("Should return zero for every keyword of an empty text")
    void shouldHandleEmptyText() {
        final KeywordDensity density = scorer.keywordDensity("", List.of("x", "y"));

        assertThat(density.densities()).containsExactly(
                Map.entry("x", 0.0), Map.entry("y", 0.0));
    }

    @Test
    @DisplayName("Should match case-insensitive substrings and keep keywords as given")
    void shouldMatchSubstrings() {
        final KeywordDensity density = scorer.keywordDensity("SEO tools for seos", List.of("Seo", "tool", "missing"));

        assertThat(density.densities()).containsOnlyKeys("Seo", "tool", "missing");
        assertThat(density.densities().keySet()).containsExactly("Seo", "tool", "missing");
        assertThat(density.density("Seo")).isCloseTo(50.0, offset(1e-9));
        assertThat(density.density("tool")).isCloseTo(25.0, offset(1e-9));
        assertThat(density.density("missing")).isZero();
    }

    @Test
    @DisplayName("Should count non-overlapping occurrences without capping at 100")
    void shouldCountNonOverlapping() {
        final KeywordDensity density = scorer.keywordDensity("aaaa", List.of("aa", "a"));

        assertThat(density.density("aa")).isCloseTo(200.0, offset(1e-9));
        assertThat(density.density("a")).isCloseTo(400.0, offset(1e-9));
    }

    @Test
    @DisplayName("Should return zero for blank keywords and collapse duplicates")
    void shouldHandleBlankAndDuplicateKeywords() {
        final KeywordDensity density = scorer.keywordDensity("word word", List.of("", " ", "word", "word"));

        assertThat(density.densities()).hasSize(3);
        assertThat(density.density("")).isZero();
        assertThat(density.density(" ")).isZero();
        assertThat(density.density("word")).isCloseTo(100.0, offset(1e-9));
    }

    @Test
    @DisplayName("Should reject null arguments")
    void shouldRejectNull() {
        assertThatNullPointerException().isThrownBy(() -> scorer.keywordDensity(null, List.of("x")));
        assertThatNullPointerException().isThrownBy(() -> scorer.keywordDensity("text", null));
    }
}

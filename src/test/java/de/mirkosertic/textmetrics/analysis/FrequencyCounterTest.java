package de.mirkosertic.textmetrics.analysis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("FrequencyCounter Tests")
class FrequencyCounterTest {

    private final FrequencyCounter counter = new FrequencyCounter();

    @Test
    @DisplayName("Should return zero statistics for empty text")
    void shouldHandleEmptyText() {
        final WordStats stats = counter.wordStats("");

        assertThat(stats.totalWords()).isZero();
        assertThat(stats.uniqueWords()).isZero();
        assertThat(stats.topFrequency().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should count total and unique words case-insensitively")
    void shouldCountWords() {
        final WordStats stats = counter.wordStats("SEO is fun. seo is work, SEO!");

        assertThat(stats.totalWords()).isEqualTo(7);
        assertThat(stats.uniqueWords()).isEqualTo(4);
        assertThat(stats.topFrequency().entries())
                .extracting(TermCount::term, TermCount::count)
                .containsExactly(tuple("seo", 3), tuple("is", 2), tuple("fun", 1), tuple("work", 1));
    }

    @Test
    @DisplayName("Should break ties by first appearance and truncate to top N")
    void shouldTruncateWithStableTies() {
        final WordStats stats = counter.wordStats("d c b a a b c d e", 3);

        assertThat(stats.uniqueWords()).isEqualTo(5);
        assertThat(stats.topFrequency().entries())
                .extracting(TermCount::term)
                .containsExactly("d", "c", "b");
    }

    @Test
    @DisplayName("Should order counts non-increasingly")
    void shouldOrderDescending() {
        final WordStats stats = counter.wordStats("x y y z z z w w w w v");

        final List<Integer> counts = stats.topFrequency().entries().stream().map(TermCount::count).toList();
        assertThat(counts).isSortedAccordingTo((a, b) -> Integer.compare(b, a));
        assertThat(stats.totalWords()).isGreaterThanOrEqualTo(stats.uniqueWords());
    }

    @Test
    @DisplayName("Should be deterministic")
    void shouldBeDeterministic() {
        final String text = "alpha beta gamma beta alpha delta epsilon";

        assertThat(counter.wordStats(text)).isEqualTo(counter.wordStats(text));
    }

    @Test
    @DisplayName("Should expose top terms of a token list")
    void shouldExposeTopTerms() {
        final FrequencyTable table = FrequencyCounter.topTerms(List.of("b", "a", "b"), 1);

        assertThat(table.asMap()).containsExactly(Map.entry("b", 2));
        assertThat(table.count("a")).isZero();
    }

    @Test
    @DisplayName("Should reject a non-positive top N")
    void shouldRejectInvalidTopN() {
        assertThatIllegalArgumentException().isThrownBy(() -> counter.wordStats("text", 0));
        assertThatIllegalArgumentException().isThrownBy(() -> new FrequencyCounter(TextTokenizer.basic(), -1));
    }
}

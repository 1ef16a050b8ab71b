package de.mirkosertic.textmetrics.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextCleanerTest {

    @Test
    void shouldRemoveReplacementCharacters() {
        assertThat(TextCleaner.paragraphs("Text with \uFFFD\uFFFD broken chars")).containsExactly("Text with broken chars");
    }

    @Test
    void shouldRemoveControlCharacters() {
        assertThat(TextCleaner.normalize("Text\u0000\u0001with\u001Fcontrol")).isEqualTo("Textwithcontrol");
    }

    @Test
    void shouldKeepTabsAndLineBreaksWhenNormalizing() {
        assertThat(TextCleaner.normalize("a\tb\nc\r\nd")).isEqualTo("a\tb\nc\r\nd");
    }

    @Test
    void shouldRemoveZeroWidthCharactersAndBom() {
        assertThat(TextCleaner.normalize("\uFEFFText\u200Bwith\u200Czero\u200Dwidth")).isEqualTo("Textwithzerowidth");
    }

    @Test
    void shouldReplaceUnicodeSpaces() {
        assertThat(TextCleaner.normalize("non\u00A0breaking\u2003em\u3000ideographic"))
                .isEqualTo("non breaking em ideographic");
    }

    @Test
    void shouldApplyCompatibilityNormalization() {
        assertThat(TextCleaner.normalize("\uFB01nd \uFF21\uFF22\uFF23")).isEqualTo("find ABC");
    }

    @Test
    void shouldHandleNullAndEmptyInput() {
        assertThat(TextCleaner.paragraphs(null)).isEmpty();
        assertThat(TextCleaner.paragraphs("")).isEmpty();
    }

    @Test
    void shouldPreserveUnicodeText() {
        final String input = "Caf\u00E9 M\u00FCnchen Z\u00FCrich 123!";
        assertThat(TextCleaner.paragraphs(input)).containsExactly(input);
    }

    @Test
    void paragraphs_shouldSplitOnLineBreaksAndSkipBlankLines() {
        assertThat(TextCleaner.paragraphs("First  paragraph\r\n\r\n \t \nSecond\tone\rThird\n"))
                .containsExactly("First paragraph", "Second one", "Third");
    }

    @Test
    void paragraphs_shouldCollapseUnicodeSpacesInsideParagraphs() {
        assertThat(TextCleaner.paragraphs("  wide\u3000\u00A0gap  \nnext\u2003line"))
                .containsExactly("wide gap", "next line");
    }

    @Test
    void paragraphs_shouldDropLinesWithOnlyInvalidCharacters() {
        assertThat(TextCleaner.paragraphs("Intro\n\u200B\uFEFF\nOutro")).containsExactly("Intro", "Outro");
    }
}

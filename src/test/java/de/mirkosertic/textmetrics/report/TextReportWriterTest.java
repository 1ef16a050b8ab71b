package de.mirkosertic.textmetrics.report;

import de.mirkosertic.textmetrics.ingest.FailedFile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TextReportWriter Tests")
class TextReportWriterTest {

    @Test
    @DisplayName("Should render one section per file and the corpus scores")
    void shouldRenderSections() {
        final String report = TextReportWriter.render(ReportFixtures.batch());

        assertThat(report).startsWith("Text Metrics Report\n===================\n");
        assertThat(report).contains("Language: en\n", "Documents: 2\n");
        assertThat(report).contains("File: " + Path.of("docs", "first.txt"), "Total words: 13\n", "Detected language: en\n");
        assertThat(report).contains("Top 3 words:\n  the: 3\n");
        assertThat(report).containsPattern("Keyword density:\n  fox: \\d+\\.\\d{2}%\n");
        assertThat(report).containsPattern("Readability: [A-Za-z ]+ \\(reading ease -?\\d+\\.\\d, grade level -?\\d+\\.\\d\\)");
        assertThat(report).contains("Meaningful words: ");
        assertThat(report).contains("TF-IDF (top 3):\n", "WDF-IDF (top 3):\n");
        assertThat(report).doesNotContain("Notes:");
    }

    @Test
    @DisplayName("Should list failed files with their error")
    void shouldRenderFailures() {
        final String report = TextReportWriter.render(ReportFixtures.batch(ReportFixtures.options(),
                List.of(new FailedFile(Path.of("broken.pdf"), "Failed to parse document"))));

        assertThat(report).contains("Documents: 2 (1 failed)\n");
        assertThat(report).contains("File: broken.pdf\nError: Failed to parse document\n");
    }

    @Test
    @DisplayName("Should format numbers independent of the default locale")
    void shouldFormatWithRootLocale() {
        assertThat(TextReportWriter.format("%.2f%%", 12.3456)).isEqualTo("12.35%");
    }

    @Test
    @DisplayName("Should write the report as UTF-8 text")
    void shouldWriteFile(@TempDir final Path tempDir) throws Exception {
        final Path file = tempDir.resolve("report.txt");

        TextReportWriter.write(ReportFixtures.batch(), file);

        assertThat(Files.readString(file)).isEqualTo(TextReportWriter.render(ReportFixtures.batch()));
    }
}

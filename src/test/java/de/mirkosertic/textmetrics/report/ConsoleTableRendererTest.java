package de.mirkosertic.textmetrics.report;

import de.mirkosertic.textmetrics.ingest.FailedFile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ConsoleTableRenderer Tests")
class ConsoleTableRendererTest {

    @Test
    @DisplayName("Should render aligned rows for every file")
    void shouldRenderTable() {
        final String table = ConsoleTableRenderer.render(ReportFixtures.batch(ReportFixtures.options(),
                List.of(new FailedFile(Path.of("broken.pdf"), "Failed to parse document"))));

        final List<String> lines = table.lines().toList();
        assertThat(lines.get(0)).startsWith("+-").endsWith("-+");
        assertThat(lines.get(1)).contains("File", "Words", "Unique", "Reading ease", "Level", "Top words");
        assertThat(lines.get(3)).startsWith("| first.txt").contains("| 13 ").contains("the, ");
        assertThat(lines.get(4)).startsWith("| second.docx");
        assertThat(lines.get(5)).startsWith("| broken.pdf").contains("error", "Failed to parse document");
        assertThat(lines.get(6)).isEqualTo(lines.get(0));
        assertThat(lines.get(7)).isEqualTo("2 documents, 19 words");
        assertThat(lines.subList(0, 7)).extracting(String::length).containsOnly(lines.get(0).length());
    }
}

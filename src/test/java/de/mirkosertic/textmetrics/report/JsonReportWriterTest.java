package de.mirkosertic.textmetrics.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.textmetrics.ingest.BatchResult;
import de.mirkosertic.textmetrics.ingest.FailedFile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringWriter;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JsonReportWriter Tests")
class JsonReportWriterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("Should serialize documents and corpus scores")
    void shouldSerializeBatch() throws Exception {
        final JsonNode json = objectMapper.readTree(JsonReportWriter.toJson(ReportFixtures.batch()));

        assertThat(json.get("language").asText()).isEqualTo("en");
        assertThat(json.get("documentCount").asInt()).isEqualTo(2);
        assertThat(json.get("totalWords").asInt()).isEqualTo(19);
        assertThat(json.get("version").asText()).isNotBlank();

        final JsonNode first = json.get("documents").get(0);
        assertThat(first.get("file").asText()).endsWith("first.txt");
        assertThat(first.get("totalWords").asInt()).isEqualTo(13);
        assertThat(first.get("topWords")).hasSize(3);
        assertThat(first.get("topWords").get(0).get("term").asText()).isEqualTo("the");
        assertThat(first.get("keywordDensity").get("fox").asDouble()).isGreaterThan(0.0);
        assertThat(first.get("readability").get("level").asText()).isNotBlank();
        assertThat(first.get("salience").get("uniqueMeaningfulWords").asInt()).isPositive();

        assertThat(json.get("tfIdf")).hasSize(3);
        assertThat(json.get("tfIdf").get(0).has("score")).isTrue();
        assertThat(json.get("wdfIdf")).hasSize(3);
    }

    @Test
    @DisplayName("Should leave out absent values")
    void shouldOmitNullFields() throws Exception {
        final JsonNode json = objectMapper.readTree(JsonReportWriter.toJson(ReportFixtures.batch()));

        final JsonNode second = json.get("documents").get(1);
        assertThat(second.has("detectedLanguage")).isFalse();
        assertThat(second.has("diagnostics")).isFalse();
        assertThat(json.has("tfIdfByDocument")).isFalse();
        assertThat(json.has("diagnostics")).isFalse();
        assertThat(json.get("failures")).isEmpty();
    }

    @Test
    @DisplayName("Should include per-document scores and failures")
    void shouldIncludeOptionalSections() throws Exception {
        final BatchResult result = ReportFixtures.batch(ReportFixtures.options().withPerDocumentScores(true),
                List.of(new FailedFile(Path.of("docs", "broken.pdf"), "Failed to parse document")));

        final JsonNode json = objectMapper.readTree(JsonReportWriter.toJson(result));

        assertThat(json.get("tfIdfByDocument")).hasSize(2);
        assertThat(json.get("wdfIdfByDocument").fieldNames()).toIterable()
                .containsExactly(Path.of("docs", "first.txt").toString(), Path.of("docs", "second.docx").toString());
        assertThat(json.get("failures").get(0).get("error").asText()).isEqualTo("Failed to parse document");
    }

    @Test
    @DisplayName("Should write the report to a writer and a file")
    void shouldWriteReport(@TempDir final Path tempDir) throws Exception {
        final BatchResult result = ReportFixtures.batch();
        final StringWriter writer = new StringWriter();
        JsonReportWriter.write(result, writer);
        final Path file = tempDir.resolve("report.json");
        JsonReportWriter.write(result, file);

        assertThat(writer.toString()).isEqualTo(JsonReportWriter.toJson(result) + System.lineSeparator());
        assertThat(objectMapper.readTree(file.toFile()).get("documentCount").asInt()).isEqualTo(2);
    }
}

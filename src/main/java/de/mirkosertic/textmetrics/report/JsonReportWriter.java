package de.mirkosertic.textmetrics.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.mirkosertic.textmetrics.config.BuildInfo;
import de.mirkosertic.textmetrics.ingest.BatchResult;
import de.mirkosertic.textmetrics.report.dto.BatchReport;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes batch results as JSON.
 */
public final class JsonReportWriter {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private JsonReportWriter() {
    }

    public static BatchReport toReport(final BatchResult result) {
        return BatchReport.from(result, BuildInfo.getVersion());
    }

    public static String toJson(final BatchResult result) {
        try {
            return OBJECT_MAPPER.writeValueAsString(toReport(result));
        } catch (final JsonProcessingException e) {
            throw new UncheckedIOException("JSON serialization failed", e);
        }
    }

    public static void write(final BatchResult result, final Writer writer) throws IOException {
        writer.write(toJson(result));
        writer.write(System.lineSeparator());
    }

    public static void write(final BatchResult result, final Path file) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(result, writer);
        }
    }
}

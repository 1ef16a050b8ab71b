package de.mirkosertic.textmetrics.ingest;

import de.mirkosertic.textmetrics.analysis.DocumentAnalysis;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * A file of a batch together with its metrics.
 */
public record AnalyzedFile(
        Path file,
        String fileType,
        long fileSize,
        int paragraphCount,
        int rawWordCount,
        @Nullable String detectedLanguage,
        DocumentAnalysis analysis
) {

    static AnalyzedFile of(final ExtractedDocument document, final DocumentAnalysis analysis) {
        return new AnalyzedFile(document.file(), document.fileType(), document.fileSize(),
                document.paragraphs().size(), document.rawWordCount(), document.detectedLanguage(), analysis);
    }
}

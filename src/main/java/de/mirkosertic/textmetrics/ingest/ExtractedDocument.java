package de.mirkosertic.textmetrics.ingest;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.List;

/**
 * Text of a stored document.
 *
 * @param file             the source file
 * @param paragraphs       non-blank paragraphs in document order
 * @param text             paragraphs joined by newlines
 * @param rawWordCount     number of whitespace separated chunks of {@code text}
 * @param detectedLanguage ISO 639-1 code, null when detection is disabled or uncertain
 * @param fileType         detected MIME type
 * @param fileSize         size in bytes
 */
public record ExtractedDocument(
        Path file,
        List<String> paragraphs,
        String text,
        int rawWordCount,
        @Nullable String detectedLanguage,
        String fileType,
        long fileSize
) {

    public ExtractedDocument {
        paragraphs = List.copyOf(paragraphs);
    }

    public String fileName() {
        return file.getFileName().toString();
    }
}

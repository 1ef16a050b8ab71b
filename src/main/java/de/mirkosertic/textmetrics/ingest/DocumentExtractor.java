package de.mirkosertic.textmetrics.ingest;

import de.mirkosertic.textmetrics.config.ApplicationConfig;
import de.mirkosertic.textmetrics.util.TextCleaner;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.apache.tika.exception.WriteLimitReachedException;
import org.apache.tika.langdetect.optimaize.OptimaizeLangDetector;
import org.apache.tika.language.detect.LanguageDetector;
import org.apache.tika.language.detect.LanguageResult;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.apache.tika.sax.BodyContentHandler;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Extracts the paragraphs of a stored document using Apache Tika.
 * Supports Word, OpenOffice, PDF, RTF, HTML and plain text.
 */
public class DocumentExtractor {

    private static final Logger logger = LoggerFactory.getLogger(DocumentExtractor.class);

    private final long maxContentLength;
    private final Tika tika;
    private final Parser parser;
    private final @Nullable LanguageDetector languageDetector;

    public DocumentExtractor(final ApplicationConfig config) {
        this(config.getMaxContentLength(), config.isDetectLanguage());
    }

    /**
     * @param maxContentLength characters to extract per document, -1 for unlimited
     * @param detectLanguage   whether the language of the text is detected
     */
    public DocumentExtractor(final long maxContentLength, final boolean detectLanguage) {
        this.maxContentLength = maxContentLength;
        this.tika = new Tika();
        this.parser = new AutoDetectParser();
        this.languageDetector = detectLanguage ? new OptimaizeLangDetector().loadModels() : null;
    }

    /**
     * Extracts a document.
     *
     * @param file the file to read
     * @return paragraphs, flat text and file metadata
     * @throws IOException if the file cannot be read or parsed
     */
    public ExtractedDocument extract(final Path file) throws IOException {
        final long fileSize = Files.size(file);
        // Tika rejects empty streams, an empty file is an empty document
        final String content = fileSize == 0 ? "" : parse(file);

        final List<String> paragraphs = TextCleaner.paragraphs(content);
        final String text = String.join("\n", paragraphs);
        logger.debug("Extracted {} paragraphs ({} characters) from {}", paragraphs.size(), text.length(), file);

        return new ExtractedDocument(
                file,
                paragraphs,
                text,
                countRawWords(text),
                detectLanguage(file, text),
                tika.detect(file),
                fileSize
        );
    }

    private String parse(final Path file) throws IOException {
        final Metadata metadata = new Metadata();
        metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, file.getFileName().toString());

        // -1 means unlimited
        final int writeLimit = maxContentLength <= 0 ? -1 : (int) Math.min(Integer.MAX_VALUE, maxContentLength);
        final BodyContentHandler handler = new BodyContentHandler(writeLimit);

        final ParseContext context = new ParseContext();
        context.set(Parser.class, parser);

        try (final InputStream stream = Files.newInputStream(file)) {
            parser.parse(stream, handler, metadata, context);
        } catch (final SAXException e) {
            if (!WriteLimitReachedException.isWriteLimitReached(e)) {
                throw new IOException("Failed to parse document " + file, e);
            }
            logger.info("Content of {} truncated at {} characters", file, writeLimit);
        } catch (final TikaException e) {
            throw new IOException("Failed to parse document " + file, e);
        }
        return handler.toString();
    }

    private @Nullable String detectLanguage(final Path file, final String text) {
        if (languageDetector == null || text.isEmpty()) {
            return null;
        }
        try {
            final LanguageResult result = languageDetector.detect(text);
            return result.isReasonablyCertain() ? result.getLanguage() : null;
        } catch (final RuntimeException e) {
            logger.warn("Language detection failed for file: {}", file, e);
            return null;
        }
    }

    static int countRawWords(final String text) {
        final String trimmed = text.strip();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}

package de.mirkosertic.textmetrics.ingest;

import de.mirkosertic.textmetrics.analysis.AnalysisDocument;
import de.mirkosertic.textmetrics.analysis.AnalysisOptions;
import de.mirkosertic.textmetrics.analysis.CorpusAnalysis;
import de.mirkosertic.textmetrics.analysis.DocumentAnalysis;
import de.mirkosertic.textmetrics.analysis.TextAnalyticsEngine;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.stream.Stream;

/**
 * Analyzes a batch of stored documents.
 *
 * <p>Each file is extracted and analyzed on the worker pool. A file that cannot be read or
 * analyzed is logged and recorded as a {@link FailedFile}; the batch continues. Once every file is
 * done, TF-IDF and WDF-IDF are computed over all successfully extracted texts.</p>
 */
public class BatchAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(BatchAnalysisService.class);

    private final DocumentExtractor extractor;
    private final TextAnalyticsEngine engine;
    private final FilePatternMatcher patternMatcher;
    private final int threadPoolSize;

    public BatchAnalysisService(final DocumentExtractor extractor,
                                final TextAnalyticsEngine engine,
                                final FilePatternMatcher patternMatcher,
                                final int threadPoolSize) {
        this.extractor = extractor;
        this.engine = engine;
        this.patternMatcher = patternMatcher;
        this.threadPoolSize = threadPoolSize;
    }

    /**
     * Resolves the given paths to the files to analyze. Files given directly are always taken,
     * directories are walked recursively and filtered by the include/exclude patterns.
     *
     * @param paths files and directories
     * @return distinct files, directory contents sorted by path
     * @throws IOException if a path does not exist or a directory cannot be walked
     */
    public List<Path> collectFiles(final List<Path> paths) throws IOException {
        final Set<Path> files = new LinkedHashSet<>();
        for (final Path path : paths) {
            if (Files.isDirectory(path)) {
                try (Stream<Path> walk = Files.walk(path)) {
                    walk.filter(Files::isRegularFile)
                            .filter(patternMatcher::shouldInclude)
                            .sorted()
                            .forEach(files::add);
                }
            } else if (Files.exists(path)) {
                files.add(path);
            } else {
                throw new IOException("No such file or directory: " + path);
            }
        }
        logger.debug("Collected {} files from {} paths", files.size(), paths.size());
        return new ArrayList<>(files);
    }

    /**
     * Collects, extracts and analyzes the files below the given paths.
     */
    public BatchResult analyze(final List<Path> paths, final AnalysisOptions options) throws IOException {
        return analyzeFiles(collectFiles(paths), options);
    }

    /**
     * Extracts and analyzes exactly the given files.
     */
    public BatchResult analyzeFiles(final List<Path> files, final AnalysisOptions options) {
        final List<Future<FileOutcome>> futures = new ArrayList<>(files.size());
        try (AnalysisExecutorService executor = new AnalysisExecutorService(threadPoolSize)) {
            for (final Path file : files) {
                futures.add(executor.submit(() -> process(file, options)));
            }

            final List<FileOutcome> outcomes = new ArrayList<>(files.size());
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(files.get(i), futures.get(i)));
            }
            return assemble(outcomes, options);
        }
    }

    private FileOutcome process(final Path file, final AnalysisOptions options) {
        try {
            final ExtractedDocument document = extractor.extract(file);
            final DocumentAnalysis analysis =
                    engine.analyzeDocument(new AnalysisDocument(document.fileName(), document.text()), options);
            logger.debug("Analyzed {}: {} words", file, analysis.wordStats().totalWords());
            return FileOutcome.success(AnalyzedFile.of(document, analysis), document.text());
        } catch (final IOException | RuntimeException e) {
            logger.error("Failed to analyze file: {}", file, e);
            return FileOutcome.failure(new FailedFile(file, describe(e)));
        }
    }

    private static FileOutcome await(final Path file, final Future<FileOutcome> future) {
        try {
            return future.get();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return FileOutcome.failure(new FailedFile(file, "Interrupted"));
        } catch (final ExecutionException e) {
            logger.error("Failed to analyze file: {}", file, e.getCause());
            return FileOutcome.failure(new FailedFile(file, describe(e.getCause())));
        }
    }

    private BatchResult assemble(final List<FileOutcome> outcomes, final AnalysisOptions options) {
        final List<AnalyzedFile> analyzed = new ArrayList<>();
        final List<String> texts = new ArrayList<>();
        final List<FailedFile> failures = new ArrayList<>();
        for (final FileOutcome outcome : outcomes) {
            if (outcome.analyzed() != null) {
                analyzed.add(outcome.analyzed());
                texts.add(outcome.text());
            } else {
                failures.add(outcome.failure());
            }
        }

        final CorpusAnalysis corpus = engine.scoreCorpus(
                analyzed.stream().map(AnalyzedFile::analysis).toList(), texts, options);
        logger.info("Analyzed {} documents, {} failed", analyzed.size(), failures.size());
        return new BatchResult(options, analyzed, failures, corpus);
    }

    private static String describe(final Throwable e) {
        final String message = e.getMessage() == null || e.getMessage().isBlank()
                ? e.getClass().getSimpleName() : e.getMessage();
        final Throwable cause = e.getCause();
        return cause != null && cause.getMessage() != null ? message + ": " + cause.getMessage() : message;
    }

    private record FileOutcome(@Nullable AnalyzedFile analyzed, @Nullable String text, @Nullable FailedFile failure) {

        static FileOutcome success(final AnalyzedFile analyzed, final String text) {
            return new FileOutcome(analyzed, text, null);
        }

        static FileOutcome failure(final FailedFile failure) {
            return new FileOutcome(null, null, failure);
        }
    }
}

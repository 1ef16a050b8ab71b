package de.mirkosertic.textmetrics;

import de.mirkosertic.textmetrics.analysis.AnalysisOptions;
import de.mirkosertic.textmetrics.analysis.LanguageResourceLoader;
import de.mirkosertic.textmetrics.analysis.TextAnalyticsEngine;
import de.mirkosertic.textmetrics.config.ApplicationConfig;
import de.mirkosertic.textmetrics.config.BuildInfo;
import de.mirkosertic.textmetrics.config.LoggingConfigurator;
import de.mirkosertic.textmetrics.ingest.BatchAnalysisService;
import de.mirkosertic.textmetrics.ingest.BatchResult;
import de.mirkosertic.textmetrics.ingest.DocumentExtractor;
import de.mirkosertic.textmetrics.ingest.FilePatternMatcher;
import de.mirkosertic.textmetrics.report.ConsoleTableRenderer;
import de.mirkosertic.textmetrics.report.JsonReportWriter;
import de.mirkosertic.textmetrics.report.TextReportWriter;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Command line entry point: analyzes local documents and prints or exports the metrics.
 */
@CommandLine.Command(name = "textmetrics",
        mixinStandardHelpOptions = true,
        versionProvider = TextmetricsApplication.VersionProvider.class,
        header = "Word statistics, TF-IDF/WDF-IDF, keyword density, readability and keyword salience of documents",
        description = "Files are analyzed as given, directories are walked recursively and filtered with the "
                + "include/exclude patterns of the configuration (~/.textmetrics/config.yaml).",
        exitCodeListHeading = "Exit Codes:%n",
        exitCodeList = {
                "0: analysis completed",
                "1: no readable documents or I/O error",
                "2: invalid command line"
        })
public class TextmetricsApplication implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(TextmetricsApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    enum Format { TABLE, JSON }

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(arity = "1..*", paramLabel = "PATH", description = "Documents and/or directories to analyze")
    private List<Path> paths;

    @CommandLine.Option(names = {"-l", "--language"},
            description = "Language of the documents, code or name (default: from configuration)")
    private @Nullable String language;

    @CommandLine.Option(names = {"-k", "--keyword"}, split = ",",
            description = "Keyword for the density analysis; repeatable or comma separated")
    private @Nullable List<String> keywords;

    @CommandLine.Option(names = {"-n", "--top"}, description = "Number of top words and terms shown (default: from configuration)")
    private @Nullable Integer topN;

    @CommandLine.Option(names = {"-f", "--format"},
            description = "Console output: ${COMPLETION-CANDIDATES} (default: table)")
    private Format format = Format.TABLE;

    @CommandLine.Option(names = {"-o", "--output"},
            description = "Write a report file; JSON when the name ends with .json, plain text otherwise")
    private @Nullable Path output;

    @CommandLine.Option(names = "--per-document-scores", description = "Also compute TF-IDF/WDF-IDF per document")
    private boolean perDocumentScores;

    @CommandLine.Option(names = "--log-to-file", description = "Log to ~/.textmetrics/log instead of stderr")
    private boolean logToFile;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Debug logging")
    private boolean verbose;

    private final Supplier<ApplicationConfig> configSupplier;

    public TextmetricsApplication() {
        this(ApplicationConfig::load);
    }

    TextmetricsApplication(final Supplier<ApplicationConfig> configSupplier) {
        this.configSupplier = configSupplier;
    }

    public static void main(final String[] args) {
        System.exit(commandLine(new TextmetricsApplication()).execute(args));
    }

    static CommandLine commandLine(final TextmetricsApplication application) {
        return new CommandLine(application).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        LoggingConfigurator.configure(logToFile, verbose);

        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final ApplicationConfig config = configSupplier.get();
        final AnalysisOptions options = options(config);

        final LanguageResourceLoader resourceLoader =
                new LanguageResourceLoader(config.getModelDirectory(), config.getStopwordDirectory());
        final TextAnalyticsEngine engine = new TextAnalyticsEngine(resourceLoader, options.language());
        final BatchAnalysisService batchService = new BatchAnalysisService(
                new DocumentExtractor(config),
                engine,
                new FilePatternMatcher(config.getIncludePatterns(), config.getExcludePatterns()),
                config.getThreadPoolSize());

        final BatchResult result;
        try {
            result = batchService.analyze(paths, options);
        } catch (final IOException e) {
            logger.error("Cannot collect documents", e);
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
        logger.debug("Resource cache: {}", resourceLoader.getStats());

        if (format == Format.JSON) {
            out.println(JsonReportWriter.toJson(result));
        } else {
            out.print(ConsoleTableRenderer.render(result));
        }
        out.flush();

        if (output != null) {
            try {
                writeReport(result, output);
                err.println("Report written to " + output);
            } catch (final IOException e) {
                logger.error("Cannot write report to {}", output, e);
                err.println("Error: cannot write report to " + output + ": " + e.getMessage());
                return EXIT_FAILURE;
            }
        }

        if (!result.hasDocuments()) {
            err.println("Error: no readable documents");
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }

    AnalysisOptions options(final ApplicationConfig config) {
        final int effectiveTopN = topN != null ? topN : config.getTopN();
        if (effectiveTopN < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "--top must be positive, was " + effectiveTopN);
        }
        final List<String> effectiveKeywords = keywords != null
                ? keywords.stream().map(String::trim).filter(keyword -> !keyword.isEmpty()).toList()
                : config.getKeywords();
        return new AnalysisOptions(
                language != null ? language : config.getLanguage(),
                effectiveKeywords,
                effectiveTopN,
                perDocumentScores);
    }

    static void writeReport(final BatchResult result, final Path file) throws IOException {
        final Path fileName = file.getFileName();
        if (fileName != null && fileName.toString().toLowerCase(Locale.ROOT).endsWith(".json")) {
            JsonReportWriter.write(result, file);
        } else {
            TextReportWriter.write(result, file);
        }
    }

    static class VersionProvider implements CommandLine.IVersionProvider {

        @Override
        public String[] getVersion() {
            return new String[]{"textmetrics " + BuildInfo.getVersion() + " (built " + BuildInfo.getBuildTimestamp() + ")"};
        }
    }
}

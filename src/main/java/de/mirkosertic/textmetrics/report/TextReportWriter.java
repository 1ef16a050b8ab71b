package de.mirkosertic.textmetrics.report;

import de.mirkosertic.textmetrics.analysis.Diagnostic;
import de.mirkosertic.textmetrics.analysis.DocumentAnalysis;
import de.mirkosertic.textmetrics.analysis.ReadabilityResult;
import de.mirkosertic.textmetrics.analysis.ScoreTable;
import de.mirkosertic.textmetrics.analysis.TermCount;
import de.mirkosertic.textmetrics.analysis.TermScore;
import de.mirkosertic.textmetrics.ingest.AnalyzedFile;
import de.mirkosertic.textmetrics.ingest.BatchResult;
import de.mirkosertic.textmetrics.ingest.FailedFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Plain text report of a batch: one section per file, failed files with their error, then the
 * corpus scores.
 */
public final class TextReportWriter {

    static final String TITLE = "Text Metrics Report";

    private TextReportWriter() {
    }

    public static String render(final BatchResult result) {
        final StringBuilder out = new StringBuilder();
        out.append(TITLE).append('\n');
        out.append("=".repeat(TITLE.length())).append("\n\n");
        out.append("Language: ").append(result.options().language()).append('\n');
        out.append("Documents: ").append(result.files().size());
        if (!result.failures().isEmpty()) {
            out.append(" (").append(result.failures().size()).append(" failed)");
        }
        out.append("\n\n");

        for (final AnalyzedFile file : result.files()) {
            appendFile(out, file, result.options().topN());
        }
        for (final FailedFile failure : result.failures()) {
            out.append("File: ").append(failure.file()).append('\n');
            out.append("Error: ").append(failure.error()).append("\n\n");
        }

        final int topN = result.options().topN();
        appendScores(out, "TF-IDF (top " + topN + ")", result.corpus().tfIdf().top(topN));
        appendScores(out, "WDF-IDF (top " + topN + ")", result.corpus().wdfIdf().top(topN));

        final List<Diagnostic> diagnostics = result.corpus().diagnostics();
        if (!diagnostics.isEmpty()) {
            out.append("Notes:\n");
            diagnostics.forEach(diagnostic -> out.append("  ").append(diagnostic).append('\n'));
        }
        return out.toString();
    }

    public static void write(final BatchResult result, final Path file) throws IOException {
        Files.writeString(file, render(result), StandardCharsets.UTF_8);
    }

    private static void appendFile(final StringBuilder out, final AnalyzedFile file, final int topN) {
        final DocumentAnalysis analysis = file.analysis();
        out.append("File: ").append(file.file()).append('\n');
        out.append("Total words: ").append(analysis.wordStats().totalWords()).append('\n');
        out.append("Unique words: ").append(analysis.wordStats().uniqueWords()).append('\n');
        if (file.detectedLanguage() != null) {
            out.append("Detected language: ").append(file.detectedLanguage()).append('\n');
        }

        out.append("Top ").append(topN).append(" words:\n");
        for (final TermCount entry : analysis.wordStats().topFrequency().entries()) {
            out.append("  ").append(entry.term()).append(": ").append(entry.count()).append('\n');
        }

        final Map<String, Double> densities = analysis.keywordDensity().densities();
        if (!densities.isEmpty()) {
            out.append("Keyword density:\n");
            densities.forEach((keyword, density) ->
                    out.append("  ").append(keyword).append(": ").append(format("%.2f%%", density)).append('\n'));
        }

        final ReadabilityResult readability = analysis.readability();
        out.append("Readability: ").append(readability.label());
        if (readability.isKnown()) {
            out.append(format(" (reading ease %.1f, grade level %.1f)", readability.readingEase(), readability.gradeLevel()));
        }
        out.append('\n');

        out.append("Meaningful words: ").append(analysis.salience().uniqueMeaningfulCount()).append('\n');
        for (final TermCount entry : analysis.salience().topMeaningful().entries()) {
            out.append("  ").append(entry.term()).append(": ").append(entry.count()).append('\n');
        }

        for (final Diagnostic diagnostic : analysis.diagnostics()) {
            out.append("Note: ").append(diagnostic).append('\n');
        }
        out.append('\n');
    }

    private static void appendScores(final StringBuilder out, final String title, final ScoreTable scores) {
        out.append(title).append(":\n");
        if (scores.isEmpty()) {
            out.append("  (none)\n");
        }
        for (final TermScore entry : scores.entries()) {
            out.append("  ").append(entry.term()).append(": ").append(format("%.4f", entry.score())).append('\n');
        }
        out.append('\n');
    }

    static String format(final String pattern, final Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}

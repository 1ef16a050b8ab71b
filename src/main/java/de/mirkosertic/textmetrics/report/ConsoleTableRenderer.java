package de.mirkosertic.textmetrics.report;

import de.mirkosertic.textmetrics.analysis.DocumentAnalysis;
import de.mirkosertic.textmetrics.analysis.TermCount;
import de.mirkosertic.textmetrics.ingest.AnalyzedFile;
import de.mirkosertic.textmetrics.ingest.BatchResult;
import de.mirkosertic.textmetrics.ingest.FailedFile;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a batch as a fixed-width console table, one row per file.
 */
public final class ConsoleTableRenderer {

    private static final List<String> HEADER = List.of("File", "Words", "Unique", "Reading ease", "Level", "Top words");
    private static final int TOP_WORDS_SHOWN = 3;

    private ConsoleTableRenderer() {
    }

    public static String render(final BatchResult result) {
        final List<List<String>> rows = new ArrayList<>();
        rows.add(HEADER);
        for (final AnalyzedFile file : result.files()) {
            rows.add(row(file));
        }
        for (final FailedFile failure : result.failures()) {
            rows.add(List.of(failure.file().getFileName().toString(), "-", "-", "-", "error", failure.error()));
        }

        final int[] widths = new int[HEADER.size()];
        for (final List<String> row : rows) {
            for (int i = 0; i < row.size(); i++) {
                widths[i] = Math.max(widths[i], row.get(i).length());
            }
        }

        final StringBuilder out = new StringBuilder();
        final String separator = separator(widths);
        out.append(separator);
        appendRow(out, rows.get(0), widths);
        out.append(separator);
        for (final List<String> row : rows.subList(1, rows.size())) {
            appendRow(out, row, widths);
        }
        out.append(separator);
        out.append(TextReportWriter.format("%d documents, %d words%n", result.files().size(), result.totalRawWords()));
        return out.toString();
    }

    private static List<String> row(final AnalyzedFile file) {
        final DocumentAnalysis analysis = file.analysis();
        final String topWords = analysis.wordStats().topFrequency().entries().stream()
                .limit(TOP_WORDS_SHOWN)
                .map(TermCount::term)
                .collect(Collectors.joining(", "));
        return List.of(
                file.file().getFileName().toString(),
                String.valueOf(analysis.wordStats().totalWords()),
                String.valueOf(analysis.wordStats().uniqueWords()),
                analysis.readability().isKnown()
                        ? TextReportWriter.format("%.1f", analysis.readability().readingEase()) : "-",
                analysis.readability().label(),
                topWords);
    }

    private static String separator(final int[] widths) {
        final StringBuilder line = new StringBuilder("+");
        for (final int width : widths) {
            line.append("-".repeat(width + 2)).append('+');
        }
        return line.append('\n').toString();
    }

    private static void appendRow(final StringBuilder out, final List<String> row, final int[] widths) {
        out.append('|');
        for (int i = 0; i < widths.length; i++) {
            final String cell = i < row.size() ? row.get(i) : "";
            out.append(' ').append(cell).append(" ".repeat(widths[i] - cell.length())).append(" |");
        }
        out.append('\n');
    }
}

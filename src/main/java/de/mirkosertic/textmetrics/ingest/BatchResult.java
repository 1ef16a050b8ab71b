package de.mirkosertic.textmetrics.ingest;

import de.mirkosertic.textmetrics.analysis.AnalysisOptions;
import de.mirkosertic.textmetrics.analysis.CorpusAnalysis;

import java.util.List;

/**
 * Result of analyzing a batch of files.
 *
 * @param options  the options the batch was analyzed with
 * @param files    successfully analyzed files, in the order they were collected
 * @param failures files that could not be read or analyzed
 * @param corpus   corpus scores over all successfully analyzed files
 */
public record BatchResult(AnalysisOptions options,
                          List<AnalyzedFile> files,
                          List<FailedFile> failures,
                          CorpusAnalysis corpus) {

    public BatchResult {
        files = List.copyOf(files);
        failures = List.copyOf(failures);
    }

    public int totalRawWords() {
        return files.stream().mapToInt(AnalyzedFile::rawWordCount).sum();
    }

    public boolean hasDocuments() {
        return !files.isEmpty();
    }
}

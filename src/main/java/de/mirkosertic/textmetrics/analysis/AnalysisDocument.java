package de.mirkosertic.textmetrics.analysis;

import java.util.Objects;

/**
 * A labelled document text, paragraphs joined by newlines.
 */
public record AnalysisDocument(String label, String text) {

    public AnalysisDocument {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(text, "text");
    }
}

package de.mirkosertic.textmetrics.analysis;

/**
 * A non-fatal problem raised while analyzing a document, e.g. a tokenizer tier
 * that could not be used or a scorer that fell back to its default result.
 *
 * @param component the component that raised the diagnostic (e.g. "tokenizer", "readability")
 * @param message   human-readable description
 */
public record Diagnostic(String component, String message) {

    @Override
    public String toString() {
        return component + ": " + message;
    }
}

package de.mirkosertic.textmetrics.analysis;

import java.util.List;

/**
 * Result of tokenizing one document.
 *
 * @param tokens      lower-cased, alphanumeric-only tokens in document order
 * @param strategy    name of the tier that produced the tokens
 * @param diagnostics one entry per tier that failed before {@code strategy} succeeded
 */
public record Tokenization(List<String> tokens, String strategy, List<Diagnostic> diagnostics) {

    public Tokenization {
        tokens = List.copyOf(tokens);
        diagnostics = List.copyOf(diagnostics);
    }

    public int size() {
        return tokens.size();
    }

    public boolean usedFallback() {
        return !diagnostics.isEmpty();
    }
}

package de.mirkosertic.textmetrics.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Last resort tokenization: split on whitespace. Never fails.
 */
public class WhitespaceTokenizationStrategy implements TokenizationStrategy {

    public static final String NAME = "whitespace";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> tokenize(final String lowerCasedText, final String language) {
        final List<String> tokens = new ArrayList<>();
        for (final String part : WHITESPACE.split(lowerCasedText)) {
            if (!part.isEmpty()) {
                tokens.add(part);
            }
        }
        return tokens;
    }
}

package de.mirkosertic.textmetrics.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Language-agnostic tokenization extracting runs of Unicode word characters.
 */
public class RegexTokenizationStrategy implements TokenizationStrategy {

    public static final String NAME = "regex";

    private static final Pattern WORD = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> tokenize(final String lowerCasedText, final String language) {
        final List<String> tokens = new ArrayList<>();
        final Matcher matcher = WORD.matcher(lowerCasedText);
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }
}

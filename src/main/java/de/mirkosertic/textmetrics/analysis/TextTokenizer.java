package de.mirkosertic.textmetrics.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Converts text into lower-cased, alphanumeric-only tokens using a chain of
 * {@link TokenizationStrategy tiers}.
 *
 * <p>The text is lower-cased, then the tiers are tried in order until one succeeds. A failing
 * tier is logged as a warning and reported as a {@link Diagnostic} in the returned
 * {@link Tokenization}; it never aborts the analysis. Whatever tier succeeds, only tokens that
 * consist entirely of Unicode letters and digits are kept.</p>
 *
 * <p>Two chains are provided:</p>
 * <ul>
 *   <li>{@link #full(LanguageResourceLoader)}: OpenNLP &rarr; regex &rarr; whitespace</li>
 *   <li>{@link #basic()}: regex &rarr; whitespace, used where only consistent word boundaries matter</li>
 * </ul>
 *
 * <p>Instances are immutable and thread-safe as long as their strategies are.</p>
 */
public class TextTokenizer {

    private static final Logger logger = LoggerFactory.getLogger(TextTokenizer.class);

    static final String COMPONENT = "tokenizer";

    private final List<TokenizationStrategy> strategies;

    public TextTokenizer(final List<TokenizationStrategy> strategies) {
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one tokenization strategy is required");
        }
        this.strategies = List.copyOf(strategies);
    }

    public static TextTokenizer full(final LanguageResourceLoader resourceLoader) {
        return new TextTokenizer(List.of(
                new OpenNlpTokenizationStrategy(resourceLoader),
                new RegexTokenizationStrategy(),
                new WhitespaceTokenizationStrategy()));
    }

    public static TextTokenizer basic() {
        return new TextTokenizer(List.of(
                new RegexTokenizationStrategy(),
                new WhitespaceTokenizationStrategy()));
    }

    /**
     * Tokenizes without a language, for chains that do not contain language-aware tiers.
     */
    public Tokenization tokenize(final String text) {
        return tokenize(text, "");
    }

    /**
     * Tokenizes text for the given language.
     *
     * @param text     the document text, must not be null
     * @param language language code or name, must not be null
     * @return the tokens and the diagnostics of every tier that failed
     */
    public Tokenization tokenize(final String text, final String language) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(language, "language");

        final String lowerCased = text.toLowerCase(Locale.ROOT);
        if (lowerCased.isBlank()) {
            return new Tokenization(List.of(), strategies.get(0).name(), List.of());
        }

        final String code = LanguageCodes.normalize(language);
        final List<Diagnostic> diagnostics = new ArrayList<>();
        for (final TokenizationStrategy strategy : strategies) {
            try {
                final List<String> raw = strategy.tokenize(lowerCased, code);
                return new Tokenization(keepAlphanumeric(raw), strategy.name(), diagnostics);
            } catch (final RuntimeException e) {
                logger.warn("Tokenization with '{}' failed for language '{}', falling back: {}",
                        strategy.name(), code, e.getMessage());
                diagnostics.add(new Diagnostic(COMPONENT,
                        "Tokenizer '" + strategy.name() + "' unavailable: " + e.getMessage()));
            }
        }

        logger.error("All tokenization strategies failed, continuing with an empty token list");
        return new Tokenization(List.of(), "none", diagnostics);
    }

    static List<String> keepAlphanumeric(final List<String> rawTokens) {
        final List<String> tokens = new ArrayList<>(rawTokens.size());
        for (final String token : rawTokens) {
            if (isAlphanumeric(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    static boolean isAlphanumeric(final String token) {
        return !token.isEmpty() && token.codePoints().allMatch(Character::isLetterOrDigit);
    }
}

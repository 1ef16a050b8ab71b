package de.mirkosertic.textmetrics.analysis;

import java.util.List;

/**
 * One tier of the tokenizer fallback chain.
 *
 * <p>A strategy either returns the complete token list of the text or throws. It never returns
 * a partial result; {@link TextTokenizer} replaces the whole token list with the next tier's
 * output when a tier fails.</p>
 */
public interface TokenizationStrategy {

    /**
     * @return short identifier reported in {@link Tokenization#strategy()} and diagnostics
     */
    String name();

    /**
     * Splits already lower-cased text into raw tokens. Raw tokens may still contain punctuation,
     * the caller filters them.
     *
     * @param lowerCasedText the text, lower-cased
     * @param language       normalized language code
     * @return raw tokens in text order
     * @throws ResourceUnavailableException if a resource this tier needs is missing
     */
    List<String> tokenize(String lowerCasedText, String language);
}

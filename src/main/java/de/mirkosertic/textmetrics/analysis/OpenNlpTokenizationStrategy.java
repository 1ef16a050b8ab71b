package de.mirkosertic.textmetrics.analysis;

import opennlp.tools.sentdetect.SentenceDetectorME;
import opennlp.tools.tokenize.TokenizerME;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Language-aware tokenization with the OpenNLP learnable tokenizer.
 *
 * <p>When the language has a sentence model the text is split into sentences first and each
 * sentence is tokenized on its own, which keeps sentence-final punctuation out of the last word.
 * {@link TokenizerME} and {@link SentenceDetectorME} are not thread-safe, so they are created per
 * call from the shared, immutable models.</p>
 */
public class OpenNlpTokenizationStrategy implements TokenizationStrategy {

    public static final String NAME = "opennlp";

    private final LanguageResourceLoader resourceLoader;

    public OpenNlpTokenizationStrategy(final LanguageResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> tokenize(final String lowerCasedText, final String language) {
        final LinguisticModels models = resourceLoader.linguisticModels(language).orElseThrow();
        final TokenizerME tokenizer = new TokenizerME(models.tokenizerModel());

        if (models.sentenceModel() == null) {
            return Arrays.asList(tokenizer.tokenize(lowerCasedText));
        }

        final SentenceDetectorME sentenceDetector = new SentenceDetectorME(models.sentenceModel());
        final List<String> tokens = new ArrayList<>();
        for (final String sentence : sentenceDetector.sentDetect(lowerCasedText)) {
            tokens.addAll(Arrays.asList(tokenizer.tokenize(sentence)));
        }
        return tokens;
    }
}

package de.mirkosertic.textmetrics.analysis;

import opennlp.tools.sentdetect.SentenceModel;
import opennlp.tools.tokenize.TokenizerModel;
import org.jspecify.annotations.Nullable;

/**
 * OpenNLP models of one language. The models are immutable and may be shared between threads;
 * the tools created from them may not.
 *
 * @param tokenizerModel the learnable tokenizer model
 * @param sentenceModel  the sentence detector model, null if the language has none
 */
public record LinguisticModels(TokenizerModel tokenizerModel, @Nullable SentenceModel sentenceModel) {
}

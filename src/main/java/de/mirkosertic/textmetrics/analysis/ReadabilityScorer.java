package de.mirkosertic.textmetrics.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flesch Reading Ease and Flesch-Kincaid Grade Level.
 *
 * <pre>
 * ease  = 206.835 - 1.015 * (words / sentences) - 84.6 * (syllables / words)
 * grade = 0.39 * (words / sentences) + 11.8 * (syllables / words) - 15.59
 * </pre>
 *
 * <p>Sentences end at {@code .}, {@code !} or {@code ?}; text with words but without a terminator
 * is one sentence. Syllables are estimated from vowel groups. A text without words, or any failure
 * while computing, yields {@link ReadabilityResult#unknown()} and a diagnostic.</p>
 */
public class ReadabilityScorer {

    private static final Logger logger = LoggerFactory.getLogger(ReadabilityScorer.class);

    static final String COMPONENT = "readability";

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+(?:['\\u2019-][\\p{L}\\p{N}]+)*");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");
    private static final Pattern VOWEL_GROUP = Pattern.compile("[aeiouy\\u00E0-\\u00E6\\u00E8-\\u00EF\\u00F2-\\u00F6\\u00F9-\\u00FC]+");

    public ReadabilityResult readability(final String text) {
        return readability(text, new Diagnostics());
    }

    public ReadabilityResult readability(final String text, final Diagnostics diagnostics) {
        Objects.requireNonNull(text, "text");
        try {
            final int words = countWords(text);
            if (words == 0) {
                diagnostics.add(COMPONENT, "Text contains no words, readability not available");
                return ReadabilityResult.unknown();
            }
            final int sentences = Math.max(1, countSentences(text));
            final int syllables = countSyllables(text);

            final double wordsPerSentence = (double) words / sentences;
            final double syllablesPerWord = (double) syllables / words;
            final double ease = 206.835 - 1.015 * wordsPerSentence - 84.6 * syllablesPerWord;
            final double grade = 0.39 * wordsPerSentence + 11.8 * syllablesPerWord - 15.59;

            if (!Double.isFinite(ease) || !Double.isFinite(grade)) {
                diagnostics.add(COMPONENT, "Readability formula produced a non-finite value");
                return ReadabilityResult.unknown();
            }
            return new ReadabilityResult(ease, grade, ComplexityLevel.classify(ease), sentences, words, syllables);
        } catch (final RuntimeException e) {
            logger.warn("Readability computation failed, reporting unknown", e);
            diagnostics.add(COMPONENT, "Readability computation failed: " + e.getMessage());
            return ReadabilityResult.unknown();
        }
    }

    static int countWords(final String text) {
        int count = 0;
        final Matcher matcher = WORD.matcher(text);
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    /**
     * Counts sentence segments that contain at least one word.
     */
    static int countSentences(final String text) {
        int count = 0;
        for (final String segment : SENTENCE_END.split(text)) {
            if (WORD.matcher(segment).find()) {
                count++;
            }
        }
        return count;
    }

    static int countSyllables(final String text) {
        int total = 0;
        final Matcher matcher = WORD.matcher(text);
        while (matcher.find()) {
            total += syllablesOf(matcher.group().toLowerCase(Locale.ROOT));
        }
        return total;
    }

    /**
     * Vowel group heuristic: every group of consecutive vowels is one syllable, a trailing silent
     * {@code e} is dropped (but not in {@code -le}), every word has at least one syllable.
     */
    static int syllablesOf(final String word) {
        int groups = 0;
        final Matcher matcher = VOWEL_GROUP.matcher(word);
        while (matcher.find()) {
            groups++;
        }
        if (groups > 1 && word.endsWith("e") && !word.endsWith("le") && !word.endsWith("ee")) {
            groups--;
        }
        return Math.max(1, groups);
    }
}

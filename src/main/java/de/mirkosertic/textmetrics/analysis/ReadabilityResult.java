package de.mirkosertic.textmetrics.analysis;

/**
 * Readability of one document.
 *
 * @param readingEase Flesch Reading Ease, may be negative or above 100
 * @param gradeLevel  Flesch-Kincaid Grade Level
 * @param level       complexity class of {@code readingEase}
 * @param sentences   sentences counted
 * @param words       words counted
 * @param syllables   syllables counted
 */
public record ReadabilityResult(double readingEase,
                                double gradeLevel,
                                ComplexityLevel level,
                                int sentences,
                                int words,
                                int syllables) {

    private static final ReadabilityResult UNKNOWN = new ReadabilityResult(0.0, 0.0, ComplexityLevel.UNKNOWN, 0, 0, 0);

    /**
     * The zeroed result reported when readability cannot be computed.
     */
    public static ReadabilityResult unknown() {
        return UNKNOWN;
    }

    public String label() {
        return level.label();
    }

    public boolean isKnown() {
        return level != ComplexityLevel.UNKNOWN;
    }
}

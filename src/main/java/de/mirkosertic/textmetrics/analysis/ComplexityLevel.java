package de.mirkosertic.textmetrics.analysis;

/**
 * Complexity classes of the Flesch Reading Ease score.
 */
public enum ComplexityLevel {

    VERY_DIFFICULT("Very difficult"),
    DIFFICULT("Difficult"),
    SOMEWHAT_DIFFICULT("Somewhat difficult"),
    STANDARD("Standard"),
    EASY("Easy to understand"),
    UNKNOWN("Unknown");

    private final String label;

    ComplexityLevel(final String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Classifies a reading ease score. Lower bounds are inclusive: 30 is {@link #DIFFICULT},
     * 70 is {@link #EASY}. NaN classifies as {@link #UNKNOWN}.
     */
    public static ComplexityLevel classify(final double readingEase) {
        if (Double.isNaN(readingEase)) {
            return UNKNOWN;
        }
        if (readingEase < 30) {
            return VERY_DIFFICULT;
        }
        if (readingEase < 50) {
            return DIFFICULT;
        }
        if (readingEase < 60) {
            return SOMEWHAT_DIFFICULT;
        }
        if (readingEase < 70) {
            return STANDARD;
        }
        return EASY;
    }
}

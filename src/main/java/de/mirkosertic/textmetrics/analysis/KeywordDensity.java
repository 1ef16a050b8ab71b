package de.mirkosertic.textmetrics.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keyword densities of one document.
 *
 * @param densities  keyword (as given) to density in percent, in keyword order; not capped at 100
 * @param tokenCount number of tokens used as denominator
 */
public record KeywordDensity(Map<String, Double> densities, int tokenCount) {

    public KeywordDensity {
        densities = Collections.unmodifiableMap(new LinkedHashMap<>(densities));
    }

    public static KeywordDensity empty() {
        return new KeywordDensity(Map.of(), 0);
    }

    public double density(final String keyword) {
        return densities.getOrDefault(keyword, 0.0);
    }
}

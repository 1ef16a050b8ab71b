package de.mirkosertic.textmetrics.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

/**
 * Stopword provider backed by the curated lists of a {@link LanguageResourceLoader}.
 *
 * <p>If no list can be loaded for the requested language, a built-in minimal set of high-frequency
 * German function words is returned, so salience analysis always has a noise filter.</p>
 */
public class DefaultStopwordProvider implements StopwordProvider {

    private static final Logger logger = LoggerFactory.getLogger(DefaultStopwordProvider.class);

    static final Set<String> FALLBACK_STOPWORDS = Set.of(
            "der", "die", "das", "und", "oder", "in", "zu", "ein", "eine", "den", "mit", "von");

    private final LanguageResourceLoader resourceLoader;

    public DefaultStopwordProvider(final LanguageResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    @Override
    public StopwordSet stopwords(final String language) {
        final String code = LanguageCodes.normalize(Objects.requireNonNull(language, "language"));
        final LanguageResource<Set<String>> resource = resourceLoader.stopwords(code);
        if (resource.isAvailable()) {
            return new StopwordSet(code, resource.orElseThrow(), false);
        }
        logger.debug("Using built-in fallback stopwords for '{}': {}", code, resource.failure());
        return new StopwordSet(code, FALLBACK_STOPWORDS, true);
    }
}

package de.mirkosertic.textmetrics.analysis;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Normalizes language keys to ISO 639-1 codes.
 *
 * <p>Accepts codes ({@code "de"}), English names ({@code "german"}) and a few native names
 * ({@code "deutsch"}), case-insensitively. Unknown keys are returned trimmed and lower-cased,
 * which makes every later resource lookup for them fail and fall back.</p>
 */
public final class LanguageCodes {

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("german", "de"), Map.entry("deutsch", "de"), Map.entry("ger", "de"), Map.entry("deu", "de"),
            Map.entry("english", "en"), Map.entry("eng", "en"),
            Map.entry("french", "fr"), Map.entry("francais", "fr"), Map.entry("fra", "fr"),
            Map.entry("spanish", "es"), Map.entry("espanol", "es"), Map.entry("spa", "es"),
            Map.entry("italian", "it"), Map.entry("italiano", "it"), Map.entry("ita", "it"),
            Map.entry("dutch", "nl"), Map.entry("nederlands", "nl"), Map.entry("nld", "nl"),
            Map.entry("portuguese", "pt"), Map.entry("portugues", "pt"), Map.entry("por", "pt"),
            Map.entry("swedish", "sv"), Map.entry("svenska", "sv"), Map.entry("swe", "sv"),
            Map.entry("danish", "da"), Map.entry("dansk", "da"), Map.entry("dan", "da"),
            Map.entry("norwegian", "no"), Map.entry("norsk", "no"), Map.entry("nb", "no"), Map.entry("nor", "no"),
            Map.entry("finnish", "fi"), Map.entry("suomi", "fi"), Map.entry("fin", "fi"),
            Map.entry("russian", "ru"), Map.entry("rus", "ru"),
            Map.entry("hungarian", "hu"), Map.entry("magyar", "hu"), Map.entry("hun", "hu")
    );

    private LanguageCodes() {
    }

    /**
     * Normalizes a language key.
     *
     * @param language a language code or name, must not be null
     * @return the ISO 639-1 code, or the lower-cased key if it is not known
     */
    public static String normalize(final String language) {
        Objects.requireNonNull(language, "language");
        final String key = language.trim().toLowerCase(Locale.ROOT);
        return ALIASES.getOrDefault(key, key);
    }
}

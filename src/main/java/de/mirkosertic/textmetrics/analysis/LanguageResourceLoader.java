package de.mirkosertic.textmetrics.analysis;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import opennlp.tools.sentdetect.SentenceModel;
import opennlp.tools.tokenize.TokenizerModel;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.da.DanishAnalyzer;
import org.apache.lucene.analysis.de.GermanAnalyzer;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.es.SpanishAnalyzer;
import org.apache.lucene.analysis.fi.FinnishAnalyzer;
import org.apache.lucene.analysis.fr.FrenchAnalyzer;
import org.apache.lucene.analysis.hu.HungarianAnalyzer;
import org.apache.lucene.analysis.it.ItalianAnalyzer;
import org.apache.lucene.analysis.nl.DutchAnalyzer;
import org.apache.lucene.analysis.no.NorwegianAnalyzer;
import org.apache.lucene.analysis.pt.PortugueseAnalyzer;
import org.apache.lucene.analysis.ru.RussianAnalyzer;
import org.apache.lucene.analysis.sv.SwedishAnalyzer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Loads language resources on first use and keeps them for the lifetime of the loader.
 *
 * <p>Two kinds of resources are managed, each in its own cache keyed by the normalized
 * language code:</p>
 * <ul>
 *   <li><b>Linguistic models</b>: OpenNLP Universal Dependencies tokenizer and sentence models.
 *       Looked up in the configured model directory first, then on the classpath (provided by the
 *       {@code opennlp-models-*} Maven dependencies).</li>
 *   <li><b>Stopword lists</b>: {@code <code>.txt} in the configured stopword directory, otherwise
 *       the default stop set Lucene ships for the language.</li>
 * </ul>
 *
 * <p>Each language is loaded at most once per loader. Concurrent first lookups for the same
 * language block until the single load completes and then all observe its result; later lookups
 * are served without locking. A failed load is cached as an unavailable resource.</p>
 *
 * <p>Instances are meant to be created once where the engine is assembled and shared between
 * every tokenizer and stopword provider of that engine.</p>
 */
public class LanguageResourceLoader {

    private static final Logger logger = LoggerFactory.getLogger(LanguageResourceLoader.class);

    /**
     * Maps language code to its Universal Dependencies treebank identifier used
     * in the OpenNLP model file names.
     */
    private static final Map<String, String> TREEBANK_BY_LANGUAGE = Map.of(
            "en", "ewt",
            "de", "gsd"
    );

    /**
     * Model version suffix embedded in the OpenNLP model file names.
     */
    private static final String MODEL_VERSION = "1.2-2.5.0";

    private static final Map<String, Supplier<CharArraySet>> LUCENE_STOP_SETS = Map.ofEntries(
            Map.entry("en", () -> EnglishAnalyzer.ENGLISH_STOP_WORDS_SET),
            Map.entry("de", GermanAnalyzer::getDefaultStopSet),
            Map.entry("fr", FrenchAnalyzer::getDefaultStopSet),
            Map.entry("es", SpanishAnalyzer::getDefaultStopSet),
            Map.entry("it", ItalianAnalyzer::getDefaultStopSet),
            Map.entry("nl", DutchAnalyzer::getDefaultStopSet),
            Map.entry("pt", PortugueseAnalyzer::getDefaultStopSet),
            Map.entry("sv", SwedishAnalyzer::getDefaultStopSet),
            Map.entry("da", DanishAnalyzer::getDefaultStopSet),
            Map.entry("no", NorwegianAnalyzer::getDefaultStopSet),
            Map.entry("fi", FinnishAnalyzer::getDefaultStopSet),
            Map.entry("ru", RussianAnalyzer::getDefaultStopSet),
            Map.entry("hu", HungarianAnalyzer::getDefaultStopSet)
    );

    private final @Nullable Path modelDirectory;
    private final @Nullable Path stopwordDirectory;
    private final Cache<String, LanguageResource<LinguisticModels>> modelCache;
    private final Cache<String, LanguageResource<Set<String>>> stopwordCache;
    private final ResourceCacheStats stats;

    /**
     * Creates a loader that only uses classpath models and Lucene's stop sets.
     */
    public LanguageResourceLoader() {
        this(null, null);
    }

    /**
     * @param modelDirectory    directory searched for OpenNLP model files before the classpath, may be null
     * @param stopwordDirectory directory searched for {@code <code>.txt} stopword lists, may be null
     */
    public LanguageResourceLoader(final @Nullable Path modelDirectory, final @Nullable Path stopwordDirectory) {
        this.modelDirectory = modelDirectory;
        this.stopwordDirectory = stopwordDirectory;
        this.modelCache = Caffeine.newBuilder().build();
        this.stopwordCache = Caffeine.newBuilder().build();
        this.stats = new ResourceCacheStats();
    }

    /**
     * Returns the OpenNLP models for a language, loading them on first use.
     *
     * @param language language code or name
     * @return the models, or an unavailable resource if no tokenizer model exists for the language
     */
    public LanguageResource<LinguisticModels> linguisticModels(final String language) {
        return lookup(modelCache, LanguageCodes.normalize(language), this::loadLinguisticModels);
    }

    /**
     * Returns the curated stopword list for a language, loading it on first use.
     *
     * @param language language code or name
     * @return the lower-cased stopwords, or an unavailable resource if the language has no list
     */
    public LanguageResource<Set<String>> stopwords(final String language) {
        return lookup(stopwordCache, LanguageCodes.normalize(language), this::loadStopwords);
    }

    public ResourceCacheStats getStats() {
        return stats;
    }

    private <T> LanguageResource<T> lookup(final Cache<String, LanguageResource<T>> cache,
                                           final String code,
                                           final Function<String, LanguageResource<T>> loader) {
        final AtomicBoolean loadedByThisCall = new AtomicBoolean(false);
        // Caffeine runs the mapping function at most once per key; concurrent callers wait for it
        final LanguageResource<T> resource = cache.get(code, key -> {
            loadedByThisCall.set(true);
            final LanguageResource<T> loaded = loader.apply(key);
            stats.recordLoad(loaded.isAvailable());
            if (!loaded.isAvailable()) {
                logger.warn("Language resource unavailable for '{}': {}", key, loaded.failure());
            }
            return loaded;
        });
        if (!loadedByThisCall.get()) {
            stats.recordHit();
        }
        return resource;
    }

    private LanguageResource<LinguisticModels> loadLinguisticModels(final String code) {
        final String treebank = TREEBANK_BY_LANGUAGE.get(code);
        if (treebank == null) {
            return LanguageResource.unavailable(code, "No OpenNLP models for language '" + code
                    + "'. Supported: " + TREEBANK_BY_LANGUAGE.keySet());
        }

        final TokenizerModel tokenizerModel;
        try (InputStream stream = openModel(code, treebank, "tokens")) {
            if (stream == null) {
                return LanguageResource.unavailable(code, "OpenNLP tokenizer model not found: "
                        + modelFileName(code, treebank, "tokens"));
            }
            tokenizerModel = new TokenizerModel(stream);
        } catch (final IOException | RuntimeException e) {
            return LanguageResource.unavailable(code, "Failed to read OpenNLP tokenizer model for '"
                    + code + "': " + e.getMessage());
        }

        SentenceModel sentenceModel = null;
        try (InputStream stream = openModel(code, treebank, "sentence")) {
            if (stream != null) {
                sentenceModel = new SentenceModel(stream);
            } else {
                logger.debug("No sentence model for '{}', tokenizing without sentence detection", code);
            }
        } catch (final IOException | RuntimeException e) {
            logger.warn("Failed to read OpenNLP sentence model for '{}', tokenizing without sentence detection", code, e);
        }

        logger.info("Loaded OpenNLP models for '{}' (treebank {}, sentence detection {})",
                code, treebank, sentenceModel != null ? "on" : "off");
        return LanguageResource.loaded(code, new LinguisticModels(tokenizerModel, sentenceModel));
    }

    private @Nullable InputStream openModel(final String code, final String treebank, final String type) throws IOException {
        final String fileName = modelFileName(code, treebank, type);
        if (modelDirectory != null) {
            final Path candidate = modelDirectory.resolve(fileName);
            if (Files.isRegularFile(candidate)) {
                logger.debug("Loading OpenNLP model from {}", candidate);
                return Files.newInputStream(candidate);
            }
        }
        return LanguageResourceLoader.class.getResourceAsStream("/" + fileName);
    }

    private static String modelFileName(final String code, final String treebank, final String type) {
        return "opennlp-" + code + "-ud-" + treebank + "-" + type + "-" + MODEL_VERSION + ".bin";
    }

    private LanguageResource<Set<String>> loadStopwords(final String code) {
        if (stopwordDirectory != null) {
            final Path file = stopwordDirectory.resolve(code + ".txt");
            if (Files.isRegularFile(file)) {
                try {
                    final Set<String> words = parseStopwordLines(Files.readAllLines(file, StandardCharsets.UTF_8));
                    logger.info("Loaded {} stopwords for '{}' from {}", words.size(), code, file);
                    return LanguageResource.loaded(code, words);
                } catch (final IOException e) {
                    logger.warn("Failed to read stopword file {}, trying bundled list", file, e);
                }
            }
        }

        final Supplier<CharArraySet> luceneSet = LUCENE_STOP_SETS.get(code);
        if (luceneSet == null) {
            return LanguageResource.unavailable(code, "No stopword list for language '" + code + "'");
        }
        try {
            final Set<String> words = new HashSet<>();
            for (final Object entry : luceneSet.get()) {
                words.add(entry instanceof char[] chars ? new String(chars) : entry.toString());
            }
            logger.debug("Loaded {} bundled stopwords for '{}'", words.size(), code);
            return LanguageResource.loaded(code, Set.copyOf(words));
        } catch (final RuntimeException e) {
            return LanguageResource.unavailable(code, "Failed to load bundled stopwords for '" + code + "': " + e.getMessage());
        }
    }

    static Set<String> parseStopwordLines(final List<String> lines) {
        final Set<String> words = new HashSet<>();
        for (final String line : lines) {
            final int comment = line.indexOf('#');
            final String word = (comment >= 0 ? line.substring(0, comment) : line).trim().toLowerCase(Locale.ROOT);
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return Set.copyOf(words);
    }
}

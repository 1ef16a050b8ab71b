package de.mirkosertic.textmetrics.config;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Configuration of the text metrics tool.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.textmetrics/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    static final String ENV_LANGUAGE = "TEXTMETRICS_LANGUAGE";
    static final String ENV_MODEL_DIR = "TEXTMETRICS_MODEL_DIR";
    static final String ENV_STOPWORD_DIR = "TEXTMETRICS_STOPWORD_DIR";
    static final String PROP_LANGUAGE = "textmetrics.language";
    private static final String CONFIG_DIR = ".textmetrics";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    private final UnaryOperator<String> environment;
    private final UnaryOperator<String> systemProperties;

    // Analysis settings
    private String language = "german";
    private int topN = 10;
    private List<String> keywords = new ArrayList<>();

    // Resource settings
    private @Nullable String modelDirectory;
    private @Nullable String stopwordDirectory;

    // Ingest settings
    private List<String> includePatterns = List.of(
            "*.pdf", "*.doc", "*.docx", "*.odt", "*.rtf",
            "*.txt", "*.md", "*.html"
    );
    private List<String> excludePatterns = List.of(
            "**/node_modules/**", "**/.git/**",
            "**/target/**", "**/build/**"
    );
    private long maxContentLength = -1;
    private boolean detectLanguage = true;
    private int threadPoolSize = 4;

    ApplicationConfig(final UnaryOperator<String> environment, final UnaryOperator<String> systemProperties) {
        this.environment = environment;
        this.systemProperties = systemProperties;
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        return load(System::getenv, System::getProperty, getUserConfigPath());
    }

    static ApplicationConfig load(final UnaryOperator<String> environment,
                                  final UnaryOperator<String> systemProperties,
                                  final Path userConfigPath) {
        final ApplicationConfig config = new ApplicationConfig(environment, systemProperties);

        config.loadFromClasspath();
        config.loadFromFile(userConfigPath);
        config.applyOverrides();

        logger.debug("Configuration loaded: language={}, topN={}, modelDirectory={}, stopwordDirectory={}",
                config.language, config.topN, config.modelDirectory, config.stopwordDirectory);
        return config;
    }

    /**
     * Configuration from the classpath defaults only, ignoring user file, environment and system properties.
     */
    public static ApplicationConfig defaults() {
        final ApplicationConfig config = new ApplicationConfig(name -> null, name -> null);
        config.loadFromClasspath();
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                applyYaml(is);
                logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromFile(final Path configPath) {
        if (Files.exists(configPath)) {
            try (final InputStream is = Files.newInputStream(configPath)) {
                applyYaml(is);
                logger.debug("Loaded user config from: {}", configPath);
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", configPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYaml(final InputStream is) {
        final Map<String, Object> config = new Yaml().load(is);
        if (config == null) {
            return;
        }
        final Map<String, Object> root = (Map<String, Object>) config.get("textmetrics");
        if (root == null) {
            return;
        }

        final Map<String, Object> analysis = (Map<String, Object>) root.get("analysis");
        if (analysis != null) {
            if (analysis.get("language") != null) {
                this.language = resolveVariables(analysis.get("language").toString());
            }
            if (analysis.containsKey("top-n")) {
                this.topN = ((Number) analysis.get("top-n")).intValue();
            }
            if (analysis.get("keywords") instanceof List<?> list) {
                this.keywords = new ArrayList<>((List<String>) list);
            }
        }

        final Map<String, Object> resources = (Map<String, Object>) root.get("resources");
        if (resources != null) {
            if (resources.containsKey("model-directory")) {
                this.modelDirectory = blankToNull(resolve(resources.get("model-directory")));
            }
            if (resources.containsKey("stopword-directory")) {
                this.stopwordDirectory = blankToNull(resolve(resources.get("stopword-directory")));
            }
        }

        final Map<String, Object> ingest = (Map<String, Object>) root.get("ingest");
        if (ingest != null) {
            if (ingest.get("include-patterns") instanceof List<?> list) {
                this.includePatterns = new ArrayList<>((List<String>) list);
            }
            if (ingest.get("exclude-patterns") instanceof List<?> list) {
                this.excludePatterns = new ArrayList<>((List<String>) list);
            }
            if (ingest.containsKey("max-content-length")) {
                this.maxContentLength = ((Number) ingest.get("max-content-length")).longValue();
            }
            if (ingest.containsKey("detect-language")) {
                this.detectLanguage = (Boolean) ingest.get("detect-language");
            }
            if (ingest.containsKey("thread-pool-size")) {
                this.threadPoolSize = ((Number) ingest.get("thread-pool-size")).intValue();
            }
        }
    }

    private void applyOverrides() {
        // System properties first, environment variables win over them
        final String propLanguage = systemProperties.apply(PROP_LANGUAGE);
        if (propLanguage != null && !propLanguage.isBlank()) {
            this.language = propLanguage.trim();
        }

        final String envLanguage = environment.apply(ENV_LANGUAGE);
        if (envLanguage != null && !envLanguage.isBlank()) {
            this.language = envLanguage.trim();
            logger.debug("Language from environment: {}", this.language);
        }
        final String envModelDir = environment.apply(ENV_MODEL_DIR);
        if (envModelDir != null && !envModelDir.isBlank()) {
            this.modelDirectory = envModelDir.trim();
        }
        final String envStopwordDir = environment.apply(ENV_STOPWORD_DIR);
        if (envStopwordDir != null && !envStopwordDir.isBlank()) {
            this.stopwordDirectory = envStopwordDir.trim();
        }
    }

    private @Nullable String resolve(final @Nullable Object value) {
        return value == null ? null : resolveVariables(value.toString());
    }

    private static @Nullable String blankToNull(final @Nullable String value) {
        return value == null || value.isBlank() ? null : value;
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    String resolveVariables(final String value) {
        if (!value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String[] parts = result.substring(start + 2, end).split(":", 2);
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            String replacement = environment.apply(parts[0]);
            if (replacement == null || replacement.isEmpty()) {
                replacement = systemProperties.apply(parts[0]);
            }
            if (replacement == null) {
                replacement = defaultValue;
            }
            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return getConfigDirectory().resolve(USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    public String getLanguage() {
        return language;
    }

    public int getTopN() {
        return topN;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public @Nullable Path getModelDirectory() {
        return modelDirectory == null ? null : Paths.get(modelDirectory);
    }

    public @Nullable Path getStopwordDirectory() {
        return stopwordDirectory == null ? null : Paths.get(stopwordDirectory);
    }

    public List<String> getIncludePatterns() {
        return includePatterns;
    }

    public List<String> getExcludePatterns() {
        return excludePatterns;
    }

    public long getMaxContentLength() {
        return maxContentLength;
    }

    public boolean isDetectLanguage() {
        return detectLanguage;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }
}

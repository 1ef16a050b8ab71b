package de.mirkosertic.textmetrics.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Switches logging between the default stderr configuration (logback.xml) and a rolling log file
 * under ~/.textmetrics/log (logback-file.xml).
 * <p>
 * Must be called before the first analysis runs.
 */
public final class LoggingConfigurator {

    private static final String FILE_CONFIG = "logback-file.xml";

    private LoggingConfigurator() {
    }

    /**
     * @param logToFile true to write the log to ~/.textmetrics/log instead of stderr
     * @param verbose   true to lower the level of the application loggers to DEBUG
     */
    public static void configure(final boolean logToFile, final boolean verbose) {
        if (logToFile) {
            ensureLogDirectoryExists();
            loadConfiguration(FILE_CONFIG);
        }
        if (verbose) {
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            context.getLogger("de.mirkosertic.textmetrics").setLevel(Level.DEBUG);
        }
    }

    public static Path getLogDirectory() {
        return ApplicationConfig.getConfigDirectory().resolve("log");
    }

    private static void ensureLogDirectoryExists() {
        final Path logDir = getLogDirectory();
        try {
            Files.createDirectories(logDir);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory: " + logDir);
        }
    }

    private static void loadConfiguration(final String configFile) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try (InputStream configStream = LoggingConfigurator.class.getClassLoader().getResourceAsStream(configFile)) {
            if (configStream == null) {
                System.err.println("Warning: Could not find " + configFile + " on classpath");
                return;
            }
            context.reset();
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(configStream);
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Error loading logback configuration: " + e.getMessage());
        }
    }
}

package de.mirkosertic.textmetrics.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build time from the Maven-filtered build-info.properties, "dev"/"unknown" when
 * running from an IDE.
 */
public final class BuildInfo {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    private static final String BUILD_INFO_FILE = "build-info.properties";

    private static final String version;
    private static final String buildTimestamp;

    static {
        final Properties props = new Properties();
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(BUILD_INFO_FILE)) {
            if (input != null) {
                props.load(input);
            } else {
                logger.debug("{} not found, running unpackaged", BUILD_INFO_FILE);
            }
        } catch (final IOException e) {
            logger.warn("Failed to read {}", BUILD_INFO_FILE, e);
        }
        version = unfiltered(props.getProperty("build.version")) ? "dev" : props.getProperty("build.version");
        buildTimestamp = unfiltered(props.getProperty("build.timestamp")) ? "unknown" : props.getProperty("build.timestamp");
    }

    private BuildInfo() {
    }

    private static boolean unfiltered(final String value) {
        return value == null || value.isBlank() || value.startsWith("${");
    }

    public static String getVersion() {
        return version;
    }

    public static String getBuildTimestamp() {
        return buildTimestamp;
    }
}

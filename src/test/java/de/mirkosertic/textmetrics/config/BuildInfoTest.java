package de.mirkosertic.textmetrics.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BuildInfo Tests")
class BuildInfoTest {

    @Test
    @DisplayName("Should load version and timestamp")
    void shouldLoadVersionAndTimestamp() {
        // Version is the Maven version when filtered, "dev" otherwise
        assertThat(BuildInfo.getVersion())
                .isNotEmpty()
                .matches("^(\\d+\\.\\d+\\.\\d+.*|dev)$");

        // Timestamp is ISO formatted when filtered, "unknown" otherwise
        assertThat(BuildInfo.getBuildTimestamp())
                .isNotEmpty()
                .matches("^(\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}Z|unknown)$");
    }
}

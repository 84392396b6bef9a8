package org.zerox.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.zerox.junit.extensions.logging.AllowLog;
import org.zerox.junit.extensions.logging.FailOnLog;
import org.zerox.junit.extensions.logging.LogLevel;
import org.zerox.junit.extensions.logging.LogWatchExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the layered configuration loading of {@link ConfigLoader}.
 */
@ExtendWith(LogWatchExtension.class)
@FailOnLog(level = LogLevel.INFO)
@AllowLog(level = LogLevel.INFO, loggerPattern = "org\\.zerox\\.config\\.ConfigLoader",
        messagePattern = "Loading configuration from file: .*zerox\\.conf")
public class ConfigLoaderTest {

    /**
     * Verifies that the defaults come from reference.conf.
     */
    @Test
    @Tag("unit")
    void loadsReferenceDefaults() {
        // Act
        Config config = ConfigLoader.loadDefaults();

        // Assert
        assertThat(config.getInt("zerox.compiler.lexer.tab-width")).isEqualTo(2);
        assertThat(config.getInt("zerox.compiler.suggestion.max-distance")).isEqualTo(2);
        assertThat(config.getBoolean("zerox.compiler.warnings-as-errors")).isFalse();
        assertThat(config.getString("logging.default-level")).isEqualTo("WARN");
    }

    /**
     * Verifies that a user file overrides single keys and keeps the remaining defaults.
     */
    @Test
    @Tag("unit")
    void fileOverridesDefaults(@TempDir Path directory) throws IOException {
        // Arrange
        Path file = directory.resolve("zerox.conf");
        Files.writeString(file, "zerox.compiler.lexer.tab-width = 4\n");

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        assertThat(config.getInt("zerox.compiler.lexer.tab-width")).isEqualTo(4);
        assertThat(config.getInt("zerox.compiler.suggestion.max-distance")).isEqualTo(2);
    }

    /**
     * Verifies that system properties take precedence over the user file.
     */
    @Test
    @Tag("unit")
    void systemPropertiesOverrideFile(@TempDir Path directory) throws IOException {
        // Arrange
        Path file = directory.resolve("zerox.conf");
        Files.writeString(file, "zerox.compiler.suggestion.max-distance = 1\n");
        System.setProperty("zerox.compiler.suggestion.max-distance", "3");
        ConfigFactory.invalidateCaches();

        try {
            // Act
            Config config = ConfigLoader.load(file);

            // Assert
            assertThat(config.getInt("zerox.compiler.suggestion.max-distance")).isEqualTo(3);
        } finally {
            System.clearProperty("zerox.compiler.suggestion.max-distance");
            ConfigFactory.invalidateCaches();
        }
    }

    /**
     * Verifies that a missing file is reported instead of silently falling back to the defaults.
     */
    @Test
    @Tag("unit")
    void missingFileIsRejected(@TempDir Path directory) {
        Path missing = directory.resolve("absent.conf");

        assertThatThrownBy(() -> ConfigLoader.load(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Configuration file not found: ");
    }
}

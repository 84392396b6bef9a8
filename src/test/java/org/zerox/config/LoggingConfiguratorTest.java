package org.zerox.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zerox.junit.extensions.logging.ExpectLog;
import org.zerox.junit.extensions.logging.LogLevel;
import org.zerox.junit.extensions.logging.LogWatchExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for the LoggingConfigurator class.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LoggingConfiguratorTest {

    private static final String TEST_LOGGER = "org.zerox.test";

    private LoggerContext context;
    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        originalRootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger(TEST_LOGGER).setLevel(null);
        context.getLogger("org.zerox.noisy").setLevel(null);
    }

    /**
     * The default level is applied to the root logger and named levels to their loggers.
     */
    @Test
    void configure_withLevels_shouldSetRootAndLoggerLevels() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "INFO"
              levels {
                "org.zerox.test" = "DEBUG"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals(Level.INFO, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.DEBUG, context.getLogger(TEST_LOGGER).getLevel());
    }

    /**
     * An unparseable default level falls back to WARN.
     */
    @Test
    void configure_withInvalidDefaultLevel_shouldFallBackToWarn() {
        // Given
        final Config config = ConfigFactory.parseString("logging.default-level = \"CHATTY\"");

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals(Level.WARN, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    /**
     * An unknown logger level is skipped with a warning.
     */
    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = "org\\.zerox\\.config\\.LoggingConfigurator",
            messagePattern = "Ignoring unknown level 'LOUD' for logger 'org\\.zerox\\.noisy'")
    void configure_withUnknownLoggerLevel_shouldWarnAndSkip() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "INFO"
              levels {
                "org.zerox.noisy" = "LOUD"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertNull(context.getLogger("org.zerox.noisy").getLevel());
    }

    /**
     * A configuration without a logging section leaves the levels untouched.
     */
    @Test
    void configure_withoutLoggingConfig_shouldUseDefaults() {
        // Given
        final Config config = ConfigFactory.parseString("""
            other {
              some-value = "test"
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals(originalRootLevel, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    /**
     * Only the first configuration is applied until the configurator is reset.
     */
    @Test
    void configure_calledMultipleTimes_shouldBeIdempotent() {
        // Given
        final Config first = ConfigFactory.parseString("logging.default-level = \"INFO\"");
        final Config second = ConfigFactory.parseString("logging.default-level = \"ERROR\"");

        // When
        LoggingConfigurator.configure(first);
        LoggingConfigurator.configure(second);

        // Then
        assertEquals(Level.INFO, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }
}

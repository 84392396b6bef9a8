package org.zerox.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Configures the logging system based on HOCON configuration.
 * This class reads logging settings from the configuration and applies them
 * to the Logback logging framework at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   default-level = "WARN"  # Default log level for all loggers
 *   levels {
 *     # Specific logger levels - override the default for particular components
 *     "org.zerox.compiler.frontend.parser" = "DEBUG"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {
    }

    /**
     * Configures the logging system based on the provided configuration.
     * This method is idempotent - calling it multiple times has no additional effect.
     *
     * @param config The configuration containing logging settings.
     */
    public static synchronized void configure(final Config config) {
        if (loggingConfigured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }
        loggingConfigured = true;

        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            return;
        }

        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            LOGGER.warn("Logback is not the active SLF4J backend, ignoring the logging configuration.");
            return;
        }

        final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
        configureDefaultLevel(loggingConfig, context);
        configureSpecificLevels(loggingConfig, context);
        LOGGER.debug("Logging configuration applied successfully.");
    }

    /**
     * Configures the default log level for all loggers.
     */
    private static void configureDefaultLevel(final Config loggingConfig, final LoggerContext context) {
        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.WARN);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOGGER.debug("Configured default log level: {}", level);
        }
    }

    /**
     * Configures specific logger levels as defined in the configuration.
     */
    private static void configureSpecificLevels(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(LEVELS_KEY)) {
            return;
        }

        int configuredCount = 0;
        for (final Map.Entry<String, ConfigValue> entry : loggingConfig.getConfig(LEVELS_KEY).root().entrySet()) {
            final String loggerName = entry.getKey();
            final String levelName = String.valueOf(entry.getValue().unwrapped());
            final Level level = Level.toLevel(levelName, null);
            if (level == null) {
                LOGGER.warn("Ignoring unknown level '{}' for logger '{}'", levelName, loggerName);
                continue;
            }
            context.getLogger(loggerName).setLevel(level);
            configuredCount++;
        }
        LOGGER.debug("Configured {} specific logger levels.", configuredCount);
    }

    /**
     * Resets the logging configuration state. This is primarily useful for testing.
     * In production, this method should not be called after the initial configuration.
     */
    public static synchronized void reset() {
        loggingConfigured = false;
    }
}

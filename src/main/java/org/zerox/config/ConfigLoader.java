package org.zerox.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Responsible for loading the compiler configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. Java System Properties ({@code -Dzerox.compiler.lexer.tab-width=4})
     * 3. The given configuration file, if any
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param configFile An optional HOCON file; {@code null} to use the defaults only.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws IllegalArgumentException if {@code configFile} does not exist or is a directory.
     * @throws com.typesafe.config.ConfigException if a source cannot be parsed or resolved.
     */
    public static Config load(Path configFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config propertiesConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (configFile == null) {
            fileConfig = ConfigFactory.empty();
        } else if (!Files.isRegularFile(configFile)) {
            throw new IllegalArgumentException("Configuration file not found: " + configFile.toAbsolutePath());
        } else {
            LOG.info("Loading configuration from file: {}", configFile.toAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile.toFile());
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return envConfig
                .withFallback(propertiesConfig)
                .withFallback(fileConfig)
                .withFallback(defaultConfig)
                .resolve();
    }

    /**
     * Loads the configuration without a user file.
     * @return The resolved defaults merged with environment and system property overrides.
     */
    public static Config loadDefaults() {
        return load(null);
    }
}

package org.kal.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the compiler configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "kal.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration with {@code kal.conf} from the working directory as the file layer, if present.
     *
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load() {
        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        if (cwdConfigFile.exists() && !cwdConfigFile.isDirectory()) {
            LOG.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
            return merge(ConfigFactory.parseFile(cwdConfigFile));
        }
        LOG.debug("Configuration file '{}' not found. Using default configuration from classpath.", CONFIG_FILE_NAME);
        return merge(ConfigFactory.empty());
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Java System Properties (e.g., -Dkal.repl.prompt=...)
     * 2. Environment Variables
     * 3. The given configuration file
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param configFile The configuration file; {@code null} falls back to {@link #load()}.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws IllegalArgumentException if the given file does not exist.
     */
    public static Config load(final File configFile) {
        if (configFile == null) {
            return load();
        }
        if (!configFile.exists() || configFile.isDirectory()) {
            throw new IllegalArgumentException("Configuration file was not found: " + configFile.getAbsolutePath());
        }
        LOG.info("Using configuration file: {}", configFile.getAbsolutePath());
        return merge(ConfigFactory.parseFile(configFile));
    }

    private static Config merge(final Config fileConfig) {
        // Default values from reference.conf in the classpath (lowest precedence).
        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        final Config combinedConfig = ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(fileConfig)
            .withFallback(defaultConfig);

        return combinedConfig.resolve();
    }
}

package org.minimips.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the application configuration from its layered sources.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * The configuration file looked up in the working directory when none is given.
     */
    public static final String CONFIG_FILE_NAME = "minimips.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. CLI arguments (as Java System Properties, e.g., -Dminimips.runtime.max-steps=500)
     * 2. Environment Variables
     * 3. Configuration file (the given file, or minimips.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param configFile An explicit configuration file, or {@code null} to look for
     *                   {@value #CONFIG_FILE_NAME} in the working directory.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or an explicit
     *         file does not exist.
     */
    public static Config load(final File configFile) {
        final Config fileConfig;
        if (configFile != null) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile,
                    com.typesafe.config.ConfigParseOptions.defaults().setAllowMissing(false));
        } else {
            final File cwdConfig = new File(CONFIG_FILE_NAME);
            if (cwdConfig.exists() && !cwdConfig.isDirectory()) {
                LOG.info("Loading configuration from file: {}", cwdConfig.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(cwdConfig);
            } else {
                LOG.debug("Configuration file '{}' not found. Using defaults.", CONFIG_FILE_NAME);
                fileConfig = ConfigFactory.empty();
            }
        }
        return layer(fileConfig);
    }

    /**
     * Loads the configuration with a classpath resource in place of the configuration file.
     *
     * @param resourceName The resource name, e.g. {@code org/minimips/config/test.conf}.
     * @return The resolved configuration.
     */
    public static Config loadResource(final String resourceName) {
        return layer(ConfigFactory.parseResources(resourceName));
    }

    private static Config layer(final Config fileConfig) {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
    }
}

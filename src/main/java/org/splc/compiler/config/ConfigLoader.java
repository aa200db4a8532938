package org.splc.compiler.config;

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
    private static final String CONFIG_FILE_NAME = "splc.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. Java System Properties (-Dkey=value)
     * 3. Configuration File (splc.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load() {
        final File configFile = new File(CONFIG_FILE_NAME);
        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found, using defaults.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        // The one provided first wins.
        return ConfigFactory.systemEnvironment()
            .withFallback(ConfigFactory.systemProperties())
            .withFallback(fileConfig)
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();
    }

    /**
     * Loads a configuration from a classpath resource layered over the defaults. System
     * properties still take precedence; environment variables are not consulted.
     *
     * @param resource The classpath resource name, e.g. {@code "org/splc/compiler/config/test-compiler.conf"}.
     * @return A resolved {@link Config}.
     */
    public static Config load(final String resource) {
        final Config resourceConfig = ConfigFactory.parseResources(resource);
        if (resourceConfig.isEmpty()) {
            LOG.warn("Configuration resource '{}' not found or empty, using defaults.", resource);
        }
        return ConfigFactory.systemProperties()
            .withFallback(resourceConfig)
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();
    }
}

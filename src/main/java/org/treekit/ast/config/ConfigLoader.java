package org.treekit.ast.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the toolkit configuration from layered sources.
 * The loader respects a specific precedence order so that defaults can be overridden per run.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Name of the optional configuration file looked up in the working directory. */
    public static final String CONFIG_FILE_NAME = "treekit.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration using the default file name {@value #CONFIG_FILE_NAME}.
     *
     * @return A resolved {@link Config} containing the merged configuration.
     * @see #load(String)
     */
    public static Config load() {
        return load(CONFIG_FILE_NAME);
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. JVM system properties (e.g., -Dtreekit.pool.integer.max=255)
     * 2. The configuration file, looked up in the file system first and on the classpath second
     * 3. Default values (from reference.conf on the classpath)
     *
     * @param fileName The configuration file name or path.
     * @return A resolved {@link Config} containing the merged configuration.
     */
    public static Config load(String fileName) {
        final Config systemConfig = ConfigFactory.systemProperties();
        final Config fileConfig = loadFile(fileName);
        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return systemConfig
                .withFallback(fileConfig)
                .withFallback(defaultConfig)
                .resolve();
    }

    private static Config loadFile(String fileName) {
        final File configFile = new File(fileName);
        if (configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            return ConfigFactory.parseFile(configFile);
        }
        final Config resourceConfig = ConfigFactory.parseResources(fileName);
        if (!resourceConfig.isEmpty()) {
            LOG.info("Loading configuration from classpath resource: {}", fileName);
            return resourceConfig;
        }
        LOG.info("Configuration file '{}' not found or is empty. Using defaults.", fileName);
        return ConfigFactory.empty();
    }
}

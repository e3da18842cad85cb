package org.irlens.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.irlens.compare.CompareOptions;
import org.irlens.render.RenderConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads irlens settings from various sources.
 * The loader respects a specific precedence order so that a single run can be tuned without
 * touching code.
 */
public final class IrLensConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(IrLensConfigLoader.class);
    private static final String CONFIG_FILE_NAME = "irlens.conf";
    public static final String RENDER_PATH = "irlens.render";
    public static final String COMPARE_PATH = "irlens.compare";

    private IrLensConfigLoader() {}

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment variables
     * 2. Java system properties, e.g. {@code -Dirlens.render.line-width=80}
     * 3. {@code irlens.conf} in the working directory
     * 4. Defaults from {@code reference.conf} on the classpath
     *
     * @return The merged and resolved configuration.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Same as {@link #load()} but reads the file layer from the given file.
     *
     * @param configFile The optional configuration file; skipped if it does not exist.
     * @return The merged and resolved configuration.
     */
    public static Config load(File configFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config propertyConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            log.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            log.debug("Configuration file '{}' not found. Using defaults.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return envConfig
                .withFallback(propertyConfig)
                .withFallback(fileConfig)
                .withFallback(defaultConfig)
                .resolve();
    }

    public static RenderConfig renderConfig(Config config) {
        return RenderConfig.fromConfig(config.getConfig(RENDER_PATH));
    }

    public static CompareOptions compareOptions(Config config) {
        return CompareOptions.fromConfig(config.getConfig(COMPARE_PATH));
    }
}

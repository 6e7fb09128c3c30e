package com.chauhraj.kdbtick.config;

import java.io.File;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

public class ConfigurationLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationLoader.class);

    static final String CONNECTION_PATH = "kdbtick.connection";
    static final String ENVIRONMENT_FILE = "config/environment.conf";

    private final Config config;

    public ConfigurationLoader() {
        this(new File(ENVIRONMENT_FILE));
    }

    ConfigurationLoader(File envConfig) {
        // Load configurations in order of precedence (lowest to highest)
        Config defaults = ConfigFactory.parseResources("defaults.conf");

        // Load environment specific config if it exists
        Config environment = ConfigFactory.empty();
        if (envConfig.exists()) {
            logger.info("Loading environment configuration from {}", envConfig);
            environment = ConfigFactory.parseFile(envConfig);
        }

        // System properties have highest precedence
        Config system = ConfigFactory.systemProperties();

        this.config = system
            .withFallback(environment)
            .withFallback(defaults)
            .resolve();
    }

    /**
     * Connection settings under {@code kdbtick.connection}.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type
     */
    public ConnectionSettings getSettings() {
        return ConnectionSettings.fromConfig(config.getConfig(CONNECTION_PATH));
    }

    public Config getConfig() {
        return config;
    }
}

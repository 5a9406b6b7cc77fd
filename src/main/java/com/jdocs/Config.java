package com.jdocs;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jdocs.model.JDocsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Configuration management - loads ~/.jdocs/config.json and resolves settings from
 * command-line value, environment variable, config file and default, in that order.
 */
public final class Config {

    private static final Logger log = LoggerFactory.getLogger(Config.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String ENV_BASE_URL = "LOCAL_LLM_BASE_URL";
    public static final String ENV_MODEL = "LOCAL_LLM_MODEL";
    public static final String ENV_API_KEY = "LOCAL_LLM_API_KEY";
    public static final String ENV_SERVER_COMMAND = "JDOCS_SERVER_COMMAND";

    public static final String DEFAULT_BASE_URL = "http://localhost:1234/v1";

    private Config() {}

    public static Path getConfigDir() {
        return Path.of(System.getProperty("user.home"), ".jdocs");
    }

    public static Path getConfigPath() {
        return getConfigDir().resolve("config.json");
    }

    public static JDocsConfig loadConfig() {
        return loadConfig(getConfigPath());
    }

    static JDocsConfig loadConfig(Path configPath) {
        if (Files.exists(configPath)) {
            try {
                return MAPPER.readValue(configPath.toFile(), JDocsConfig.class);
            } catch (IOException e) {
                log.warn("Ignoring unreadable config {}: {}", configPath, e.getMessage());
                return new JDocsConfig();
            }
        }
        return new JDocsConfig();
    }

    /**
     * First non-blank of option, environment variable, config value; otherwise the default.
     */
    static String resolve(String option, Map<String, String> env, String envName, String configValue,
                          String defaultValue) {
        if (option != null && !option.isBlank()) return option;
        String fromEnv = env.get(envName);
        if (fromEnv != null && !fromEnv.isBlank()) return fromEnv;
        if (configValue != null && !configValue.isBlank()) return configValue;
        return defaultValue;
    }
}

package com.vyperformatter.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vyperformatter.util.LoggerUtil;

/**
 * Reads {@code .vyperformatter.yml} files. Anything missing or out of range falls back
 * to the bundled defaults with a warning; a broken file falls back entirely.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";

    public static final String CONFIG_FILE_NAME = ".vyperformatter.yml";
    public static final int DEFAULT_LINE_LENGTH = 80;
    public static final int MIN_LINE_LENGTH = 10;
    public static final int MAX_LINE_LENGTH = 500;

    private static FormatterConfig _cachedDefaultConfig = null;

    public static FormatterConfig loadConfig(Path configPath) {
        if (configPath == null) {
            logger.fine("No config path provided, using default configuration");
            return loadDefaultConfig();
        }

        if (!Files.exists(configPath)) {
            logger.fine("Configuration file not found: " + configPath + ", using default configuration");
            return loadDefaultConfig();
        }

        try {
            logger.info("Loading configuration from: " + configPath);

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(configPath.toFile(), Map.class);
            if (config == null) {
                logger.warning("Configuration file is empty: " + configPath + ", using default configuration");
                return loadDefaultConfig();
            }

            return _createConfigFromMap(config);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Error parsing configuration file: " + e.getMessage(), e);
            logger.info("Falling back to default configuration");
            return loadDefaultConfig();
        }
    }

    /**
     * Loads the bundled default configuration once.
     */
    public static synchronized FormatterConfig loadDefaultConfig() {
        if (_cachedDefaultConfig != null) {
            return _cachedDefaultConfig;
        }

        try (InputStream defaultConfigStream =
                     ConfigurationLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {

            if (defaultConfigStream == null) {
                logger.severe("Default configuration resource not found: " + DEFAULT_CONFIG_RESOURCE);
                return _createEmptyConfig();
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(defaultConfigStream, Map.class);

            _cachedDefaultConfig = _createConfigFromMap(config);
            logger.fine("Default configuration loaded");

            return _cachedDefaultConfig;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load default configuration", e);
            return _createEmptyConfig();
        }
    }

    @SuppressWarnings("unchecked")
    private static FormatterConfig _createConfigFromMap(Map<String, Object> config) {
        Map<String, Object> generalConfig = new HashMap<>();
        if (config.get("general") instanceof Map) {
            generalConfig = new HashMap<>((Map<String, Object>) config.get("general"));
        } else {
            logger.warning("Missing or invalid 'general' section in config, using defaults");
        }

        _validateIntRange(generalConfig, FormatterConfig.LINE_LENGTH, MIN_LINE_LENGTH, MAX_LINE_LENGTH);
        _ensureDefaultGeneralConfig(generalConfig);

        return new FormatterConfig(generalConfig);
    }

    private static void _validateIntRange(Map<String, Object> config, String key, int min, int max) {
        if (config.get(key) instanceof Number) {
            int value = ((Number) config.get(key)).intValue();
            if (value < min || value > max) {
                logger.warning("Configuration value '" + key + "' is outside acceptable range " +
                        "(" + min + "-" + max + "). Using default value.");
                config.remove(key);
            }
        } else if (config.containsKey(key)) {
            logger.warning("Configuration value '" + key + "' is not a number. Using default value.");
            config.remove(key);
        }
    }

    private static FormatterConfig _createEmptyConfig() {
        Map<String, Object> generalConfig = new HashMap<>();
        _ensureDefaultGeneralConfig(generalConfig);
        return new FormatterConfig(generalConfig);
    }

    private static void _ensureDefaultGeneralConfig(Map<String, Object> generalConfig) {
        if (!(generalConfig.get(FormatterConfig.LINE_LENGTH) instanceof Number)) {
            generalConfig.put(FormatterConfig.LINE_LENGTH, DEFAULT_LINE_LENGTH);
        }
        if (!(generalConfig.get(FormatterConfig.SAFETY_CHECK) instanceof Boolean)) {
            _warnIfPresent(generalConfig, FormatterConfig.SAFETY_CHECK);
            generalConfig.put(FormatterConfig.SAFETY_CHECK, true);
        }
        if (!(generalConfig.get(FormatterConfig.FALLBACK_TO_ORIGINAL) instanceof Boolean)) {
            _warnIfPresent(generalConfig, FormatterConfig.FALLBACK_TO_ORIGINAL);
            generalConfig.put(FormatterConfig.FALLBACK_TO_ORIGINAL, true);
        }
        if (!(generalConfig.get(FormatterConfig.IGNORE_FILES) instanceof List)) {
            _warnIfPresent(generalConfig, FormatterConfig.IGNORE_FILES);
            generalConfig.put(FormatterConfig.IGNORE_FILES, new ArrayList<String>());
        }
    }

    private static void _warnIfPresent(Map<String, Object> generalConfig, String key) {
        if (generalConfig.containsKey(key)) {
            logger.warning("Invalid value for '" + key + "' in config, using default");
        }
    }

    public static void saveConfig(FormatterConfig config, Path configPath) throws IOException {
        try {
            Path parent = configPath.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }

            Map<String, Object> configMap = new LinkedHashMap<>();
            configMap.put("general", config.getGeneralConfigMap());

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.writeValue(configPath.toFile(), configMap);

            logger.info("Configuration saved to: " + configPath);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to save configuration to: " + configPath, e);
            throw e;
        }
    }
}

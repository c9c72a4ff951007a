package com.templateformatter.config;

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
import com.templateformatter.format.FormatHelpers;
import com.templateformatter.util.LoggerUtil;

/**
 * Loads {@code .template-formatter.yml} files, falling back to the bundled defaults.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";

    public static final String CONFIG_FILE_NAME = ".template-formatter.yml";

    private static FormatterConfig _cachedDefaultConfig = null;

    /**
     * Loads configuration from a file with fallback to defaults.
     */
    public static FormatterConfig loadConfig(Path configPath) {
        if (configPath == null) {
            logger.fine("No config path provided, using default configuration");
            return loadDefaultConfig();
        }

        if (!Files.exists(configPath)) {
            logger.warning("Configuration file not found: " + configPath + ", using default configuration");
            return loadDefaultConfig();
        }

        try {
            logger.info("Loading configuration from: " + configPath);

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(configPath.toFile(), Map.class);

            FormatterConfig formatterConfig = _createConfigFromMap(config == null ? new HashMap<>() : config);
            logger.info("Configuration loaded successfully with " +
                    formatterConfig.getRuleSwitches().size() + " rule switches");

            return formatterConfig;
        } catch (IOException | RuntimeException e) {
            logger.log(Level.WARNING, "Error parsing configuration file: " + e.getMessage(), e);
            logger.info("Falling back to default configuration");
            return loadDefaultConfig();
        }
    }

    /**
     * Loads the embedded default configuration with caching.
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
            logger.fine("Default configuration loaded successfully");

            return _cachedDefaultConfig;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load default configuration", e);
            return _createEmptyConfig();
        }
    }

    /**
     * Looks for a configuration file in {@code directory} and its parents.
     */
    public static Path findConfig(Path directory) {
        Path current = directory == null ? null : directory.toAbsolutePath();
        while (current != null) {
            Path candidate = current.resolve(CONFIG_FILE_NAME);
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
            current = current.getParent();
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private static FormatterConfig _createConfigFromMap(Map<String, Object> config) {
        Map<String, Object> formatterConfig = new LinkedHashMap<>();
        if (config.get("formatter") instanceof Map) {
            formatterConfig.putAll((Map<String, Object>) config.get("formatter"));
        } else if (config.containsKey("formatter")) {
            logger.warning("Invalid 'formatter' section in config, using defaults");
        }

        Map<String, Object> linterConfig = new LinkedHashMap<>();
        if (config.get("linter") instanceof Map) {
            linterConfig.putAll((Map<String, Object>) config.get("linter"));
        } else if (config.containsKey("linter")) {
            logger.warning("Invalid 'linter' section in config, using defaults");
        }

        _validateConfigurationValues(formatterConfig);
        _ensureDefaultFormatterConfig(formatterConfig);
        _ensureDefaultLinterConfig(linterConfig);

        return new FormatterConfig(formatterConfig, linterConfig);
    }

    /**
     * Validates configuration values to ensure they are within acceptable ranges.
     */
    private static void _validateConfigurationValues(Map<String, Object> formatterConfig) {
        _validateIntRange(formatterConfig, "indentWidth", 1, 8);
        _validateIntRange(formatterConfig, "maxLineLength", 40, 200);
    }

    /**
     * Validates that an integer configuration value is within the specified range.
     */
    private static void _validateIntRange(Map<String, Object> config, String key, int min, int max) {
        if (config.containsKey(key) && config.get(key) instanceof Number) {
            int value = ((Number) config.get(key)).intValue();
            if (value < min || value > max) {
                logger.warning("Configuration value '" + key + "' is outside acceptable range " +
                        "(" + min + "-" + max + "). Using default value.");
                config.remove(key);
            }
        }
    }

    private static FormatterConfig _createEmptyConfig() {
        Map<String, Object> formatterConfig = new LinkedHashMap<>();
        _ensureDefaultFormatterConfig(formatterConfig);

        Map<String, Object> linterConfig = new LinkedHashMap<>();
        _ensureDefaultLinterConfig(linterConfig);

        return new FormatterConfig(formatterConfig, linterConfig);
    }

    private static void _ensureDefaultFormatterConfig(Map<String, Object> formatterConfig) {
        if (!(formatterConfig.get("indentWidth") instanceof Number)) {
            formatterConfig.put("indentWidth", 2);
        }
        if (!(formatterConfig.get("maxLineLength") instanceof Number)) {
            formatterConfig.put("maxLineLength", 80);
        }
        if (!(formatterConfig.get("inlineElements") instanceof List)) {
            formatterConfig.put("inlineElements", new ArrayList<>(FormatHelpers.INLINE_ELEMENTS));
        }
        if (!(formatterConfig.get("voidElements") instanceof List)) {
            formatterConfig.put("voidElements", new ArrayList<>(FormatHelpers.VOID_ELEMENTS));
        }
        if (!(formatterConfig.get("contentPreservingElements") instanceof List)) {
            formatterConfig.put("contentPreservingElements",
                    new ArrayList<>(FormatHelpers.CONTENT_PRESERVING_ELEMENTS));
        }
        if (!(formatterConfig.get("rewriters") instanceof Map)) {
            Map<String, Object> rewriters = new LinkedHashMap<>();
            rewriters.put("pre", new ArrayList<String>());
            rewriters.put("post", new ArrayList<String>());
            formatterConfig.put("rewriters", rewriters);
        }
    }

    private static void _ensureDefaultLinterConfig(Map<String, Object> linterConfig) {
        if (!(linterConfig.get("unsafeFixes") instanceof Boolean)) {
            linterConfig.put("unsafeFixes", false);
        }
        if (!(linterConfig.get("rules") instanceof Map)) {
            linterConfig.put("rules", new LinkedHashMap<String, Object>());
        }
    }

    /**
     * Saves configuration to a file.
     */
    public static void saveConfig(FormatterConfig config, Path configPath) throws IOException {
        try {
            Path parent = configPath.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }

            Map<String, Object> configMap = new LinkedHashMap<>();
            configMap.put("formatter", config.getFormatterConfigMap());
            configMap.put("linter", config.getLinterConfigMap());

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.writeValue(configPath.toFile(), configMap);

            logger.info("Configuration saved successfully to: " + configPath);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to save configuration to: " + configPath, e);
            throw e;
        }
    }
}

package com.indentlint.config;

import com.indentlint.util.LoggerUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads YAML configuration, fills in defaults and drops out-of-range values.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";
    public static final String INDENTATION_RULE = "indentation";

    private static LintConfig _cachedDefaultConfig = null;

    /**
     * Loads configuration from a file, falling back to the defaults when the file is
     * missing or unreadable.
     */
    public static LintConfig loadConfig(Path configPath) {
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
                logger.warning("Configuration file is empty: " + configPath);
                config = new HashMap<>();
            }

            LintConfig lintConfig = _createConfigFromMap(config);
            logger.info("Configuration loaded with " + lintConfig.getRuleConfigsMap().size() + " rule sections");

            return lintConfig;
        } catch (IOException e) {
            logger.log(Level.WARNING, "Error parsing configuration file: " + e.getMessage(), e);
            logger.info("Falling back to default configuration");
            return loadDefaultConfig();
        }
    }

    /**
     * Loads the embedded default configuration; the result is cached.
     */
    public static synchronized LintConfig loadDefaultConfig() {
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
    private static LintConfig _createConfigFromMap(Map<String, Object> config) {
        Map<String, Object> generalConfig = new HashMap<>();
        if (config.get("general") instanceof Map) {
            generalConfig = new HashMap<>((Map<String, Object>) config.get("general"));
        } else if (config.containsKey("general")) {
            logger.warning("Invalid 'general' section in config, using defaults");
        }

        Map<String, Map<String, Object>> ruleConfigs = new HashMap<>();
        if (config.get("rules") instanceof Map) {
            Map<String, Object> rulesMap = (Map<String, Object>) config.get("rules");

            for (Map.Entry<String, Object> entry : rulesMap.entrySet()) {
                if (entry.getValue() instanceof Map) {
                    ruleConfigs.put(entry.getKey(), new HashMap<>((Map<String, Object>) entry.getValue()));
                } else {
                    logger.warning("Invalid configuration for rule '" + entry.getKey() + "', using defaults");
                    ruleConfigs.put(entry.getKey(), new HashMap<>());
                }
            }
        } else if (config.containsKey("rules")) {
            logger.warning("Invalid 'rules' section in config, using defaults");
        }

        _validateConfigurationValues(generalConfig, ruleConfigs);

        _ensureDefaultGeneralConfig(generalConfig);
        _ensureDefaultRuleConfigs(ruleConfigs);

        return new LintConfig(generalConfig, ruleConfigs);
    }

    private static void _validateConfigurationValues(Map<String, Object> generalConfig,
                                                     Map<String, Map<String, Object>> ruleConfigs) {
        _validateIntRange(generalConfig, "tabWidth", 1, 16);
        _validateIntRange(generalConfig, "maxFixPasses", 1, 100);

        Map<String, Object> indentation = ruleConfigs.get(INDENTATION_RULE);
        if (indentation != null) {
            _validateIntRange(indentation, "basicOffset", 0, 32);
            _validateIntRange(indentation, "braceAdjustment", -16, 16);
            _validateIntRange(indentation, "caseIndent", 0, 32);
            _validateIntRange(indentation, "throwsIndent", 0, 32);
            _validateIntRange(indentation, "arrayInitIndent", 0, 32);
            _validateIntRange(indentation, "lineWrappingIndentation", 0, 32);
        }
    }

    /**
     * Removes an integer value that lies outside {@code [min, max]} so the default applies.
     */
    private static void _validateIntRange(Map<String, Object> config, String key, int min, int max) {
        if (config.containsKey(key) && !(config.get(key) instanceof Number)) {
            logger.warning("Configuration value '" + key + "' is not a number. Using default value.");
            config.remove(key);
            return;
        }
        if (config.get(key) instanceof Number) {
            int value = ((Number) config.get(key)).intValue();
            if (value < min || value > max) {
                logger.warning("Configuration value '" + key + "' is outside acceptable range " +
                        "(" + min + ".." + max + "). Using default value.");
                config.remove(key);
            }
        }
    }

    private static LintConfig _createEmptyConfig() {
        Map<String, Object> generalConfig = new HashMap<>();
        _ensureDefaultGeneralConfig(generalConfig);

        Map<String, Map<String, Object>> ruleConfigs = new HashMap<>();
        _ensureDefaultRuleConfigs(ruleConfigs);

        return new LintConfig(generalConfig, ruleConfigs);
    }

    private static void _ensureDefaultGeneralConfig(Map<String, Object> generalConfig) {
        generalConfig.putIfAbsent("tabWidth", 4);
        generalConfig.putIfAbsent("maxFixPasses", 10);
        if (!(generalConfig.get("commentSuppression") instanceof Boolean)) {
            generalConfig.put("commentSuppression", true);
        }
        if (!(generalConfig.get("ignoreFiles") instanceof List)) {
            generalConfig.put("ignoreFiles", new ArrayList<String>());
        }
    }

    private static void _ensureDefaultRuleConfigs(Map<String, Map<String, Object>> ruleConfigs) {
        Map<String, Object> indentation = ruleConfigs.computeIfAbsent(INDENTATION_RULE, k -> new HashMap<>());
        if (!(indentation.get("enabled") instanceof Boolean)) {
            indentation.put("enabled", true);
        }
        indentation.putIfAbsent("basicOffset", 4);
        indentation.putIfAbsent("braceAdjustment", 0);
        indentation.putIfAbsent("caseIndent", 4);
        indentation.putIfAbsent("throwsIndent", 4);
        indentation.putIfAbsent("arrayInitIndent", 4);
        indentation.putIfAbsent("lineWrappingIndentation", 4);
        if (!(indentation.get("forceStrictCondition") instanceof Boolean)) {
            indentation.put("forceStrictCondition", false);
        }
    }

    /**
     * Writes the configuration as YAML, creating parent directories as needed.
     */
    public static void saveConfig(LintConfig config, Path configPath) throws IOException {
        try {
            Path parent = configPath.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }

            Map<String, Object> configMap = new LinkedHashMap<>();
            configMap.put("general", new TreeMap<>(config.getGeneralConfigMap()));
            Map<String, Object> rules = new TreeMap<>();
            config.getRuleConfigsMap().forEach((rule, options) -> rules.put(rule, new TreeMap<>(options)));
            configMap.put("rules", rules);

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.writeValue(configPath.toFile(), configMap);

            logger.info("Configuration saved to: " + configPath);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to save configuration to: " + configPath, e);
            throw e;
        }
    }
}

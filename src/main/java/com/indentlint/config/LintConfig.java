package com.indentlint.config;

import java.util.HashMap;
import java.util.Map;

/**
 * Loaded configuration: a {@code general} section plus one option map per rule.
 */
public class LintConfig {
    private final Map<String, Object> generalConfig;
    private final Map<String, Map<String, Object>> ruleConfigs;

    public LintConfig(Map<String, Object> generalConfig,
                      Map<String, Map<String, Object>> ruleConfigs) {
        this.generalConfig = generalConfig;
        this.ruleConfigs = ruleConfigs;
    }

    /**
     * Gets a copy of the general config map.
     */
    public Map<String, Object> getGeneralConfigMap() {
        return new HashMap<>(generalConfig);
    }

    /**
     * Gets a deep copy of the rule configs map.
     */
    public Map<String, Map<String, Object>> getRuleConfigsMap() {
        Map<String, Map<String, Object>> result = new HashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : ruleConfigs.entrySet()) {
            result.put(entry.getKey(), new HashMap<>(entry.getValue()));
        }
        return result;
    }

    public <T> T getGeneralConfig(String key, T defaultValue) {
        return _coerce(generalConfig.get(key), defaultValue);
    }

    public <T> T getRuleConfig(String rule, String key, T defaultValue) {
        Map<String, Object> ruleConfig = ruleConfigs.get(rule);
        if (ruleConfig == null) {
            return defaultValue;
        }
        return _coerce(ruleConfig.get(key), defaultValue);
    }

    public boolean isRuleEnabled(String rule) {
        return getRuleConfig(rule, "enabled", Boolean.TRUE);
    }

    /**
     * Returns a copy with one rule option replaced.
     */
    public LintConfig withRuleOption(String rule, String key, Object value) {
        Map<String, Map<String, Object>> rules = getRuleConfigsMap();
        rules.computeIfAbsent(rule, k -> new HashMap<>()).put(key, value);
        return new LintConfig(getGeneralConfigMap(), rules);
    }

    /**
     * Returns a copy with one general option replaced.
     */
    public LintConfig withGeneralOption(String key, Object value) {
        Map<String, Object> general = getGeneralConfigMap();
        general.put(key, value);
        return new LintConfig(general, getRuleConfigsMap());
    }

    @SuppressWarnings("unchecked")
    private static <T> T _coerce(Object value, T defaultValue) {
        if (value == null) {
            return defaultValue;
        }

        if (defaultValue != null && !defaultValue.getClass().isInstance(value)) {
            if (defaultValue instanceof Integer && value instanceof Number) {
                return (T) Integer.valueOf(((Number) value).intValue());
            } else if (defaultValue instanceof Integer && value instanceof String) {
                try {
                    return (T) Integer.valueOf(((String) value).trim());
                } catch (NumberFormatException e) {
                    return defaultValue;
                }
            } else if (defaultValue instanceof Boolean && value instanceof String) {
                return (T) Boolean.valueOf(value.toString());
            } else if (defaultValue instanceof String) {
                return (T) value.toString();
            }

            return defaultValue;
        }

        return (T) value;
    }
}

package com.templateformatter.config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the formatter and the linter.
 */
public class FormatterConfig {
    private final Map<String, Object> formatterConfig;
    private final Map<String, Object> linterConfig;

    public FormatterConfig(Map<String, Object> formatterConfig, Map<String, Object> linterConfig) {
        this.formatterConfig = formatterConfig;
        this.linterConfig = linterConfig;
    }

    /**
     * Gets a copy of the formatter section.
     */
    public Map<String, Object> getFormatterConfigMap() {
        return new HashMap<>(formatterConfig);
    }

    /**
     * Gets a copy of the linter section.
     */
    public Map<String, Object> getLinterConfigMap() {
        return new HashMap<>(linterConfig);
    }

    public <T> T getFormatterConfig(String key, T defaultValue) {
        return _typed(formatterConfig.get(key), defaultValue);
    }

    public <T> T getLinterConfig(String key, T defaultValue) {
        return _typed(linterConfig.get(key), defaultValue);
    }

    /**
     * Reads a list of names from the formatter section, falling back when the entry is absent or
     * not a list.
     */
    public List<String> getFormatterList(String key, Collection<String> defaultValue) {
        return _stringList(formatterConfig.get(key), defaultValue);
    }

    /**
     * Names of the rewriters configured for a phase, {@code pre} or {@code post}.
     */
    public List<String> getRewriters(String phase) {
        Object rewriters = formatterConfig.get("rewriters");
        if (!(rewriters instanceof Map)) {
            return new ArrayList<>();
        }
        return _stringList(((Map<?, ?>) rewriters).get(phase), new ArrayList<>());
    }

    public boolean isUnsafeFixesEnabled() {
        return getLinterConfig("unsafeFixes", false);
    }

    /**
     * Per-rule enablement switches in declaration order.
     */
    public Map<String, Boolean> getRuleSwitches() {
        Map<String, Boolean> result = new LinkedHashMap<>();
        Object rules = linterConfig.get("rules");
        if (rules instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) rules).entrySet()) {
                result.put(String.valueOf(entry.getKey()), !Boolean.FALSE.equals(_typed(entry.getValue(), true)));
            }
        }
        return result;
    }

    public boolean isRuleEnabled(String ruleName) {
        Boolean enabled = getRuleSwitches().get(ruleName);
        return enabled == null || enabled;
    }

    @SuppressWarnings("unchecked")
    private static <T> T _typed(Object value, T defaultValue) {
        try {
            if (value == null) {
                return defaultValue;
            }

            if (defaultValue != null && !defaultValue.getClass().isInstance(value)) {

                if (defaultValue instanceof Integer && value instanceof Number) {
                    return (T) Integer.valueOf(((Number) value).intValue());
                } else if (defaultValue instanceof Boolean && value instanceof String) {
                    return (T) Boolean.valueOf(value.toString());
                } else if (defaultValue instanceof String) {
                    return (T) value.toString();
                }

                return defaultValue;
            }

            return (T) value;
        } catch (ClassCastException e) {
            return defaultValue;
        }
    }

    private static List<String> _stringList(Object value, Collection<String> defaultValue) {
        if (!(value instanceof Collection)) {
            return new ArrayList<>(defaultValue);
        }
        List<String> result = new ArrayList<>();
        for (Object item : (Collection<?>) value) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }
}

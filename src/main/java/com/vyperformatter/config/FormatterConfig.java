package com.vyperformatter.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Effective formatter settings. Values are held as the loosely typed map read from
 * YAML; typed accessors cover the keys the formatter understands.
 */
public class FormatterConfig {
    public static final String LINE_LENGTH = "lineLength";
    public static final String SAFETY_CHECK = "safetyCheck";
    public static final String FALLBACK_TO_ORIGINAL = "fallbackToOriginal";
    public static final String IGNORE_FILES = "ignoreFiles";

    private final Map<String, Object> generalConfig;

    public FormatterConfig(Map<String, Object> generalConfig) {
        this.generalConfig = new HashMap<>(generalConfig);
    }

    /**
     * Gets a copy of the general config map.
     */
    public Map<String, Object> getGeneralConfigMap() {
        return new HashMap<>(generalConfig);
    }

    @SuppressWarnings("unchecked")
    public <T> T getGeneralConfig(String key, T defaultValue) {
        Object value = generalConfig.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (defaultValue != null && !defaultValue.getClass().isInstance(value)) {
            if (defaultValue instanceof Integer && value instanceof Number) {
                return (T) Integer.valueOf(((Number) value).intValue());
            } else if (defaultValue instanceof Boolean && value instanceof String) {
                return (T) Boolean.valueOf(value.toString());
            }
            return defaultValue;
        }
        return (T) value;
    }

    public int getLineLength() {
        return getGeneralConfig(LINE_LENGTH, ConfigurationLoader.DEFAULT_LINE_LENGTH);
    }

    public boolean isSafetyCheck() {
        return getGeneralConfig(SAFETY_CHECK, true);
    }

    public boolean isFallbackToOriginal() {
        return getGeneralConfig(FALLBACK_TO_ORIGINAL, true);
    }

    public List<String> getIgnoreFiles() {
        List<String> result = new ArrayList<>();
        if (generalConfig.get(IGNORE_FILES) instanceof List) {
            for (Object pattern : (List<?>) generalConfig.get(IGNORE_FILES)) {
                result.add(String.valueOf(pattern));
            }
        }
        return result;
    }

    /**
     * Returns a copy with {@code key} set, as used for command-line overrides.
     */
    public FormatterConfig with(String key, Object value) {
        Map<String, Object> copy = new HashMap<>(generalConfig);
        copy.put(key, value);
        return new FormatterConfig(copy);
    }
}

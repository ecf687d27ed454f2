package com.optmodeler.core.generator;

import java.util.Map;

/**
 * Configuration for program generation.
 *
 * @param indent indentation of statements inside the {@code proc optmodel} block
 * @param wrapInProc whether to wrap the program in {@code proc optmodel; ... quit;}
 * @param maxDigits maximum fraction digits of numeric literals, 0 or less for no rounding
 * @param customSettings generator-specific custom settings
 */
public record GeneratorConfig(
    String indent,
    boolean wrapInProc,
    int maxDigits,
    Map<String, Object> customSettings
) {
    /** Default number of fraction digits. */
    public static final int DEFAULT_MAX_DIGITS = 12;

    /** Default indentation of four spaces. */
    public static final String DEFAULT_INDENT = "    ";

    /**
     * Compact constructor with validation.
     */
    public GeneratorConfig {
        if (indent == null) {
            indent = DEFAULT_INDENT;
        }
        if (!indent.isBlank()) {
            throw new IllegalArgumentException("indent must consist of whitespace only");
        }
        if (customSettings == null) {
            customSettings = Map.of();
        }
    }

    /**
     * Creates a default configuration.
     *
     * @return default generator config
     */
    public static GeneratorConfig defaults() {
        return new GeneratorConfig(DEFAULT_INDENT, true, DEFAULT_MAX_DIGITS, Map.of());
    }

    /**
     * Gets a custom setting with a default.
     *
     * @param key setting key
     * @param defaultValue default value
     * @param <T> expected type
     * @return setting value or default
     */
    @SuppressWarnings("unchecked")
    public <T> T getSettingOrDefault(String key, T defaultValue) {
        T value = (T) customSettings.get(key);
        return value != null ? value : defaultValue;
    }
}

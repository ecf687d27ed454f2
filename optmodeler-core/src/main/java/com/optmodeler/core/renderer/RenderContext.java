package com.optmodeler.core.renderer;

import java.util.Map;
import java.util.Objects;

/**
 * Context passed to output renderers.
 *
 * <p>The console renderer reads {@value #SHOW_HEADERS} ({@code true} prints a
 * comment header with the file name before each program) and {@value #SEPARATOR}.
 *
 * @param outputDirectory target directory for file-based renderers
 * @param settings renderer-specific settings
 */
public record RenderContext(
    String outputDirectory,
    Map<String, String> settings
) {
    /** Setting that toggles per-program comment headers on the console. */
    public static final String SHOW_HEADERS = "console.showHeaders";

    /** Setting holding the line printed between programs on the console. */
    public static final String SEPARATOR = "console.separator";

    /**
     * Compact constructor with validation.
     */
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        if (settings == null) {
            settings = Map.of();
        }
    }

    /**
     * Creates a context for console output without headers, as used for single programs.
     *
     * @return console context
     */
    public static RenderContext plainConsole() {
        return new RenderContext(".", Map.of(SHOW_HEADERS, "false"));
    }

    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }
}

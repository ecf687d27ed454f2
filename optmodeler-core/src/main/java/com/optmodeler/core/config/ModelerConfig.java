package com.optmodeler.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.optmodeler.core.generator.GeneratorConfig;

import java.util.Map;

/**
 * Root configuration for OptModeler projects.
 *
 * <p>Loaded from {@code optmodeler.yaml}. Every section is optional; missing sections and
 * fields fall back to the values of {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "Transport"
 *   version: "1.0.0"
 *
 * render:
 *   indent: "  "
 *   wrapInProc: true
 *   maxDigits: 8
 *
 * output:
 *   directory: "./build/optmodel"
 *   extension: "sas"
 * }</pre>
 *
 * @param project project metadata
 * @param render rendering options
 * @param output output options
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelerConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("render") RenderSettings render,
    @JsonProperty("output") OutputSettings output
) {
    /** Default output directory. */
    public static final String DEFAULT_OUTPUT_DIRECTORY = "./optmodel";

    public ModelerConfig {
        if (project == null) {
            project = new ProjectInfo("model", "1.0.0");
        }
        if (render == null) {
            render = new RenderSettings(null, null, null);
        }
        if (output == null) {
            output = new OutputSettings(null, null);
        }
    }

    /**
     * Creates the default configuration: four-space indentation, wrapped programs,
     * twelve fraction digits, output under {@value #DEFAULT_OUTPUT_DIRECTORY}.
     *
     * @return default configuration
     */
    public static ModelerConfig defaults() {
        return new ModelerConfig(null, null, null);
    }

    /**
     * Derives the generator configuration.
     *
     * @return generator configuration for this project
     */
    public GeneratorConfig toGeneratorConfig() {
        return new GeneratorConfig(render.indent(), render.wrapInProc(), render.maxDigits(),
            Map.of("project.name", project.name()));
    }

    /**
     * Project metadata.
     *
     * @param name project name
     * @param version project version
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name,
        @JsonProperty("version") String version
    ) {
        public ProjectInfo {
            if (name == null || name.isBlank()) {
                name = "model";
            }
        }
    }

    /**
     * Rendering options.
     *
     * @param indent indentation inside the proc block
     * @param wrapInProc whether to emit {@code proc optmodel;} and {@code quit;}
     * @param maxDigits maximum fraction digits of numeric literals
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RenderSettings(
        @JsonProperty("indent") String indent,
        @JsonProperty("wrapInProc") Boolean wrapInProc,
        @JsonProperty("maxDigits") Integer maxDigits
    ) {
        public RenderSettings {
            if (indent == null) {
                indent = GeneratorConfig.DEFAULT_INDENT;
            }
            if (wrapInProc == null) {
                wrapInProc = Boolean.TRUE;
            }
            if (maxDigits == null) {
                maxDigits = GeneratorConfig.DEFAULT_MAX_DIGITS;
            }
        }
    }

    /**
     * Output options.
     *
     * @param directory directory that receives generated programs
     * @param extension file extension, without the dot
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputSettings(
        @JsonProperty("directory") String directory,
        @JsonProperty("extension") String extension
    ) {
        public OutputSettings {
            if (directory == null || directory.isBlank()) {
                directory = DEFAULT_OUTPUT_DIRECTORY;
            }
            if (extension == null || extension.isBlank()) {
                extension = "sas";
            }
        }
    }
}

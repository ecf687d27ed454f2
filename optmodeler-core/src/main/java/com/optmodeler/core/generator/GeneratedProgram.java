package com.optmodeler.core.generator;

import java.util.Objects;

/**
 * A generated solver program.
 *
 * @param name program name, the container name
 * @param content program text
 * @param fileExtension file extension for this content
 */
public record GeneratedProgram(
    String name,
    String content,
    String fileExtension
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedProgram {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
    }
}

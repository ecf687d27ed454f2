package com.optmodeler.core.renderer;

import java.util.Objects;

/**
 * A single file of generated output.
 *
 * @param relativePath path relative to the output directory
 * @param content file content
 * @param contentType MIME type, may be null
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}

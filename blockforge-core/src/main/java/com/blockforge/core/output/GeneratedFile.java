package com.blockforge.core.output;

import java.util.Objects;

/**
 * Represents a generated file to be rendered.
 *
 * @param relativePath relative path for the file (e.g., "pages/home.html")
 * @param content file content
 * @param type artifact kind
 */
public record GeneratedFile(
    String relativePath,
    String content,
    ArtifactType type
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath must not be blank");
        }
    }
}

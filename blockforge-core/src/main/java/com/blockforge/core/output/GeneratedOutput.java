package com.blockforge.core.output;

import java.util.List;
import java.util.Objects;

/**
 * Collection of generated files to be rendered.
 *
 * @param files generated files, in render order
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    /**
     * Returns the files of one kind.
     *
     * @param type artifact kind
     * @return matching files, in render order
     */
    public List<GeneratedFile> filesOfType(ArtifactType type) {
        return files.stream().filter(file -> file.type() == type).toList();
    }
}

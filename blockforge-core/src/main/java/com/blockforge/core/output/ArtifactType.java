package com.blockforge.core.output;

/**
 * Kind of a generated artifact, with its media type.
 */
public enum ArtifactType {
    PAGE_MARKUP("text/html"),
    THEME_DESCRIPTOR("application/json");

    private final String mediaType;

    ArtifactType(String mediaType) {
        this.mediaType = mediaType;
    }

    public String mediaType() {
        return mediaType;
    }
}

package com.blockforge.core.theme;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A complete theme descriptor ({@code theme.json}, schema version 3).
 *
 * @param schema schema URL, written as {@code $schema}
 * @param version descriptor format version
 * @param settings design token presets
 * @param styles global styles
 */
@JsonPropertyOrder({"$schema", "version", "settings", "styles"})
public record ThemeDescriptor(
    @JsonProperty("$schema") String schema,
    int version,
    ThemeSettings settings,
    ThemeStyles styles
) {
    public ThemeDescriptor {
        Objects.requireNonNull(settings, "settings must not be null");
        styles = styles == null ? ThemeStyles.none() : styles;
    }
}

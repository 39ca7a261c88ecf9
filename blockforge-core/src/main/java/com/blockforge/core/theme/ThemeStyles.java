package com.blockforge.core.theme;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global styles of a theme descriptor.
 *
 * <p>Values are CSS strings or {@code var:preset|...} references and are copied without
 * validation. Unset fields are omitted from the written descriptor, so an all-null instance
 * serializes to {@code {}}.
 *
 * @param color page background and text colors
 * @param typography page font settings
 * @param spacing page padding and margin
 * @param elements styles per HTML element ({@code h1}, {@code link}, {@code button}, ...)
 * @param blocks styles per block name ({@code core/button}, ...)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ThemeStyles(
    ColorStyle color,
    TypographyStyle typography,
    SpacingStyle spacing,
    Map<String, ElementStyle> elements,
    Map<String, ElementStyle> blocks
) {
    public ThemeStyles {
        elements = elements == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(elements));
        blocks = blocks == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(blocks));
    }

    /**
     * Styles with nothing set.
     *
     * @return empty styles
     */
    public static ThemeStyles none() {
        return new ThemeStyles(null, null, null, null, null);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ColorStyle(String background, String text) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record TypographyStyle(String fontFamily, String fontSize, String fontWeight, String lineHeight) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SpacingStyle(SpacingValue padding, SpacingValue margin) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SpacingValue(String top, String right, String bottom, String left) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record BorderStyle(String radius, String width, String color) {}

    /**
     * Style overrides for one element or block.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ElementStyle(
        ColorStyle color,
        TypographyStyle typography,
        BorderStyle border,
        SpacingStyle spacing
    ) {}
}

package com.blockforge.core.theme;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Theme design tokens supplied by the user.
 *
 * <p>Every category is optional. A category that is missing or empty is replaced by its
 * default in {@link ThemeDescriptorBuilder}; a supplied category replaces the default as a
 * whole. Layout sizes are the exception and are merged field by field.
 *
 * <p>Example YAML:
 * <pre>{@code
 * name: bakery
 * colors:
 *   primary: "#8b4513"
 *   cream: { color: "#fff8e7", name: "Cream" }
 * typography:
 *   fluid: true
 *   fontSizes:
 *     - { slug: small, size: 0.9rem }
 * layout:
 *   contentSize: 720px
 * }</pre>
 *
 * @param name theme name, informational only
 * @param colors palette entries by slug, in declaration order
 * @param gradients gradient presets
 * @param typography font settings
 * @param spacing spacing settings
 * @param layout content and wide widths
 * @param styles global styles, copied into the descriptor as given
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ThemeConfig(
    String name,
    Map<String, ColorEntry> colors,
    List<GradientPreset> gradients,
    TypographyConfig typography,
    SpacingConfig spacing,
    LayoutConfig layout,
    ThemeStyles styles
) {
    public ThemeConfig {
        colors = colors == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(colors));
        gradients = gradients == null ? List.of() : List.copyOf(gradients);
    }

    /**
     * Creates a configuration with no tokens, so every category takes its default.
     *
     * @return empty theme configuration
     */
    public static ThemeConfig empty() {
        return new ThemeConfig(null, null, null, null, null, null, null);
    }

    /**
     * Gradient preset. The gradient is any CSS gradient expression.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record GradientPreset(String slug, String name, String gradient) {}

    /**
     * Typography tokens.
     *
     * @param fluid whether font sizes scale with the viewport; false when unset
     * @param fontFamilies font family presets
     * @param fontSizes font size presets
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TypographyConfig(Boolean fluid, List<FontFamily> fontFamilies, List<FontSize> fontSizes) {
        public TypographyConfig {
            fontFamilies = fontFamilies == null ? List.of() : List.copyOf(fontFamilies);
            fontSizes = fontSizes == null ? List.of() : List.copyOf(fontSizes);
        }
    }

    /**
     * Font family preset with optional web font faces.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record FontFamily(String slug, String name, String fontFamily, List<FontFace> fontFace) {
        public FontFamily {
            fontFace = fontFace == null ? List.of() : List.copyOf(fontFace);
        }
    }

    /**
     * Web font face. Sources are theme-relative or absolute URLs.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record FontFace(String fontFamily, String fontWeight, String fontStyle, List<String> src) {
        public FontFace {
            src = src == null ? List.of() : List.copyOf(src);
        }
    }

    /**
     * Font size preset. A null name is derived from the slug.
     *
     * @param slug preset slug
     * @param size CSS size
     * @param name display name
     * @param fluid fluid bounds, or null for a fixed size
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record FontSize(String slug, String size, String name, Fluid fluid) {

        public FontSize(String slug, String size, String name) {
            this(slug, size, name, null);
        }

        /**
         * Lower and upper bound of a fluid font size.
         */
        @JsonIgnoreProperties(ignoreUnknown = true)
        @JsonInclude(JsonInclude.Include.NON_NULL)
        public record Fluid(String min, String max) {}
    }

    /**
     * Spacing tokens.
     *
     * @param units allowed CSS units
     * @param spacingSizes spacing presets
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SpacingConfig(List<String> units, List<SpacingSize> spacingSizes) {
        public SpacingConfig {
            units = units == null ? List.of() : List.copyOf(units);
            spacingSizes = spacingSizes == null ? List.of() : List.copyOf(spacingSizes);
        }
    }

    /**
     * Spacing preset. A null name is derived from the slug.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SpacingSize(String slug, String size, String name) {}

    /**
     * Content and wide widths. Either may be null to keep its default.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record LayoutConfig(String contentSize, String wideSize) {}
}

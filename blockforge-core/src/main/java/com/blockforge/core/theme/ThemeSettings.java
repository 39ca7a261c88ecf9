package com.blockforge.core.theme;

import com.blockforge.core.theme.ThemeConfig.FontFamily;
import com.blockforge.core.theme.ThemeConfig.FontSize;
import com.blockforge.core.theme.ThemeConfig.GradientPreset;
import com.blockforge.core.theme.ThemeConfig.LayoutConfig;
import com.blockforge.core.theme.ThemeConfig.SpacingSize;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * The {@code settings} section of a theme descriptor.
 *
 * @param appearanceTools enables the editor's border, spacing and typography controls
 * @param color palette and gradient presets
 * @param typography font presets
 * @param spacing spacing presets
 * @param layout content and wide widths
 */
@JsonPropertyOrder({"appearanceTools", "color", "typography", "spacing", "layout"})
public record ThemeSettings(
    boolean appearanceTools,
    ColorSettings color,
    TypographySettings typography,
    SpacingSettings spacing,
    LayoutConfig layout
) {

    /**
     * Color presets. Gradients are omitted when none are configured.
     */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonPropertyOrder({"palette", "gradients", "defaultPalette", "defaultGradients"})
    public record ColorSettings(
        List<PaletteColor> palette,
        List<GradientPreset> gradients,
        boolean defaultPalette,
        boolean defaultGradients
    ) {
        public ColorSettings {
            palette = List.copyOf(palette);
            gradients = gradients == null ? List.of() : List.copyOf(gradients);
        }
    }

    /**
     * Typography presets. Font families are omitted when none are configured.
     */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonPropertyOrder({"fluid", "fontFamilies", "fontSizes"})
    public record TypographySettings(boolean fluid, List<FontFamily> fontFamilies, List<FontSize> fontSizes) {
        public TypographySettings {
            fontFamilies = fontFamilies == null ? List.of() : List.copyOf(fontFamilies);
            fontSizes = List.copyOf(fontSizes);
        }
    }

    @JsonPropertyOrder({"units", "spacingSizes"})
    public record SpacingSettings(List<String> units, List<SpacingSize> spacingSizes) {
        public SpacingSettings {
            units = List.copyOf(units);
            spacingSizes = List.copyOf(spacingSizes);
        }
    }

    /**
     * One palette entry.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"slug", "name", "color"})
    public record PaletteColor(String slug, String name, String color) {}
}

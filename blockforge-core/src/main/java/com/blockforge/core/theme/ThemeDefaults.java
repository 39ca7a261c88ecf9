package com.blockforge.core.theme;

import com.blockforge.core.theme.ThemeConfig.FontSize;
import com.blockforge.core.theme.ThemeConfig.LayoutConfig;
import com.blockforge.core.theme.ThemeConfig.SpacingSize;
import com.blockforge.core.theme.ThemeSettings.PaletteColor;

import java.util.List;

/**
 * Default design tokens used for every category the configuration leaves out.
 */
public final class ThemeDefaults {

    public static final String SCHEMA = "https://schemas.wp.org/trunk/theme.json";
    public static final int VERSION = 3;

    public static final List<PaletteColor> PALETTE = List.of(
        new PaletteColor("primary", "Primary", "#0073aa"),
        new PaletteColor("secondary", "Secondary", "#23282d"),
        new PaletteColor("background", "Background", "#ffffff"),
        new PaletteColor("foreground", "Foreground", "#1e1e1e"),
        new PaletteColor("accent", "Accent", "#cd2653")
    );

    public static final List<FontSize> FONT_SIZES = List.of(
        new FontSize("small", "0.875rem", "Small"),
        new FontSize("medium", "1rem", "Medium"),
        new FontSize("large", "1.25rem", "Large"),
        new FontSize("x-large", "1.5rem", "Extra Large"),
        new FontSize("xx-large", "2rem", "Huge")
    );

    public static final List<SpacingSize> SPACING_SIZES = List.of(
        new SpacingSize("10", "0.625rem", "Extra Small"),
        new SpacingSize("20", "1rem", "Small"),
        new SpacingSize("30", "1.5rem", "Medium"),
        new SpacingSize("40", "2rem", "Large"),
        new SpacingSize("50", "3rem", "Extra Large")
    );

    public static final List<String> UNITS = List.of("px", "rem", "%");

    public static final LayoutConfig LAYOUT = new LayoutConfig("650px", "1200px");

    private ThemeDefaults() {
    }
}

package com.blockforge.core.theme;

import com.blockforge.core.theme.ThemeConfig.FontSize;
import com.blockforge.core.theme.ThemeConfig.LayoutConfig;
import com.blockforge.core.theme.ThemeConfig.SpacingConfig;
import com.blockforge.core.theme.ThemeConfig.SpacingSize;
import com.blockforge.core.theme.ThemeConfig.TypographyConfig;
import com.blockforge.core.theme.ThemeSettings.ColorSettings;
import com.blockforge.core.theme.ThemeSettings.PaletteColor;
import com.blockforge.core.theme.ThemeSettings.SpacingSettings;
import com.blockforge.core.theme.ThemeSettings.TypographySettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds theme descriptors from user design tokens.
 *
 * <p>Each category (palette, gradients, font families, font sizes, spacing units, spacing
 * sizes) is taken from the configuration when it is non-empty and from {@link ThemeDefaults}
 * otherwise. Categories are never merged element by element. Layout widths are resolved
 * independently of each other.
 *
 * <p>Values are passed through unvalidated; building never fails for well-typed input.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ThemeConfig config = new ThemeConfig("bakery",
 *     Map.of("primary", ColorEntry.of("#8b4513")), null, null, null, null, null);
 * String json = ThemeDescriptorWriter.write(new ThemeDescriptorBuilder().build(config));
 * }</pre>
 */
public class ThemeDescriptorBuilder {

    private static final Logger log = LoggerFactory.getLogger(ThemeDescriptorBuilder.class);

    /**
     * Builds the descriptor for a theme configuration.
     *
     * @param config design tokens; use {@link ThemeConfig#empty()} for an all-defaults theme
     * @return complete theme descriptor
     */
    public ThemeDescriptor build(ThemeConfig config) {
        Objects.requireNonNull(config, "config must not be null");

        ColorSettings color = new ColorSettings(palette(config.colors()), config.gradients(), false, false);
        ThemeSettings settings = new ThemeSettings(true, color, typography(config.typography()),
            spacing(config.spacing()), layout(config.layout()));

        log.debug("Built theme descriptor '{}' with {} palette colors",
            config.name(), color.palette().size());
        return new ThemeDescriptor(ThemeDefaults.SCHEMA, ThemeDefaults.VERSION, settings, config.styles());
    }

    /**
     * Derives a display name from a slug: {@code "brand-dark"} becomes {@code "Brand Dark"}.
     *
     * @param slug preset slug
     * @return title-cased words of the slug
     */
    public static String slugToName(String slug) {
        if (slug == null) {
            return "";
        }
        return Arrays.stream(slug.split("[-_\\s]+"))
            .filter(word -> !word.isEmpty())
            .map(word -> word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1))
            .collect(Collectors.joining(" "));
    }

    private static List<PaletteColor> palette(Map<String, ColorEntry> colors) {
        List<PaletteColor> palette = new ArrayList<>();
        colors.forEach((slug, entry) -> {
            if (entry != null) {
                palette.add(new PaletteColor(slug, name(slug, entry.name()), entry.color()));
            }
        });
        return palette.isEmpty() ? ThemeDefaults.PALETTE : palette;
    }

    private static TypographySettings typography(TypographyConfig typography) {
        if (typography == null) {
            return new TypographySettings(false, null, ThemeDefaults.FONT_SIZES);
        }
        List<FontSize> sizes = typography.fontSizes().isEmpty()
            ? ThemeDefaults.FONT_SIZES
            : typography.fontSizes().stream()
                .map(size -> new FontSize(size.slug(), size.size(), name(size.slug(), size.name()), size.fluid()))
                .toList();
        return new TypographySettings(Boolean.TRUE.equals(typography.fluid()), typography.fontFamilies(), sizes);
    }

    private static SpacingSettings spacing(SpacingConfig spacing) {
        if (spacing == null) {
            return new SpacingSettings(ThemeDefaults.UNITS, ThemeDefaults.SPACING_SIZES);
        }
        List<String> units = spacing.units().isEmpty() ? ThemeDefaults.UNITS : spacing.units();
        List<SpacingSize> sizes = spacing.spacingSizes().isEmpty()
            ? ThemeDefaults.SPACING_SIZES
            : spacing.spacingSizes().stream()
                .map(size -> new SpacingSize(size.slug(), size.size(), name(size.slug(), size.name())))
                .toList();
        return new SpacingSettings(units, sizes);
    }

    private static LayoutConfig layout(LayoutConfig layout) {
        if (layout == null) {
            return ThemeDefaults.LAYOUT;
        }
        return new LayoutConfig(
            orDefault(layout.contentSize(), ThemeDefaults.LAYOUT.contentSize()),
            orDefault(layout.wideSize(), ThemeDefaults.LAYOUT.wideSize()));
    }

    private static String name(String slug, String explicit) {
        return explicit == null || explicit.isBlank() ? slugToName(slug) : explicit;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}

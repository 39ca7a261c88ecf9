package com.blockforge.core.pattern;

import com.blockforge.core.model.BlockNode;

import java.util.List;

/**
 * Interface for pattern generators that compose block trees for one section type.
 *
 * <p>A generator turns a typed section configuration (e.g. {@code HeroConfig}) into a single
 * root {@link BlockNode}. Each generator declares a closed set of layout variants; every variant
 * is a distinct composition strategy over the same configuration fields.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI) and looked up by
 * {@link PatternRegistry}.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class HeroPatternGenerator extends AbstractPatternGenerator<HeroConfig, Layout> {
 *     public HeroPatternGenerator() {
 *         super(SectionType.HERO, "Hero Section", HeroConfig.class, Layout.class, Layout.CENTERED,
 *             Map.of(Layout.CENTERED, HeroPatternGenerator::centered,
 *                    Layout.MINIMAL, HeroPatternGenerator::minimal));
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.blockforge.core.pattern.PatternGenerator}
 *
 * @param <C> section configuration type
 * @see SectionType
 * @see LayoutVariant
 */
public interface PatternGenerator<C> {

    /**
     * Returns unique identifier for this generator.
     *
     * <p>Equal to the id of the section type it composes (e.g., "hero", "features").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * <p>Used in CLI output and logs (e.g., "Hero Section").
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the section type this generator composes.
     *
     * @return section type
     */
    SectionType getSectionType();

    /**
     * Returns the configuration record type.
     *
     * <p>Raw configuration maps are converted to this type before generation.
     *
     * @return configuration class
     */
    Class<C> getConfigType();

    /**
     * Returns the declared layout ids, in declaration order.
     *
     * @return layout ids
     */
    List<String> getLayouts();

    /**
     * Returns the layout used when none or an unknown one is requested.
     *
     * @return default layout id
     */
    String getDefaultLayout();

    /**
     * Checks whether a layout id is declared by this generator (case-insensitive).
     *
     * @param layout layout id, may be null
     * @return true if the layout is declared
     */
    default boolean supportsLayout(String layout) {
        if (layout == null) {
            return false;
        }
        String normalized = layout.trim();
        return getLayouts().stream().anyMatch(id -> id.equalsIgnoreCase(normalized));
    }

    /**
     * Generates the block tree of a section.
     *
     * <p>Optional fields that are absent produce no blocks. Missing conceptually-required fields
     * degrade the output (empty text, {@code #} links) instead of failing.
     *
     * @param config section configuration
     * @param layout layout id; null, blank or unknown ids select the default layout
     * @return root block of the section
     * @throws NullPointerException if config is null
     */
    BlockNode generate(C config, String layout);
}

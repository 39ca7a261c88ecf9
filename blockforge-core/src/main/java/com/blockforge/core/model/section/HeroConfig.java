package com.blockforge.core.model.section;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Configuration for a hero section.
 *
 * <p>Buttons are rendered only when both text and URL are set. {@code backgroundOverlay} is the
 * cover dim ratio (0-100); {@code alignment} applies to the centered layout only.
 *
 * @param heading main heading
 * @param subheading supporting text below the heading
 * @param buttonText primary button label
 * @param buttonUrl primary button target
 * @param secondaryButtonText secondary button label
 * @param secondaryButtonUrl secondary button target
 * @param backgroundImage background or media image URL
 * @param backgroundOverlay overlay dim ratio for cover layouts
 * @param alignment text alignment (left, center, right)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HeroConfig(
    String heading,
    String subheading,
    String buttonText,
    String buttonUrl,
    String secondaryButtonText,
    String secondaryButtonUrl,
    String backgroundImage,
    Integer backgroundOverlay,
    String alignment
) {
    /**
     * Creates a hero configuration with heading and subheading only.
     *
     * @param heading main heading
     * @param subheading supporting text
     * @return hero configuration
     */
    public static HeroConfig of(String heading, String subheading) {
        return new HeroConfig(heading, subheading, null, null, null, null, null, null, null);
    }
}

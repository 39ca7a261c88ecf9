package com.blockforge.core.model.section;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Configuration for a call-to-action section.
 *
 * <p>The primary button is always rendered; a missing URL degrades to {@code #}.
 * {@code backgroundColor} is either a palette slug or a custom color value.
 *
 * @param heading section heading
 * @param description supporting text
 * @param buttonText primary button label
 * @param buttonUrl primary button target
 * @param secondaryButtonText secondary button label
 * @param secondaryButtonUrl secondary button target
 * @param backgroundColor palette slug or custom color
 * @param backgroundImage optional background image URL
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CtaConfig(
    String heading,
    String description,
    String buttonText,
    String buttonUrl,
    String secondaryButtonText,
    String secondaryButtonUrl,
    String backgroundColor,
    String backgroundImage
) {
    /**
     * Creates a call-to-action with a single button.
     *
     * @param heading section heading
     * @param description supporting text
     * @param buttonText button label
     * @param buttonUrl button target
     * @return call-to-action configuration
     */
    public static CtaConfig of(String heading, String description, String buttonText, String buttonUrl) {
        return new CtaConfig(heading, description, buttonText, buttonUrl, null, null, null, null);
    }
}

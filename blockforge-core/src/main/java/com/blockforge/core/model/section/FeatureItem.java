package com.blockforge.core.model.section;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One feature of a features section.
 *
 * @param title feature title
 * @param description feature description
 * @param icon optional icon (emoji or inline markup)
 * @param image optional image URL
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FeatureItem(
    String title,
    String description,
    String icon,
    String image
) {
    /**
     * Creates a feature without icon or image.
     *
     * @param title feature title
     * @param description feature description
     * @return feature item
     */
    public static FeatureItem of(String title, String description) {
        return new FeatureItem(title, description, null, null);
    }
}

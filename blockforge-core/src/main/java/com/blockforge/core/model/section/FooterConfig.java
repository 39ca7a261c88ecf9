package com.blockforge.core.model.section;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

/**
 * Configuration for a footer section.
 *
 * @param columns link columns
 * @param copyright copyright line
 * @param socialLinks optional social links
 * @param showNewsletter whether the mega layout shows a newsletter row
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FooterConfig(
    List<FooterColumn> columns,
    String copyright,
    List<SocialLink> socialLinks,
    Boolean showNewsletter
) {
    /**
     * Compact constructor normalizing list fields.
     */
    public FooterConfig {
        columns = columns == null ? List.of() : columns.stream().filter(Objects::nonNull).toList();
        socialLinks = socialLinks == null ? List.of() : socialLinks.stream().filter(Objects::nonNull).toList();
    }

    /**
     * Returns whether the newsletter row is requested.
     *
     * @return true only when {@code showNewsletter} is explicitly true
     */
    public boolean newsletterEnabled() {
        return Boolean.TRUE.equals(showNewsletter);
    }
}

package com.blockforge.core.model.section;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

/**
 * A titled column of footer links.
 *
 * @param title column heading
 * @param links links in display order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FooterColumn(
    String title,
    List<FooterLink> links
) {
    /**
     * Compact constructor normalizing the link list.
     */
    public FooterColumn {
        links = links == null ? List.of() : links.stream().filter(Objects::nonNull).toList();
    }
}

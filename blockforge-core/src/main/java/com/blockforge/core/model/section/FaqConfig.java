package com.blockforge.core.model.section;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

/**
 * Configuration for a FAQ section.
 *
 * @param title section heading
 * @param subtitle optional text below the heading
 * @param items questions in display order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FaqConfig(
    String title,
    String subtitle,
    List<FaqItem> items
) {
    /**
     * Compact constructor normalizing the item list.
     */
    public FaqConfig {
        items = items == null ? List.of() : items.stream().filter(Objects::nonNull).toList();
    }
}

package com.blockforge.core.model.section;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

/**
 * Configuration for a statistics section.
 *
 * @param title optional section heading
 * @param subtitle optional text below the heading
 * @param stats figures in display order
 * @param backgroundColor palette slug or custom color for the banner layout
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StatsConfig(
    String title,
    String subtitle,
    List<StatItem> stats,
    String backgroundColor
) {
    /**
     * Compact constructor normalizing the figure list.
     */
    public StatsConfig {
        stats = stats == null ? List.of() : stats.stream().filter(Objects::nonNull).toList();
    }
}

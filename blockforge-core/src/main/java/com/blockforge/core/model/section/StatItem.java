package com.blockforge.core.model.section;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One figure of a statistics section.
 *
 * @param value displayed figure (e.g. "10k+")
 * @param label what the figure measures
 * @param description optional detail line
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StatItem(
    String value,
    String label,
    String description
) {}

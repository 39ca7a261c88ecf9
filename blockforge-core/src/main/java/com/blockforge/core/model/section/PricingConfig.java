package com.blockforge.core.model.section;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

/**
 * Configuration for a pricing section.
 *
 * @param title section heading
 * @param subtitle optional text below the heading
 * @param plans plans in display order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PricingConfig(
    String title,
    String subtitle,
    List<PricingPlan> plans
) {
    /**
     * Compact constructor normalizing the plan list.
     */
    public PricingConfig {
        plans = plans == null ? List.of() : plans.stream().filter(Objects::nonNull).toList();
    }
}

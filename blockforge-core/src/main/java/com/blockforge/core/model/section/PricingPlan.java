package com.blockforge.core.model.section;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

/**
 * One plan of a pricing table.
 *
 * @param name plan name
 * @param price display price (e.g. "$29")
 * @param period optional billing period (e.g. "/month")
 * @param description optional short description
 * @param features included features
 * @param buttonText optional button label
 * @param buttonUrl optional button target
 * @param highlighted whether the plan is visually emphasized
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PricingPlan(
    String name,
    String price,
    String period,
    String description,
    List<String> features,
    String buttonText,
    String buttonUrl,
    Boolean highlighted
) {
    /**
     * Compact constructor normalizing the feature list.
     */
    public PricingPlan {
        features = features == null ? List.of() : features.stream().filter(Objects::nonNull).toList();
    }

    /**
     * Returns whether the plan is highlighted.
     *
     * @return true only when {@code highlighted} is explicitly true
     */
    public boolean isHighlighted() {
        return Boolean.TRUE.equals(highlighted);
    }
}

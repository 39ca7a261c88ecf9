package com.blockforge.core.model.section;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

/**
 * Configuration for a features section.
 *
 * @param title section heading
 * @param subtitle optional text below the heading
 * @param features features in display order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FeaturesConfig(
    String title,
    String subtitle,
    List<FeatureItem> features
) {
    /**
     * Compact constructor normalizing the feature list.
     */
    public FeaturesConfig {
        features = features == null ? List.of() : features.stream().filter(Objects::nonNull).toList();
    }
}

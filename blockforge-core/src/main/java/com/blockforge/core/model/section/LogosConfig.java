package com.blockforge.core.model.section;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

/**
 * Configuration for a logo cloud section.
 *
 * @param title optional section heading
 * @param logos logos in display order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LogosConfig(
    String title,
    List<LogoItem> logos
) {
    /**
     * Compact constructor normalizing the logo list.
     */
    public LogosConfig {
        logos = logos == null ? List.of() : logos.stream().filter(Objects::nonNull).toList();
    }
}

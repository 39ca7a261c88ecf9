package com.blockforge.core.model.section;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Untyped section description as it arrives from configuration files or upstream content logic.
 *
 * <p>The {@code config} map is converted into the typed configuration record of the matching
 * pattern generator.
 *
 * @param type section type id (e.g. "hero", "features")
 * @param layout optional layout variant id
 * @param config raw section configuration
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SectionInput(
    @JsonProperty("type") String type,
    @JsonProperty("layout") String layout,
    @JsonProperty("config") Map<String, Object> config
) {
    /**
     * Compact constructor normalizing the configuration map.
     */
    public SectionInput {
        config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }

    /**
     * Creates a section input using the default layout.
     *
     * @param type section type id
     * @param config raw section configuration
     * @return section input
     */
    public static SectionInput of(String type, Map<String, Object> config) {
        return new SectionInput(type, null, config);
    }
}

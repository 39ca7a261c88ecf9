package com.blockforge.core.model.section;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One member of a team section.
 *
 * @param name member name
 * @param role optional job title
 * @param bio optional short biography
 * @param image optional portrait URL
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TeamMember(
    String name,
    String role,
    String bio,
    String image
) {}

package com.blockforge.core.model.section;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One logo of a logo cloud.
 *
 * @param name company or brand name, used as alt text
 * @param image optional logo image URL
 * @param url optional link target
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LogoItem(
    String name,
    String image,
    String url
) {}

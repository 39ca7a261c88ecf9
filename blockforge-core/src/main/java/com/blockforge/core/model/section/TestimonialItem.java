package com.blockforge.core.model.section;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One customer testimonial.
 *
 * @param quote testimonial text, without surrounding quotes
 * @param author author name
 * @param role optional author role or company
 * @param image optional author portrait URL
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TestimonialItem(
    String quote,
    String author,
    String role,
    String image
) {}

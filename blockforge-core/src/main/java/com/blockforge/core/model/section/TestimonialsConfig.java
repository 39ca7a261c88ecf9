package com.blockforge.core.model.section;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

/**
 * Configuration for a testimonials section.
 *
 * @param title section heading
 * @param subtitle optional text below the heading
 * @param testimonials testimonials in display order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TestimonialsConfig(
    String title,
    String subtitle,
    List<TestimonialItem> testimonials
) {
    /**
     * Compact constructor normalizing the testimonial list.
     */
    public TestimonialsConfig {
        testimonials = testimonials == null ? List.of() : testimonials.stream().filter(Objects::nonNull).toList();
    }
}

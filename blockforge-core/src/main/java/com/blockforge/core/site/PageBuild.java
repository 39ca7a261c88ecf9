package com.blockforge.core.site;

import java.util.List;
import java.util.Objects;

/**
 * Markup generated for one page.
 *
 * @param slug page slug
 * @param title page title
 * @param markup serialized sections, separated by blank lines
 * @param sectionCount number of sections rendered
 * @param skippedSections descriptions of sections left out, with the reason
 */
public record PageBuild(
    String slug,
    String title,
    String markup,
    int sectionCount,
    List<String> skippedSections
) {
    public PageBuild {
        Objects.requireNonNull(slug, "slug must not be null");
        Objects.requireNonNull(markup, "markup must not be null");
        skippedSections = skippedSections == null ? List.of() : List.copyOf(skippedSections);
    }
}

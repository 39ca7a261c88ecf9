package com.blockforge.core.site;

import java.util.List;
import java.util.Objects;

/**
 * Result of building a site: page markup plus the theme descriptor JSON.
 *
 * @param pages built pages, in configuration order
 * @param themeJson serialized theme descriptor
 */
public record SiteBuild(List<PageBuild> pages, String themeJson) {

    public SiteBuild {
        pages = List.copyOf(pages);
        Objects.requireNonNull(themeJson, "themeJson must not be null");
    }

    /**
     * Counts skipped sections over all pages.
     *
     * @return number of skipped sections
     */
    public int skippedCount() {
        return pages.stream().mapToInt(page -> page.skippedSections().size()).sum();
    }
}

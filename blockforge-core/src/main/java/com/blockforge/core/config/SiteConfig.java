package com.blockforge.core.config;

import com.blockforge.core.model.section.SectionInput;
import com.blockforge.core.theme.ThemeConfig;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration of a BlockForge site.
 *
 * <p>Loaded from {@code blockforge.yaml}. Describes the pages to generate, the sections of
 * each page, the theme tokens and where the output goes.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * site:
 *   name: "Acme Bakery"
 *
 * pages:
 *   - slug: home
 *     title: Home
 *     sections:
 *       - type: hero
 *         layout: split-left
 *         config:
 *           heading: "Fresh bread daily"
 *           image: "https://example.com/bread.jpg"
 *
 * theme:
 *   colors:
 *     primary: "#8b4513"
 *
 * output:
 *   directory: "./build"
 * }</pre>
 *
 * @param site site metadata
 * @param pages pages to generate
 * @param theme theme tokens
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SiteConfig(
    @JsonProperty("site") SiteInfo site,
    @JsonProperty("pages") List<PageConfig> pages,
    @JsonProperty("theme") ThemeConfig theme,
    @JsonProperty("output") OutputConfig output
) {
    /**
     * Compact constructor filling absent parts with defaults.
     */
    public SiteConfig {
        site = site == null ? new SiteInfo("site", null) : site;
        pages = pages == null ? List.of() : List.copyOf(pages);
        theme = theme == null ? ThemeConfig.empty() : theme;
        output = output == null ? OutputConfig.defaults() : output;
    }

    /**
     * Creates a configuration with no pages, the default theme and the default output.
     *
     * @return default configuration
     */
    public static SiteConfig defaults() {
        return new SiteConfig(null, null, null, null);
    }

    /**
     * Site metadata.
     *
     * @param name site name
     * @param description optional site description
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SiteInfo(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description
    ) {}

    /**
     * One page and its sections, in display order.
     *
     * @param slug page slug, used as the output file name
     * @param title page title
     * @param sections sections of the page
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PageConfig(
        @JsonProperty("slug") String slug,
        @JsonProperty("title") String title,
        @JsonProperty("sections") List<SectionInput> sections
    ) {
        public PageConfig {
            sections = sections == null ? List.of() : List.copyOf(sections);
        }
    }

    /**
     * Output settings.
     *
     * @param directory output directory
     * @param themeFile file name of the theme descriptor inside the output directory
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("themeFile") String themeFile
    ) {
        public static final String DEFAULT_DIRECTORY = "./build";
        public static final String DEFAULT_THEME_FILE = "theme.json";

        public OutputConfig {
            directory = directory == null || directory.isBlank() ? DEFAULT_DIRECTORY : directory;
            themeFile = themeFile == null || themeFile.isBlank() ? DEFAULT_THEME_FILE : themeFile;
        }

        public static OutputConfig defaults() {
            return new OutputConfig(null, null);
        }
    }
}

package com.blockforge.core.site;

import com.blockforge.core.config.SiteConfig;
import com.blockforge.core.config.SiteConfig.OutputConfig;
import com.blockforge.core.config.SiteConfig.PageConfig;
import com.blockforge.core.model.BlockNode;
import com.blockforge.core.model.section.SectionInput;
import com.blockforge.core.output.ArtifactType;
import com.blockforge.core.output.GeneratedFile;
import com.blockforge.core.output.GeneratedOutput;
import com.blockforge.core.pattern.PatternRegistry;
import com.blockforge.core.serializer.BlockSerializer;
import com.blockforge.core.theme.ThemeDescriptorBuilder;
import com.blockforge.core.theme.ThemeDescriptorWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a site configuration into page markup and a theme descriptor.
 *
 * <p>Sections that cannot be rendered never fail the build. A section with an unknown type or
 * an unusable configuration is logged at WARN, left out of its page and recorded in
 * {@link PageBuild#skippedSections()}. Pages without a slug are skipped the same way.
 */
public class SiteBuilder {

    private static final Logger log = LoggerFactory.getLogger(SiteBuilder.class);

    static final String PAGES_DIRECTORY = "pages/";
    static final String PAGE_EXTENSION = ".html";

    private final PatternRegistry registry;
    private final BlockSerializer serializer;
    private final ThemeDescriptorBuilder themeBuilder;

    public SiteBuilder() {
        this(PatternRegistry.discover(), new BlockSerializer(), new ThemeDescriptorBuilder());
    }

    public SiteBuilder(PatternRegistry registry, BlockSerializer serializer, ThemeDescriptorBuilder themeBuilder) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.serializer = Objects.requireNonNull(serializer, "serializer must not be null");
        this.themeBuilder = Objects.requireNonNull(themeBuilder, "themeBuilder must not be null");
    }

    /**
     * Builds every page and the theme of a site.
     *
     * @param config site configuration
     * @return built pages and theme JSON
     */
    public SiteBuild build(SiteConfig config) {
        Objects.requireNonNull(config, "config must not be null");

        List<PageBuild> pages = new ArrayList<>();
        for (PageConfig page : config.pages()) {
            if (page.slug() == null || page.slug().isBlank()) {
                log.warn("Skipping page '{}' without a slug", page.title());
                continue;
            }
            pages.add(buildPage(page));
        }

        String themeJson = ThemeDescriptorWriter.write(themeBuilder.build(config.theme()));
        SiteBuild build = new SiteBuild(pages, themeJson);
        log.info("Built site '{}': {} pages, {} skipped sections",
            config.site().name(), pages.size(), build.skippedCount());
        return build;
    }

    /**
     * Builds one page.
     *
     * @param page page configuration
     * @return page markup with skip report
     */
    public PageBuild buildPage(PageConfig page) {
        List<BlockNode> roots = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        for (int i = 0; i < page.sections().size(); i++) {
            SectionInput section = page.sections().get(i);
            String position = page.slug() + "#" + (i + 1) + " (" + section.type() + ")";
            try {
                Optional<BlockNode> root = registry.createPattern(section);
                if (root.isPresent()) {
                    roots.add(root.get());
                } else {
                    log.warn("Skipping section {}: unknown section type", position);
                    skipped.add(position + ": unknown section type");
                }
            } catch (IllegalArgumentException e) {
                log.warn("Skipping section {}: {}", position, e.getMessage());
                skipped.add(position + ": invalid configuration");
            }
        }

        log.debug("Page '{}': {} sections rendered, {} skipped", page.slug(), roots.size(), skipped.size());
        return new PageBuild(page.slug(), page.title(), serializer.serialize(roots), roots.size(), skipped);
    }

    /**
     * Lays out a built site as files: {@code pages/<slug>.html} per page plus the theme file.
     *
     * @param build built site
     * @param output output settings
     * @return files to render
     */
    public static GeneratedOutput toOutput(SiteBuild build, OutputConfig output) {
        List<GeneratedFile> files = new ArrayList<>();
        for (PageBuild page : build.pages()) {
            files.add(new GeneratedFile(PAGES_DIRECTORY + page.slug() + PAGE_EXTENSION,
                page.markup(), ArtifactType.PAGE_MARKUP));
        }
        files.add(new GeneratedFile(output.themeFile(), build.themeJson(), ArtifactType.THEME_DESCRIPTOR));
        return new GeneratedOutput(files);
    }
}

package com.blockforge.core.pattern.impl;

import com.blockforge.core.model.BlockNode;
import com.blockforge.core.model.section.LogoItem;
import com.blockforge.core.model.section.LogosConfig;
import com.blockforge.core.pattern.LayoutVariant;
import com.blockforge.core.pattern.SectionType;
import com.blockforge.core.pattern.base.AbstractPatternGenerator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.blockforge.core.pattern.base.Blocks.chunk;
import static com.blockforge.core.pattern.base.Blocks.column;
import static com.blockforge.core.pattern.base.Blocks.columns;
import static com.blockforge.core.pattern.base.Blocks.hasText;
import static com.blockforge.core.pattern.base.Blocks.image;
import static com.blockforge.core.pattern.base.Blocks.link;
import static com.blockforge.core.pattern.base.Blocks.map;
import static com.blockforge.core.pattern.base.Blocks.paragraph;
import static com.blockforge.core.pattern.base.Blocks.section;

/**
 * Composes logo clouds ("trusted by" strips).
 *
 * <p>Logos without an image are shown by name. A logo URL turns the image or name into a link.
 *
 * <h2>Layouts</h2>
 * <ul>
 *   <li><b>row</b> (default): all logos in one row</li>
 *   <li><b>grid:</b> logos in rows of four</li>
 *   <li><b>text:</b> names only, on one line</li>
 * </ul>
 */
public class LogosPatternGenerator extends AbstractPatternGenerator<LogosConfig, LogosPatternGenerator.Layout> {

    private static final int GRID_COLUMNS = 4;

    /**
     * Logo cloud layout variants.
     */
    public enum Layout implements LayoutVariant {
        ROW("row"),
        GRID("grid"),
        TEXT("text");

        private final String id;

        Layout(String id) {
            this.id = id;
        }

        @Override
        public String id() {
            return id;
        }
    }

    public LogosPatternGenerator() {
        super(SectionType.LOGOS, "Logo Cloud", LogosConfig.class, Layout.class, Layout.ROW, Map.of(
            Layout.ROW, config -> rows(config, Math.max(1, config.logos().size())),
            Layout.GRID, config -> rows(config, GRID_COLUMNS),
            Layout.TEXT, LogosPatternGenerator::text
        ));
    }

    private static BlockNode rows(LogosConfig config, int perRow) {
        List<BlockNode> children = caption(config);
        for (List<LogoItem> row : chunk(config.logos(), perRow)) {
            List<BlockNode> cells = row.stream()
                .map(item -> column(map("verticalAlignment", "center"), List.of(logo(item))))
                .toList();
            children.add(columns(map("verticalAlignment", "center", "isStackedOnMobile", false), cells));
        }
        return section("40px", "40px", children);
    }

    private static BlockNode text(LogosConfig config) {
        List<BlockNode> children = caption(config);
        if (!config.logos().isEmpty()) {
            String names = config.logos().stream()
                .map(LogosPatternGenerator::name)
                .collect(Collectors.joining(" · "));
            children.add(paragraph(names, "align", "center", "fontSize", "large"));
        }
        return section("40px", "40px", children);
    }

    private static List<BlockNode> caption(LogosConfig config) {
        List<BlockNode> children = new ArrayList<>();
        if (hasText(config.title())) {
            children.add(paragraph(config.title(), "align", "center", "fontSize", "small"));
        }
        return children;
    }

    private static BlockNode logo(LogoItem logo) {
        if (hasText(logo.image())) {
            return image(logo.image(), logo.name(),
                "href", hasText(logo.url()) ? logo.url() : null,
                "linkDestination", hasText(logo.url()) ? "custom" : null,
                "className", "is-style-logo");
        }
        return paragraph(name(logo), "align", "center");
    }

    private static String name(LogoItem logo) {
        String name = logo.name() == null ? "" : logo.name();
        return hasText(logo.url()) ? link(logo.url(), name) : name;
    }
}

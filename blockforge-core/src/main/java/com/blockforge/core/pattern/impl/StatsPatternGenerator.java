package com.blockforge.core.pattern.impl;

import com.blockforge.core.model.BlockNode;
import com.blockforge.core.model.section.StatItem;
import com.blockforge.core.model.section.StatsConfig;
import com.blockforge.core.pattern.LayoutVariant;
import com.blockforge.core.pattern.SectionType;
import com.blockforge.core.pattern.base.AbstractPatternGenerator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.blockforge.core.pattern.base.Blocks.SECTION_PADDING;
import static com.blockforge.core.pattern.base.Blocks.chunk;
import static com.blockforge.core.pattern.base.Blocks.column;
import static com.blockforge.core.pattern.base.Blocks.constrained;
import static com.blockforge.core.pattern.base.Blocks.group;
import static com.blockforge.core.pattern.base.Blocks.hasText;
import static com.blockforge.core.pattern.base.Blocks.map;
import static com.blockforge.core.pattern.base.Blocks.padding;
import static com.blockforge.core.pattern.base.Blocks.paragraph;
import static com.blockforge.core.pattern.base.Blocks.sectionTitle;
import static com.blockforge.core.pattern.base.Blocks.spacer;
import static com.blockforge.core.pattern.base.Blocks.stackedColumns;
import static com.blockforge.core.pattern.base.Blocks.withBackground;

/**
 * Composes statistics sections (key figures with labels).
 *
 * <p>The title is optional. A background color, literal or palette slug, applies to every
 * layout; the banner layout uses the {@code primary} slug when none is set.
 *
 * <h2>Layouts</h2>
 * <ul>
 *   <li><b>row</b> (default): all figures in one row</li>
 *   <li><b>grid-2:</b> figures in rows of two</li>
 *   <li><b>banner:</b> full-width colored strip with white text</li>
 * </ul>
 */
public class StatsPatternGenerator extends AbstractPatternGenerator<StatsConfig, StatsPatternGenerator.Layout> {

    private static final String BANNER_BACKGROUND = "primary";

    /**
     * Statistics layout variants.
     */
    public enum Layout implements LayoutVariant {
        ROW("row"),
        GRID_2("grid-2"),
        BANNER("banner");

        private final String id;

        Layout(String id) {
            this.id = id;
        }

        @Override
        public String id() {
            return id;
        }
    }

    public StatsPatternGenerator() {
        super(SectionType.STATS, "Statistics Section", StatsConfig.class, Layout.class, Layout.ROW, Map.of(
            Layout.ROW, config -> rows(config, Math.max(1, config.stats().size())),
            Layout.GRID_2, config -> rows(config, 2),
            Layout.BANNER, StatsPatternGenerator::banner
        ));
    }

    private static BlockNode rows(StatsConfig config, int perRow) {
        List<BlockNode> children = header(config);
        for (List<StatItem> row : chunk(config.stats(), perRow)) {
            children.add(stackedColumns(row.stream().map(stat -> column(map(), figure(stat, null))).toList()));
        }
        return group(withBackground(map(
            "layout", constrained(),
            "style", padding(SECTION_PADDING, SECTION_PADDING)
        ), config.backgroundColor()), children);
    }

    private static BlockNode banner(StatsConfig config) {
        String background = hasText(config.backgroundColor()) ? config.backgroundColor() : BANNER_BACKGROUND;
        Map<String, Object> white = map("color", map("text", "#ffffff"));

        List<BlockNode> children = new ArrayList<>();
        if (hasText(config.title())) {
            children.add(paragraph(config.title(), "align", "center", "fontSize", "large", "style", white));
        }
        if (!config.stats().isEmpty()) {
            children.add(stackedColumns(config.stats().stream().map(stat -> column(map(), figure(stat, white))).toList()));
        }

        return group(withBackground(map(
            "layout", constrained(),
            "align", "full",
            "style", padding("40px", "40px")
        ), background), children);
    }

    private static List<BlockNode> header(StatsConfig config) {
        List<BlockNode> children = new ArrayList<>();
        if (hasText(config.title())) {
            children.add(sectionTitle(config.title()));
            if (hasText(config.subtitle())) {
                children.add(paragraph(config.subtitle(), "align", "center"));
            }
            children.add(spacer("40px"));
        }
        return children;
    }

    private static List<BlockNode> figure(StatItem stat, Map<String, Object> style) {
        List<BlockNode> blocks = new ArrayList<>(3);
        blocks.add(paragraph("<strong>" + (stat.value() == null ? "" : stat.value()) + "</strong>",
            "align", "center", "fontSize", "xx-large", "style", style));
        if (hasText(stat.label())) {
            blocks.add(paragraph(stat.label(), "align", "center", "style", style));
        }
        if (hasText(stat.description())) {
            blocks.add(paragraph(stat.description(), "align", "center", "fontSize", "small", "style", style));
        }
        return blocks;
    }
}

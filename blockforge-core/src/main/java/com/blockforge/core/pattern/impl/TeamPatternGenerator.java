package com.blockforge.core.pattern.impl;

import com.blockforge.core.model.BlockNode;
import com.blockforge.core.model.section.TeamConfig;
import com.blockforge.core.model.section.TeamMember;
import com.blockforge.core.pattern.LayoutVariant;
import com.blockforge.core.pattern.SectionType;
import com.blockforge.core.pattern.base.AbstractPatternGenerator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.blockforge.core.pattern.base.Blocks.SECTION_PADDING;
import static com.blockforge.core.pattern.base.Blocks.chunk;
import static com.blockforge.core.pattern.base.Blocks.column;
import static com.blockforge.core.pattern.base.Blocks.columns;
import static com.blockforge.core.pattern.base.Blocks.constrained;
import static com.blockforge.core.pattern.base.Blocks.group;
import static com.blockforge.core.pattern.base.Blocks.hasText;
import static com.blockforge.core.pattern.base.Blocks.heading;
import static com.blockforge.core.pattern.base.Blocks.image;
import static com.blockforge.core.pattern.base.Blocks.map;
import static com.blockforge.core.pattern.base.Blocks.padding;
import static com.blockforge.core.pattern.base.Blocks.paragraph;
import static com.blockforge.core.pattern.base.Blocks.section;
import static com.blockforge.core.pattern.base.Blocks.sectionTitle;
import static com.blockforge.core.pattern.base.Blocks.spacer;
import static com.blockforge.core.pattern.base.Blocks.stackedColumns;

/**
 * Composes team sections.
 *
 * <h2>Layouts</h2>
 * <ul>
 *   <li><b>grid-3</b> (default), <b>grid-4:</b> member cards chunked into rows</li>
 *   <li><b>list:</b> one row per member with the portrait left of the text</li>
 * </ul>
 */
public class TeamPatternGenerator extends AbstractPatternGenerator<TeamConfig, TeamPatternGenerator.Layout> {

    /**
     * Team layout variants.
     */
    public enum Layout implements LayoutVariant {
        GRID_3("grid-3"),
        GRID_4("grid-4"),
        LIST("list");

        private final String id;

        Layout(String id) {
            this.id = id;
        }

        @Override
        public String id() {
            return id;
        }
    }

    public TeamPatternGenerator() {
        super(SectionType.TEAM, "Team Section", TeamConfig.class, Layout.class, Layout.GRID_3, Map.of(
            Layout.GRID_3, config -> grid(config, 3),
            Layout.GRID_4, config -> grid(config, 4),
            Layout.LIST, TeamPatternGenerator::list
        ));
    }

    private static BlockNode grid(TeamConfig config, int perRow) {
        List<BlockNode> children = header(config);
        for (List<TeamMember> row : chunk(config.members(), perRow)) {
            List<BlockNode> cards = new ArrayList<>(row.size());
            for (TeamMember member : row) {
                List<BlockNode> blocks = new ArrayList<>(4);
                if (hasText(member.image())) {
                    blocks.add(image(member.image(), member.name(),
                        "align", "center", "width", 150, "height", 150, "className", "is-style-rounded"));
                }
                blocks.add(heading(4, member.name(), "textAlign", "center"));
                if (hasText(member.role())) {
                    blocks.add(paragraph(member.role(), "align", "center", "fontSize", "small"));
                }
                if (hasText(member.bio())) {
                    blocks.add(paragraph(member.bio(), "align", "center"));
                }
                cards.add(column(map(), blocks));
            }
            children.add(stackedColumns(cards));
        }
        return section(SECTION_PADDING, SECTION_PADDING, children);
    }

    private static BlockNode list(TeamConfig config) {
        List<BlockNode> children = header(config);
        for (TeamMember member : config.members()) {
            List<BlockNode> row = new ArrayList<>(2);
            if (hasText(member.image())) {
                row.add(column(map("width", "120px"), List.of(
                    image(member.image(), member.name(), "width", 120, "height", 120, "className", "is-style-rounded"))));
            }
            List<BlockNode> text = new ArrayList<>(3);
            text.add(heading(4, member.name()));
            if (hasText(member.role())) {
                text.add(paragraph(member.role(), "fontSize", "small"));
            }
            if (hasText(member.bio())) {
                text.add(paragraph(member.bio()));
            }
            row.add(column(map("verticalAlignment", "center"), text));
            children.add(columns(map("verticalAlignment", "center", "isStackedOnMobile", true), row));
        }
        return group(map("layout", constrained("800px"), "style", padding(SECTION_PADDING, SECTION_PADDING)), children);
    }

    private static List<BlockNode> header(TeamConfig config) {
        List<BlockNode> children = new ArrayList<>();
        children.add(sectionTitle(config.title()));
        if (hasText(config.subtitle())) {
            children.add(paragraph(config.subtitle(), "align", "center"));
        }
        children.add(spacer("40px"));
        return children;
    }
}

package com.blockforge.core.pattern.impl;

import com.blockforge.core.model.BlockNode;
import com.blockforge.core.model.section.FaqConfig;
import com.blockforge.core.model.section.FaqItem;
import com.blockforge.core.pattern.LayoutVariant;
import com.blockforge.core.pattern.SectionType;
import com.blockforge.core.pattern.base.AbstractPatternGenerator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.blockforge.core.pattern.base.Blocks.SECTION_PADDING;
import static com.blockforge.core.pattern.base.Blocks.byParity;
import static com.blockforge.core.pattern.base.Blocks.column;
import static com.blockforge.core.pattern.base.Blocks.constrained;
import static com.blockforge.core.pattern.base.Blocks.details;
import static com.blockforge.core.pattern.base.Blocks.group;
import static com.blockforge.core.pattern.base.Blocks.hasText;
import static com.blockforge.core.pattern.base.Blocks.heading;
import static com.blockforge.core.pattern.base.Blocks.map;
import static com.blockforge.core.pattern.base.Blocks.padding;
import static com.blockforge.core.pattern.base.Blocks.paragraph;
import static com.blockforge.core.pattern.base.Blocks.section;
import static com.blockforge.core.pattern.base.Blocks.sectionTitle;
import static com.blockforge.core.pattern.base.Blocks.spacer;
import static com.blockforge.core.pattern.base.Blocks.stackedColumns;

/**
 * Composes FAQ sections.
 *
 * <h2>Layouts</h2>
 * <ul>
 *   <li><b>accordion</b> (default): one collapsible details block per question</li>
 *   <li><b>list:</b> question headings followed by their answers</li>
 *   <li><b>two-column:</b> questions split into two columns by position parity</li>
 * </ul>
 */
public class FaqPatternGenerator extends AbstractPatternGenerator<FaqConfig, FaqPatternGenerator.Layout> {

    /**
     * FAQ layout variants.
     */
    public enum Layout implements LayoutVariant {
        ACCORDION("accordion"),
        LIST("list"),
        TWO_COLUMN("two-column");

        private final String id;

        Layout(String id) {
            this.id = id;
        }

        @Override
        public String id() {
            return id;
        }
    }

    public FaqPatternGenerator() {
        super(SectionType.FAQ, "FAQ Section", FaqConfig.class, Layout.class, Layout.ACCORDION, Map.of(
            Layout.ACCORDION, FaqPatternGenerator::accordion,
            Layout.LIST, FaqPatternGenerator::list,
            Layout.TWO_COLUMN, FaqPatternGenerator::twoColumn
        ));
    }

    private static BlockNode accordion(FaqConfig config) {
        List<BlockNode> children = header(config);
        for (FaqItem item : config.items()) {
            children.add(details(item.question(), answer(item)));
        }
        return narrow(children);
    }

    private static BlockNode list(FaqConfig config) {
        List<BlockNode> children = header(config);
        for (FaqItem item : config.items()) {
            children.addAll(entry(item, 3));
        }
        return narrow(children);
    }

    private static BlockNode twoColumn(FaqConfig config) {
        List<List<BlockNode>> entries = config.items().stream().map(item -> entry(item, 4)).toList();

        List<BlockNode> children = header(config);
        if (!entries.isEmpty()) {
            children.add(stackedColumns(List.of(
                column(map(), flatten(byParity(entries, true))),
                column(map(), flatten(byParity(entries, false)))
            )));
        }
        return section(SECTION_PADDING, SECTION_PADDING, children);
    }

    private static List<BlockNode> header(FaqConfig config) {
        List<BlockNode> children = new ArrayList<>();
        children.add(sectionTitle(config.title()));
        if (hasText(config.subtitle())) {
            children.add(paragraph(config.subtitle(), "align", "center"));
        }
        children.add(spacer("30px"));
        return children;
    }

    private static List<BlockNode> entry(FaqItem item, int level) {
        List<BlockNode> blocks = new ArrayList<>(2);
        blocks.add(heading(level, item.question()));
        blocks.addAll(answer(item));
        return blocks;
    }

    private static List<BlockNode> answer(FaqItem item) {
        return hasText(item.answer()) ? List.of(paragraph(item.answer())) : List.of();
    }

    private static List<BlockNode> flatten(List<List<BlockNode>> groups) {
        List<BlockNode> result = new ArrayList<>();
        groups.forEach(result::addAll);
        return result;
    }

    private static BlockNode narrow(List<BlockNode> children) {
        return group(map("layout", constrained("800px"), "style", padding(SECTION_PADDING, SECTION_PADDING)), children);
    }
}

package com.blockforge.core.pattern.impl;

import com.blockforge.core.model.BlockNode;
import com.blockforge.core.model.section.PricingConfig;
import com.blockforge.core.model.section.PricingPlan;
import com.blockforge.core.pattern.LayoutVariant;
import com.blockforge.core.pattern.SectionType;
import com.blockforge.core.pattern.base.AbstractPatternGenerator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.blockforge.core.pattern.base.Blocks.SECTION_PADDING;
import static com.blockforge.core.pattern.base.Blocks.button;
import static com.blockforge.core.pattern.base.Blocks.buttons;
import static com.blockforge.core.pattern.base.Blocks.chunk;
import static com.blockforge.core.pattern.base.Blocks.column;
import static com.blockforge.core.pattern.base.Blocks.columns;
import static com.blockforge.core.pattern.base.Blocks.constrained;
import static com.blockforge.core.pattern.base.Blocks.group;
import static com.blockforge.core.pattern.base.Blocks.hasText;
import static com.blockforge.core.pattern.base.Blocks.heading;
import static com.blockforge.core.pattern.base.Blocks.list;
import static com.blockforge.core.pattern.base.Blocks.listItem;
import static com.blockforge.core.pattern.base.Blocks.map;
import static com.blockforge.core.pattern.base.Blocks.padding;
import static com.blockforge.core.pattern.base.Blocks.paragraph;
import static com.blockforge.core.pattern.base.Blocks.section;
import static com.blockforge.core.pattern.base.Blocks.sectionTitle;
import static com.blockforge.core.pattern.base.Blocks.separator;
import static com.blockforge.core.pattern.base.Blocks.spacer;
import static com.blockforge.core.pattern.base.Blocks.stackedColumns;

/**
 * Composes pricing tables.
 *
 * <p>A highlighted plan gets a filled button and the {@code primary} background; the others get
 * outline buttons. Plans without a button label have no button.
 *
 * <h2>Layouts</h2>
 * <ul>
 *   <li><b>columns</b> (default): all plans side by side</li>
 *   <li><b>cards:</b> bordered cards, three per row</li>
 *   <li><b>stacked:</b> one row per plan with details left and price right</li>
 * </ul>
 */
public class PricingPatternGenerator extends AbstractPatternGenerator<PricingConfig, PricingPatternGenerator.Layout> {

    private static final int CARDS_PER_ROW = 3;
    private static final String HIGHLIGHT_COLOR = "primary";

    /**
     * Pricing layout variants.
     */
    public enum Layout implements LayoutVariant {
        COLUMNS("columns"),
        CARDS("cards"),
        STACKED("stacked");

        private final String id;

        Layout(String id) {
            this.id = id;
        }

        @Override
        public String id() {
            return id;
        }
    }

    public PricingPatternGenerator() {
        super(SectionType.PRICING, "Pricing Table", PricingConfig.class, Layout.class, Layout.COLUMNS, Map.of(
            Layout.COLUMNS, PricingPatternGenerator::columnsLayout,
            Layout.CARDS, PricingPatternGenerator::cards,
            Layout.STACKED, PricingPatternGenerator::stacked
        ));
    }

    private static BlockNode columnsLayout(PricingConfig config) {
        List<BlockNode> plans = new ArrayList<>(config.plans().size());
        for (PricingPlan plan : config.plans()) {
            plans.add(column(map(
                "style", padding("30px", "30px", "20px", "20px"),
                "backgroundColor", plan.isHighlighted() ? HIGHLIGHT_COLOR : null
            ), planBlocks(plan, "center")));
        }

        List<BlockNode> children = header(config);
        if (!plans.isEmpty()) {
            children.add(stackedColumns(plans));
        }
        return section(SECTION_PADDING, SECTION_PADDING, children);
    }

    private static BlockNode cards(PricingConfig config) {
        List<BlockNode> children = header(config);
        for (List<PricingPlan> row : chunk(config.plans(), CARDS_PER_ROW)) {
            List<BlockNode> cards = new ArrayList<>(row.size());
            for (PricingPlan plan : row) {
                Map<String, Object> style = padding("40px", "40px", "30px", "30px");
                style.put("border", map("radius", "12px", "width", plan.isHighlighted() ? "2px" : "1px", "color", "#e5e7eb"));
                cards.add(column(map(
                    "style", style,
                    "backgroundColor", plan.isHighlighted() ? HIGHLIGHT_COLOR : null
                ), planBlocks(plan, "center")));
            }
            children.add(stackedColumns(cards));
        }
        return section(SECTION_PADDING, SECTION_PADDING, children);
    }

    private static BlockNode stacked(PricingConfig config) {
        List<BlockNode> children = header(config);
        List<PricingPlan> plans = config.plans();
        for (int i = 0; i < plans.size(); i++) {
            PricingPlan plan = plans.get(i);

            List<BlockNode> details = new ArrayList<>(3);
            details.add(heading(3, plan.name()));
            if (hasText(plan.description())) {
                details.add(paragraph(plan.description()));
            }
            if (!plan.features().isEmpty()) {
                details.add(featureList(plan));
            }

            List<BlockNode> action = new ArrayList<>(2);
            action.add(paragraph(price(plan), "align", "right", "fontSize", "x-large"));
            if (hasText(plan.buttonText())) {
                action.add(buttons("right", List.of(planButton(plan))));
            }

            children.add(columns(map("verticalAlignment", "center", "isStackedOnMobile", true), List.of(
                column(map("width", "70%"), details),
                column(map("width", "30%", "verticalAlignment", "center"), action)
            )));
            if (i < plans.size() - 1) {
                children.add(separator());
            }
        }

        return group(map("layout", constrained("800px"), "style", padding(SECTION_PADDING, SECTION_PADDING)), children);
    }

    private static List<BlockNode> header(PricingConfig config) {
        List<BlockNode> children = new ArrayList<>();
        children.add(sectionTitle(config.title()));
        if (hasText(config.subtitle())) {
            children.add(paragraph(config.subtitle(), "align", "center"));
        }
        children.add(spacer("40px"));
        return children;
    }

    private static List<BlockNode> planBlocks(PricingPlan plan, String align) {
        List<BlockNode> blocks = new ArrayList<>(5);
        blocks.add(heading(3, plan.name(), "textAlign", align));
        blocks.add(paragraph(price(plan), "align", align, "fontSize", "x-large"));
        if (hasText(plan.description())) {
            blocks.add(paragraph(plan.description(), "align", align));
        }
        if (!plan.features().isEmpty()) {
            blocks.add(featureList(plan));
        }
        if (hasText(plan.buttonText())) {
            blocks.add(buttons(align, List.of(planButton(plan))));
        }
        return blocks;
    }

    private static BlockNode featureList(PricingPlan plan) {
        return list(map(), plan.features().stream().map(feature -> listItem(feature)).toList());
    }

    private static BlockNode planButton(PricingPlan plan) {
        return button(plan.buttonText(), plan.buttonUrl(),
            "className", plan.isHighlighted() ? "is-style-fill" : "is-style-outline");
    }

    private static String price(PricingPlan plan) {
        String price = "<strong>" + (plan.price() == null ? "" : plan.price()) + "</strong>";
        return hasText(plan.period()) ? price + " " + plan.period() : price;
    }
}

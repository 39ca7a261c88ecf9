package com.blockforge.core.pattern.impl;

import com.blockforge.core.model.BlockNode;
import com.blockforge.core.model.CoreBlock;
import com.blockforge.core.model.section.CtaConfig;
import com.blockforge.core.pattern.LayoutVariant;
import com.blockforge.core.pattern.SectionType;
import com.blockforge.core.pattern.base.AbstractPatternGenerator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.blockforge.core.pattern.base.Blocks.button;
import static com.blockforge.core.pattern.base.Blocks.buttons;
import static com.blockforge.core.pattern.base.Blocks.column;
import static com.blockforge.core.pattern.base.Blocks.columns;
import static com.blockforge.core.pattern.base.Blocks.constrained;
import static com.blockforge.core.pattern.base.Blocks.cover;
import static com.blockforge.core.pattern.base.Blocks.group;
import static com.blockforge.core.pattern.base.Blocks.hasText;
import static com.blockforge.core.pattern.base.Blocks.heading;
import static com.blockforge.core.pattern.base.Blocks.map;
import static com.blockforge.core.pattern.base.Blocks.padding;
import static com.blockforge.core.pattern.base.Blocks.paragraph;
import static com.blockforge.core.pattern.base.Blocks.withBackground;

/**
 * Composes call-to-action sections.
 *
 * <p>The primary button is always emitted; without a URL it links to {@code #}. The background
 * color is either a literal color or a palette slug (see {@code Blocks.withBackground}).
 *
 * <h2>Layouts</h2>
 * <ul>
 *   <li><b>centered</b> (default): stacked heading, description and buttons; a cover block when
 *       a background image is set</li>
 *   <li><b>split:</b> text on the left two thirds, button on the right</li>
 *   <li><b>banner:</b> slim full-width strip</li>
 *   <li><b>card:</b> rounded box centered in the section</li>
 * </ul>
 */
public class CtaPatternGenerator extends AbstractPatternGenerator<CtaConfig, CtaPatternGenerator.Layout> {

    private static final String BANNER_BACKGROUND = "#1e40af";
    private static final String CARD_BACKGROUND = "#f3f4f6";
    private static final String WHITE = "#ffffff";

    /**
     * Call-to-action layout variants.
     */
    public enum Layout implements LayoutVariant {
        CENTERED("centered"),
        SPLIT("split"),
        BANNER("banner"),
        CARD("card");

        private final String id;

        Layout(String id) {
            this.id = id;
        }

        @Override
        public String id() {
            return id;
        }
    }

    public CtaPatternGenerator() {
        super(SectionType.CTA, "Call to Action", CtaConfig.class, Layout.class, Layout.CENTERED, Map.of(
            Layout.CENTERED, CtaPatternGenerator::centered,
            Layout.SPLIT, CtaPatternGenerator::split,
            Layout.BANNER, CtaPatternGenerator::banner,
            Layout.CARD, CtaPatternGenerator::card
        ));
    }

    private static BlockNode centered(CtaConfig config) {
        List<BlockNode> actions = new ArrayList<>(2);
        actions.add(button(config.buttonText(), config.buttonUrl(), "className", "is-style-fill"));
        if (hasText(config.secondaryButtonText()) && hasText(config.secondaryButtonUrl())) {
            actions.add(button(config.secondaryButtonText(), config.secondaryButtonUrl(), "className", "is-style-outline"));
        }

        List<BlockNode> children = new ArrayList<>();
        children.add(heading(2, config.heading(), "textAlign", "center"));
        if (hasText(config.description())) {
            children.add(paragraph(config.description(), "align", "center", "fontSize", "medium"));
        }
        children.add(buttons("center", actions));

        if (hasText(config.backgroundImage())) {
            return cover(map("url", config.backgroundImage(), "dimRatio", 70, "align", "full"), children);
        }

        return group(withBackground(map(
            "layout", constrained(),
            "align", "full",
            "style", padding("80px", "80px")
        ), config.backgroundColor()), children);
    }

    private static BlockNode split(CtaConfig config) {
        List<BlockNode> text = new ArrayList<>(2);
        text.add(heading(2, config.heading()));
        if (hasText(config.description())) {
            text.add(paragraph(config.description(), "fontSize", "medium"));
        }

        BlockNode action = column(map("width", "33.33%", "verticalAlignment", "center"), List.of(
            buttons("right", List.of(button(config.buttonText(), config.buttonUrl())))));

        return group(withBackground(map(
            "layout", constrained(),
            "align", "full",
            "style", padding("60px", "60px")
        ), config.backgroundColor()), List.of(
            columns(map("verticalAlignment", "center", "isStackedOnMobile", true), List.of(
                column(map("width", "66.66%"), text),
                action
            ))
        ));
    }

    private static BlockNode banner(CtaConfig config) {
        String background = hasText(config.backgroundColor()) ? config.backgroundColor() : BANNER_BACKGROUND;
        Map<String, Object> textColor = map("color", map("text", WHITE));

        return group(withBackground(map(
            "layout", map("type", "flex", "flexWrap", "wrap", "justifyContent", "space-between"),
            "align", "full",
            "style", padding("20px", "20px", "40px", "40px")
        ), background), List.of(
            paragraph(config.heading(), "fontSize", "medium", "style", textColor),
            BlockNode.container(CoreBlock.BUTTONS.blockName(), Map.of(), List.of(
                button(config.buttonText(), config.buttonUrl(), "className", "is-style-outline", "style", textColor)))
        ));
    }

    private static BlockNode card(CtaConfig config) {
        String background = hasText(config.backgroundColor()) ? config.backgroundColor() : CARD_BACKGROUND;

        List<BlockNode> content = new ArrayList<>(3);
        content.add(heading(3, config.heading(), "textAlign", "center"));
        if (hasText(config.description())) {
            content.add(paragraph(config.description(), "align", "center"));
        }
        content.add(buttons("center", List.of(button(config.buttonText(), config.buttonUrl()))));

        Map<String, Object> cardStyle = padding("40px", "40px", "40px", "40px");
        cardStyle.put("border", map("radius", "12px"));

        BlockNode box = group(withBackground(map(
            "layout", constrained("600px"),
            "style", cardStyle
        ), background), content);

        return group(map("layout", constrained(), "style", padding("40px", "40px")), List.of(box));
    }
}

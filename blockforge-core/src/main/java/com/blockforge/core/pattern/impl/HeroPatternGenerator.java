package com.blockforge.core.pattern.impl;

import com.blockforge.core.model.BlockNode;
import com.blockforge.core.model.section.HeroConfig;
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
import static com.blockforge.core.pattern.base.Blocks.image;
import static com.blockforge.core.pattern.base.Blocks.map;
import static com.blockforge.core.pattern.base.Blocks.padding;
import static com.blockforge.core.pattern.base.Blocks.paragraph;
import static com.blockforge.core.pattern.base.Blocks.spacer;

/**
 * Composes hero sections, the first section of a landing page.
 *
 * <h2>Layouts</h2>
 * <ul>
 *   <li><b>centered</b> (default): stacked heading, subheading and buttons in a full-width group;
 *       becomes a cover block when a background image is set</li>
 *   <li><b>split-left / split-right:</b> two columns with the text on the named side and the
 *       image on the other; {@code split} selects split-left</li>
 *   <li><b>minimal:</b> narrow group framed by spacers, one outline button</li>
 *   <li><b>fullscreen:</b> viewport-high cover block</li>
 * </ul>
 *
 * <p>Buttons are emitted only when both label and URL are set.
 */
public class HeroPatternGenerator extends AbstractPatternGenerator<HeroConfig, HeroPatternGenerator.Layout> {

    private static final int DEFAULT_COVER_DIM = 50;
    private static final int DEFAULT_FULLSCREEN_DIM = 60;

    /**
     * Hero layout variants.
     */
    public enum Layout implements LayoutVariant {
        CENTERED("centered"),
        SPLIT_LEFT("split-left", "split"),
        SPLIT_RIGHT("split-right"),
        MINIMAL("minimal"),
        FULLSCREEN("fullscreen");

        private final String id;
        private final List<String> aliases;

        Layout(String id, String... aliases) {
            this.id = id;
            this.aliases = List.of(aliases);
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public List<String> aliases() {
            return aliases;
        }
    }

    public HeroPatternGenerator() {
        super(SectionType.HERO, "Hero Section", HeroConfig.class, Layout.class, Layout.CENTERED, Map.of(
            Layout.CENTERED, HeroPatternGenerator::centered,
            Layout.SPLIT_LEFT, config -> split(config, true),
            Layout.SPLIT_RIGHT, config -> split(config, false),
            Layout.MINIMAL, HeroPatternGenerator::minimal,
            Layout.FULLSCREEN, HeroPatternGenerator::fullscreen
        ));
    }

    private static BlockNode centered(HeroConfig config) {
        String textAlign = hasText(config.alignment()) ? config.alignment().trim() : "center";

        List<BlockNode> children = new ArrayList<>();
        children.add(heading(1, config.heading(), "textAlign", textAlign));
        if (hasText(config.subheading())) {
            children.add(paragraph(config.subheading(), "align", textAlign, "fontSize", "large"));
        }
        List<BlockNode> heroButtons = heroButtons(config, "is-style-fill");
        if (!heroButtons.isEmpty()) {
            children.add(buttons(textAlign, heroButtons));
        }

        if (hasText(config.backgroundImage())) {
            return cover(map(
                "url", config.backgroundImage(),
                "dimRatio", dimRatio(config, DEFAULT_COVER_DIM),
                "minHeight", 600,
                "align", "full",
                "contentPosition", "center center"
            ), children);
        }

        return group(map(
            "layout", constrained(),
            "align", "full",
            "style", padding("100px", "100px")
        ), children);
    }

    private static BlockNode split(HeroConfig config, boolean contentFirst) {
        List<BlockNode> content = new ArrayList<>();
        content.add(heading(1, config.heading(), "textAlign", "left"));
        if (hasText(config.subheading())) {
            content.add(paragraph(config.subheading(), "align", "left", "fontSize", "large"));
        }
        List<BlockNode> heroButtons = heroButtons(config, null);
        if (!heroButtons.isEmpty()) {
            content.add(buttons("left", heroButtons));
        }
        BlockNode contentColumn = column(map("width", "50%", "verticalAlignment", "center"), content);

        List<BlockNode> media = hasText(config.backgroundImage())
            ? List.of(image(config.backgroundImage(), config.heading(), "sizeSlug", "large", "className", "is-style-rounded"))
            : List.of();
        BlockNode mediaColumn = column(map("width", "50%"), media);

        List<BlockNode> row = contentFirst ? List.of(contentColumn, mediaColumn) : List.of(mediaColumn, contentColumn);

        return group(map(
            "align", "full",
            "layout", constrained(),
            "style", padding("80px", "80px")
        ), List.of(columns(map("verticalAlignment", "center", "isStackedOnMobile", true), row)));
    }

    private static BlockNode minimal(HeroConfig config) {
        List<BlockNode> children = new ArrayList<>();
        children.add(spacer("60px"));
        children.add(heading(1, config.heading(), "textAlign", "center", "fontSize", "x-large"));
        if (hasText(config.subheading())) {
            children.add(paragraph(config.subheading(), "align", "center", "fontSize", "medium"));
        }
        if (hasText(config.buttonText()) && hasText(config.buttonUrl())) {
            children.add(buttons("center", List.of(
                button(config.buttonText(), config.buttonUrl(), "className", "is-style-outline"))));
        }
        children.add(spacer("60px"));

        return group(map("layout", constrained("800px"), "align", "full"), children);
    }

    private static BlockNode fullscreen(HeroConfig config) {
        List<BlockNode> children = new ArrayList<>();
        children.add(heading(1, config.heading(), "textAlign", "center", "fontSize", "x-large"));
        if (hasText(config.subheading())) {
            children.add(paragraph(config.subheading(), "align", "center", "fontSize", "large"));
        }
        List<BlockNode> heroButtons = heroButtons(config, "is-style-fill");
        if (!heroButtons.isEmpty()) {
            children.add(buttons("center", heroButtons));
        }

        return cover(map(
            "url", hasText(config.backgroundImage()) ? config.backgroundImage() : null,
            "dimRatio", dimRatio(config, DEFAULT_FULLSCREEN_DIM),
            "minHeightUnit", "vh",
            "minHeight", 100,
            "align", "full",
            "contentPosition", "center center"
        ), children);
    }

    private static List<BlockNode> heroButtons(HeroConfig config, String primaryClassName) {
        List<BlockNode> result = new ArrayList<>(2);
        if (hasText(config.buttonText()) && hasText(config.buttonUrl())) {
            result.add(button(config.buttonText(), config.buttonUrl(), "className", primaryClassName));
        }
        if (hasText(config.secondaryButtonText()) && hasText(config.secondaryButtonUrl())) {
            result.add(button(config.secondaryButtonText(), config.secondaryButtonUrl(), "className", "is-style-outline"));
        }
        return result;
    }

    private static int dimRatio(HeroConfig config, int fallback) {
        Integer overlay = config.backgroundOverlay();
        return overlay == null || overlay <= 0 ? fallback : Math.min(overlay, 100);
    }
}

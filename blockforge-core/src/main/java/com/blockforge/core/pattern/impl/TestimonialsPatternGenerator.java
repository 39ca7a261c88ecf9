package com.blockforge.core.pattern.impl;

import com.blockforge.core.model.BlockNode;
import com.blockforge.core.model.section.TestimonialItem;
import com.blockforge.core.model.section.TestimonialsConfig;
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
import static com.blockforge.core.pattern.base.Blocks.group;
import static com.blockforge.core.pattern.base.Blocks.hasText;
import static com.blockforge.core.pattern.base.Blocks.image;
import static com.blockforge.core.pattern.base.Blocks.italic;
import static com.blockforge.core.pattern.base.Blocks.map;
import static com.blockforge.core.pattern.base.Blocks.padding;
import static com.blockforge.core.pattern.base.Blocks.paragraph;
import static com.blockforge.core.pattern.base.Blocks.quote;
import static com.blockforge.core.pattern.base.Blocks.section;
import static com.blockforge.core.pattern.base.Blocks.sectionTitle;
import static com.blockforge.core.pattern.base.Blocks.spacer;
import static com.blockforge.core.pattern.base.Blocks.stackedColumns;

/**
 * Composes testimonial sections.
 *
 * <h2>Layouts</h2>
 * <ul>
 *   <li><b>cards</b> (default): one column per testimonial with optional avatar</li>
 *   <li><b>single-large:</b> the first testimonial as a large quote block; falls back to cards
 *       when there is no testimonial</li>
 *   <li><b>quote-wall:</b> bordered quotes split into two columns by position parity</li>
 *   <li><b>centered:</b> one narrow centered group per testimonial</li>
 * </ul>
 */
public class TestimonialsPatternGenerator
    extends AbstractPatternGenerator<TestimonialsConfig, TestimonialsPatternGenerator.Layout> {

    private static final String DASH = "— ";

    /**
     * Testimonial layout variants.
     */
    public enum Layout implements LayoutVariant {
        CARDS("cards"),
        SINGLE_LARGE("single-large"),
        QUOTE_WALL("quote-wall"),
        CENTERED("centered");

        private final String id;

        Layout(String id) {
            this.id = id;
        }

        @Override
        public String id() {
            return id;
        }
    }

    public TestimonialsPatternGenerator() {
        super(SectionType.TESTIMONIALS, "Testimonials Section", TestimonialsConfig.class, Layout.class, Layout.CARDS,
            Map.of(
                Layout.CARDS, TestimonialsPatternGenerator::cards,
                Layout.SINGLE_LARGE, TestimonialsPatternGenerator::singleLarge,
                Layout.QUOTE_WALL, TestimonialsPatternGenerator::quoteWall,
                Layout.CENTERED, TestimonialsPatternGenerator::centered
            ));
    }

    private static BlockNode cards(TestimonialsConfig config) {
        List<BlockNode> cards = new ArrayList<>(config.testimonials().size());
        for (TestimonialItem testimonial : config.testimonials()) {
            List<BlockNode> blocks = new ArrayList<>(3);
            if (hasText(testimonial.image())) {
                blocks.add(image(testimonial.image(), testimonial.author(),
                    "align", "center", "width", 80, "height", 80, "className", "is-style-rounded"));
            }
            blocks.add(paragraph(quoted(testimonial), "align", "center", "style", italic()));
            blocks.add(paragraph(attribution(testimonial, "<br/><em>", "</em>"), "align", "center"));
            cards.add(column(map("style", padding("30px", "30px", "20px", "20px")), blocks));
        }

        List<BlockNode> children = header(config, "30px");
        if (!cards.isEmpty()) {
            children.add(stackedColumns(cards));
        }
        return section(SECTION_PADDING, SECTION_PADDING, children);
    }

    private static BlockNode singleLarge(TestimonialsConfig config) {
        if (config.testimonials().isEmpty()) {
            return cards(config);
        }
        TestimonialItem testimonial = config.testimonials().get(0);

        return group(map("layout", constrained("800px"), "style", padding("80px", "80px")), List.of(
            sectionTitle(config.title()),
            spacer("40px"),
            quote(map("align", "center", "className", "is-style-large"), List.of(
                paragraph(testimonial.quote(), "fontSize", "large"))),
            paragraph(byline(testimonial), "align", "center", "fontSize", "medium")
        ));
    }

    private static BlockNode quoteWall(TestimonialsConfig config) {
        List<BlockNode> quotes = new ArrayList<>(config.testimonials().size());
        for (TestimonialItem testimonial : config.testimonials()) {
            Map<String, Object> style = padding("20px", "20px", "20px", "20px");
            style.put("border", map("left", map("width", "4px", "color", "#3b82f6")));
            quotes.add(group(map("style", style), List.of(
                paragraph(quoted(testimonial), "style", italic()),
                paragraph(byline(testimonial), "fontSize", "small")
            )));
        }

        List<BlockNode> children = header(config, "40px");
        children.add(stackedColumns(List.of(
            column(map(), byParity(quotes, true)),
            column(map(), byParity(quotes, false))
        )));
        return section(SECTION_PADDING, SECTION_PADDING, children);
    }

    private static BlockNode centered(TestimonialsConfig config) {
        List<BlockNode> children = new ArrayList<>();
        children.add(sectionTitle(config.title()));
        if (hasText(config.subtitle())) {
            children.add(paragraph(config.subtitle(), "align", "center"));
        }
        for (TestimonialItem testimonial : config.testimonials()) {
            children.add(group(map("layout", constrained("700px"), "style", padding("40px", "40px")), List.of(
                paragraph(quoted(testimonial), "align", "center", "fontSize", "large", "style", italic()),
                paragraph(attribution(testimonial, "<br/>", ""), "align", "center")
            )));
        }
        return section(SECTION_PADDING, SECTION_PADDING, children);
    }

    private static List<BlockNode> header(TestimonialsConfig config, String spacerHeight) {
        List<BlockNode> children = new ArrayList<>();
        children.add(sectionTitle(config.title()));
        if (hasText(config.subtitle())) {
            children.add(paragraph(config.subtitle(), "align", "center"));
        }
        children.add(spacer(spacerHeight));
        return children;
    }

    private static String quoted(TestimonialItem testimonial) {
        return "\"" + text(testimonial.quote()) + "\"";
    }

    private static String attribution(TestimonialItem testimonial, String roleOpen, String roleClose) {
        String author = "<strong>" + text(testimonial.author()) + "</strong>";
        return hasText(testimonial.role()) ? author + roleOpen + testimonial.role() + roleClose : author;
    }

    private static String byline(TestimonialItem testimonial) {
        String author = DASH + text(testimonial.author());
        return hasText(testimonial.role()) ? author + ", " + testimonial.role() : author;
    }

    private static String text(String value) {
        return value == null ? "" : value;
    }
}

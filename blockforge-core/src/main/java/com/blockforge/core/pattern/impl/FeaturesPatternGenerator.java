package com.blockforge.core.pattern.impl;

import com.blockforge.core.model.BlockNode;
import com.blockforge.core.model.section.FeatureItem;
import com.blockforge.core.model.section.FeaturesConfig;
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
 * Composes feature sections: a title, an optional subtitle and one entry per feature.
 *
 * <h2>Layouts</h2>
 * <ul>
 *   <li><b>grid-3</b> (default), <b>grid-2</b>, <b>grid-4:</b> features chunked into rows of
 *       the given column count, in input order</li>
 *   <li><b>cards:</b> one bordered card column per feature in a single row</li>
 *   <li><b>alternating:</b> one two-column row per feature; the icon column comes first at even
 *       positions</li>
 *   <li><b>icon-left:</b> compact rows with a narrow icon column</li>
 * </ul>
 */
public class FeaturesPatternGenerator extends AbstractPatternGenerator<FeaturesConfig, FeaturesPatternGenerator.Layout> {

    /**
     * Feature layout variants.
     */
    public enum Layout implements LayoutVariant {
        GRID_3("grid-3"),
        GRID_2("grid-2"),
        GRID_4("grid-4"),
        CARDS("cards"),
        ALTERNATING("alternating"),
        ICON_LEFT("icon-left");

        private final String id;

        Layout(String id) {
            this.id = id;
        }

        @Override
        public String id() {
            return id;
        }
    }

    public FeaturesPatternGenerator() {
        super(SectionType.FEATURES, "Features Section", FeaturesConfig.class, Layout.class, Layout.GRID_3, Map.of(
            Layout.GRID_3, config -> grid(config, 3),
            Layout.GRID_2, config -> grid(config, 2),
            Layout.GRID_4, config -> grid(config, 4),
            Layout.CARDS, FeaturesPatternGenerator::cards,
            Layout.ALTERNATING, FeaturesPatternGenerator::alternating,
            Layout.ICON_LEFT, FeaturesPatternGenerator::iconLeft
        ));
    }

    private static BlockNode grid(FeaturesConfig config, int columnCount) {
        List<BlockNode> children = header(config, "40px", "medium");
        for (List<FeatureItem> row : chunk(config.features(), columnCount)) {
            List<BlockNode> rowColumns = new ArrayList<>(row.size());
            for (FeatureItem feature : row) {
                rowColumns.add(column(map(), centeredFeature(feature)));
            }
            children.add(stackedColumns(rowColumns));
        }
        return section(SECTION_PADDING, SECTION_PADDING, children);
    }

    private static BlockNode cards(FeaturesConfig config) {
        List<BlockNode> cards = new ArrayList<>(config.features().size());
        for (FeatureItem feature : config.features()) {
            cards.add(column(map(
                "style", map(
                    "border", map("radius", "8px", "width", "1px", "color", "#e5e7eb"),
                    "spacing", map("padding", map("top", "30px", "bottom", "30px", "left", "20px", "right", "20px"))
                ),
                "backgroundColor", "white"
            ), centeredFeature(feature)));
        }

        List<BlockNode> children = header(config, "40px", null);
        if (!cards.isEmpty()) {
            children.add(stackedColumns(cards));
        }

        return group(map(
            "layout", constrained(),
            "style", padding(SECTION_PADDING, SECTION_PADDING),
            "backgroundColor", "tertiary"
        ), children);
    }

    private static BlockNode alternating(FeaturesConfig config) {
        List<BlockNode> children = header(config, "40px", null);
        List<FeatureItem> features = config.features();
        for (int i = 0; i < features.size(); i++) {
            FeatureItem feature = features.get(i);

            BlockNode textColumn = column(map("width", "50%", "verticalAlignment", "center"), text(feature));
            BlockNode mediaColumn = column(map("width", "50%", "verticalAlignment", "center"), media(feature));

            boolean mediaFirst = i % 2 == 0;
            children.add(columns(
                map("verticalAlignment", "center", "isStackedOnMobile", true),
                mediaFirst ? List.of(mediaColumn, textColumn) : List.of(textColumn, mediaColumn)
            ));
            if (i < features.size() - 1) {
                children.add(spacer("40px"));
            }
        }
        return section(SECTION_PADDING, SECTION_PADDING, children);
    }

    private static BlockNode iconLeft(FeaturesConfig config) {
        List<BlockNode> children = header(config, "30px", null);
        for (FeatureItem feature : config.features()) {
            List<BlockNode> row = new ArrayList<>(2);
            if (hasText(feature.icon())) {
                row.add(column(map("width", "60px", "verticalAlignment", "top"), List.of(
                    paragraph(feature.icon(), "fontSize", "large"))));
            } else if (hasText(feature.image())) {
                row.add(column(map("width", "60px", "verticalAlignment", "top"), List.of(
                    image(feature.image(), feature.title(), "width", 48, "height", 48))));
            }
            List<BlockNode> text = new ArrayList<>(2);
            text.add(heading(4, feature.title()));
            if (hasText(feature.description())) {
                text.add(paragraph(feature.description()));
            }
            row.add(column(map("verticalAlignment", "top"), text));
            children.add(columns(map("isStackedOnMobile", false), row));
        }

        return group(map(
            "layout", constrained("800px"),
            "style", padding(SECTION_PADDING, SECTION_PADDING)
        ), children);
    }

    private static List<BlockNode> header(FeaturesConfig config, String spacerHeight, String subtitleFontSize) {
        List<BlockNode> children = new ArrayList<>();
        children.add(sectionTitle(config.title()));
        if (hasText(config.subtitle())) {
            children.add(paragraph(config.subtitle(), "align", "center", "fontSize", subtitleFontSize));
        }
        children.add(spacer(spacerHeight));
        return children;
    }

    private static List<BlockNode> centeredFeature(FeatureItem feature) {
        List<BlockNode> blocks = new ArrayList<>(3);
        if (hasText(feature.image())) {
            blocks.add(image(feature.image(), feature.title(), "align", "center"));
        } else if (hasText(feature.icon())) {
            blocks.add(paragraph(feature.icon(), "align", "center", "fontSize", "x-large"));
        }
        blocks.add(heading(3, feature.title(), "textAlign", "center"));
        if (hasText(feature.description())) {
            blocks.add(paragraph(feature.description(), "align", "center"));
        }
        return blocks;
    }

    private static List<BlockNode> text(FeatureItem feature) {
        List<BlockNode> blocks = new ArrayList<>(2);
        blocks.add(heading(3, feature.title()));
        if (hasText(feature.description())) {
            blocks.add(paragraph(feature.description()));
        }
        return blocks;
    }

    private static List<BlockNode> media(FeatureItem feature) {
        if (hasText(feature.image())) {
            return List.of(image(feature.image(), feature.title(), "sizeSlug", "large"));
        }
        if (hasText(feature.icon())) {
            return List.of(paragraph(feature.icon(), "align", "center", "fontSize", "x-large"));
        }
        return List.of();
    }
}

package com.blockforge.core.pattern.impl;

import com.blockforge.core.model.BlockNode;
import com.blockforge.core.model.section.FooterColumn;
import com.blockforge.core.model.section.FooterConfig;
import com.blockforge.core.model.section.FooterLink;
import com.blockforge.core.model.section.SocialLink;
import com.blockforge.core.pattern.LayoutVariant;
import com.blockforge.core.pattern.SectionType;
import com.blockforge.core.pattern.base.AbstractPatternGenerator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.blockforge.core.pattern.base.Blocks.button;
import static com.blockforge.core.pattern.base.Blocks.buttons;
import static com.blockforge.core.pattern.base.Blocks.column;
import static com.blockforge.core.pattern.base.Blocks.columns;
import static com.blockforge.core.pattern.base.Blocks.constrained;
import static com.blockforge.core.pattern.base.Blocks.group;
import static com.blockforge.core.pattern.base.Blocks.hasText;
import static com.blockforge.core.pattern.base.Blocks.heading;
import static com.blockforge.core.pattern.base.Blocks.link;
import static com.blockforge.core.pattern.base.Blocks.list;
import static com.blockforge.core.pattern.base.Blocks.listItem;
import static com.blockforge.core.pattern.base.Blocks.map;
import static com.blockforge.core.pattern.base.Blocks.padding;
import static com.blockforge.core.pattern.base.Blocks.paragraph;
import static com.blockforge.core.pattern.base.Blocks.section;
import static com.blockforge.core.pattern.base.Blocks.separator;
import static com.blockforge.core.pattern.base.Blocks.stackedColumns;

/**
 * Composes page footers.
 *
 * <h2>Layouts</h2>
 * <ul>
 *   <li><b>columns</b> (default): link columns, social buttons, separator and copyright</li>
 *   <li><b>minimal:</b> inline social links and copyright</li>
 *   <li><b>centered:</b> all links flattened into one centered line</li>
 *   <li><b>mega:</b> optional newsletter row, link columns and a bottom bar</li>
 * </ul>
 */
public class FooterPatternGenerator extends AbstractPatternGenerator<FooterConfig, FooterPatternGenerator.Layout> {

    private static final String LINK_SEPARATOR = " · ";

    /**
     * Footer layout variants.
     */
    public enum Layout implements LayoutVariant {
        COLUMNS("columns"),
        MINIMAL("minimal"),
        CENTERED("centered"),
        MEGA("mega");

        private final String id;

        Layout(String id) {
            this.id = id;
        }

        @Override
        public String id() {
            return id;
        }
    }

    public FooterPatternGenerator() {
        super(SectionType.FOOTER, "Footer", FooterConfig.class, Layout.class, Layout.COLUMNS, Map.of(
            Layout.COLUMNS, FooterPatternGenerator::columnsLayout,
            Layout.MINIMAL, FooterPatternGenerator::minimal,
            Layout.CENTERED, FooterPatternGenerator::centered,
            Layout.MEGA, FooterPatternGenerator::mega
        ));
    }

    private static BlockNode columnsLayout(FooterConfig config) {
        List<BlockNode> children = new ArrayList<>();
        if (!config.columns().isEmpty()) {
            children.add(stackedColumns(linkColumns(config.columns(), null)));
        }
        if (!config.socialLinks().isEmpty()) {
            children.add(socialButtons(config.socialLinks(), null));
        }
        children.add(separator());
        children.add(copyright(config, "center"));

        return section("60px", "40px", children);
    }

    private static BlockNode minimal(FooterConfig config) {
        List<BlockNode> children = new ArrayList<>(2);
        if (!config.socialLinks().isEmpty()) {
            children.add(paragraph(socialLine(config.socialLinks()), "align", "center"));
        }
        children.add(copyright(config, "center"));

        return section("30px", "30px", children);
    }

    private static BlockNode centered(FooterConfig config) {
        List<FooterLink> links = config.columns().stream()
            .flatMap(column -> column.links().stream())
            .toList();

        List<BlockNode> children = new ArrayList<>(3);
        if (!links.isEmpty()) {
            String line = links.stream()
                .map(l -> link(l.url(), l.text()))
                .collect(Collectors.joining(LINK_SEPARATOR));
            children.add(paragraph(line, "align", "center"));
        }
        if (!config.socialLinks().isEmpty()) {
            children.add(socialButtons(config.socialLinks(), map("border", map("radius", "50%"))));
        }
        children.add(copyright(config, "center"));

        return section("40px", "40px", children);
    }

    private static BlockNode mega(FooterConfig config) {
        List<BlockNode> children = new ArrayList<>();

        if (config.newsletterEnabled()) {
            children.add(stackedColumns(List.of(
                column(map("width", "40%"), List.of(
                    heading(3, "Stay Updated"),
                    paragraph("Subscribe to our newsletter for the latest updates.")
                )),
                column(map("width", "60%", "verticalAlignment", "center"), List.of(
                    buttons("right", List.of(button("Subscribe", "#newsletter")))
                ))
            )));
            children.add(separator("style", margin("40px", "40px")));
        }

        if (!config.columns().isEmpty()) {
            children.add(stackedColumns(linkColumns(config.columns(), map("typography", map("lineHeight", "2")))));
        }

        children.add(separator("style", margin("40px", "20px")));

        List<BlockNode> social = config.socialLinks().isEmpty()
            ? List.of()
            : List.of(paragraph(socialLine(config.socialLinks()), "align", "right", "fontSize", "small"));
        children.add(columns(map("verticalAlignment", "center", "isStackedOnMobile", true), List.of(
            column(map(), List.of(copyright(config, null))),
            column(map(), social)
        )));

        return group(map(
            "layout", constrained(),
            "style", padding("60px", "40px"),
            "backgroundColor", "tertiary"
        ), children);
    }

    private static List<BlockNode> linkColumns(List<FooterColumn> columns, Map<String, Object> listStyle) {
        List<BlockNode> result = new ArrayList<>(columns.size());
        for (FooterColumn footerColumn : columns) {
            List<BlockNode> items = footerColumn.links().stream()
                .map(l -> listItem(link(l.url(), l.text())))
                .toList();
            List<BlockNode> blocks = new ArrayList<>(2);
            if (hasText(footerColumn.title())) {
                blocks.add(heading(4, footerColumn.title()));
            }
            blocks.add(list(map("style", listStyle), items));
            result.add(column(map(), blocks));
        }
        return result;
    }

    private static BlockNode socialButtons(List<SocialLink> links, Map<String, Object> style) {
        List<BlockNode> result = links.stream()
            .map(s -> button(s.platform(), s.url(), "className", "is-style-outline", "style", style))
            .toList();
        return buttons("center", result);
    }

    private static String socialLine(List<SocialLink> links) {
        return links.stream()
            .map(s -> link(s.url(), s.platform()))
            .collect(Collectors.joining(LINK_SEPARATOR));
    }

    private static BlockNode copyright(FooterConfig config, String align) {
        return paragraph(config.copyright(), "align", align, "fontSize", "small");
    }

    private static Map<String, Object> margin(String top, String bottom) {
        return map("spacing", map("margin", map("top", top, "bottom", bottom)));
    }
}

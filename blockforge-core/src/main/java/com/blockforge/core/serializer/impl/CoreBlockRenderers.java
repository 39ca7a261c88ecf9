package com.blockforge.core.serializer.impl;

import com.blockforge.core.model.BlockNode;
import com.blockforge.core.model.CoreBlock;
import com.blockforge.core.serializer.BlockRenderer;
import com.blockforge.core.serializer.BlockSerializer;
import com.blockforge.core.serializer.CssClasses;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

import static com.blockforge.core.serializer.BlockMarkup.isSet;
import static com.blockforge.core.serializer.BlockMarkup.text;
import static com.blockforge.core.serializer.BlockMarkup.wrap;

/**
 * Rendering rules for the core block types.
 *
 * <h2>Leaf blocks</h2>
 * <ul>
 *   <li><b>heading:</b> {@code <hN class="wp-block-heading">}; level 2 is the default and is
 *       left out of the encoded attributes. A missing or out-of-range level renders as
 *       {@code <h2>}, and an out-of-range value is kept in the encoded attributes as given</li>
 *   <li><b>paragraph:</b> {@code <p>} with an optional alignment class</li>
 *   <li><b>image:</b> {@code <figure>} around {@code <img>} and an optional caption</li>
 *   <li><b>button:</b> wrapper {@code <div>} around a link; URL defaults to {@code #}</li>
 *   <li><b>spacer:</b> fixed-height {@code <div>}, 100px by default</li>
 *   <li><b>separator:</b> {@code <hr>}</li>
 *   <li><b>list-item:</b> {@code <li>}</li>
 * </ul>
 *
 * <h2>Container blocks</h2>
 * group, columns, column, buttons, cover, list, quote and details wrap their children's markup
 * in the block's HTML element.
 *
 * <p>Every rule reads attributes leniently: absent or mistyped values fall back to defaults.
 */
public final class CoreBlockRenderers {

    private static final String DEFAULT_SPACER_HEIGHT = "100px";
    private static final int DEFAULT_HEADING_LEVEL = 2;

    private CoreBlockRenderers() {
        // Utility class
    }

    /**
     * Returns the core rules keyed by namespaced block name.
     *
     * @return immutable rule registry
     */
    public static Map<String, BlockRenderer> defaults() {
        Map<CoreBlock, BlockRenderer> rules = new EnumMap<>(CoreBlock.class);
        rules.put(CoreBlock.HEADING, CoreBlockRenderers::heading);
        rules.put(CoreBlock.PARAGRAPH, CoreBlockRenderers::paragraph);
        rules.put(CoreBlock.IMAGE, CoreBlockRenderers::image);
        rules.put(CoreBlock.GROUP, CoreBlockRenderers::group);
        rules.put(CoreBlock.COLUMNS, (block, serializer) -> container(block, serializer, "wp-block-columns"));
        rules.put(CoreBlock.COLUMN, (block, serializer) -> container(block, serializer, "wp-block-column"));
        rules.put(CoreBlock.BUTTONS, (block, serializer) -> container(block, serializer, "wp-block-buttons"));
        rules.put(CoreBlock.BUTTON, CoreBlockRenderers::button);
        rules.put(CoreBlock.COVER, CoreBlockRenderers::cover);
        rules.put(CoreBlock.SPACER, CoreBlockRenderers::spacer);
        rules.put(CoreBlock.SEPARATOR, CoreBlockRenderers::separator);
        rules.put(CoreBlock.LIST, CoreBlockRenderers::list);
        rules.put(CoreBlock.LIST_ITEM, CoreBlockRenderers::listItem);
        rules.put(CoreBlock.QUOTE, CoreBlockRenderers::quote);
        rules.put(CoreBlock.DETAILS, CoreBlockRenderers::details);

        return Map.copyOf(rules.entrySet().stream()
            .collect(Collectors.toMap(e -> e.getKey().blockName(), Map.Entry::getValue)));
    }

    /**
     * Fallback rule for blocks without a dedicated rule.
     *
     * <p>Concatenates all text fragments, appends the children markup and wraps the result in
     * the comment pair.
     *
     * @param block block to render
     * @param serializer serializer for child blocks
     * @return block markup
     */
    public static String generic(BlockNode block, BlockSerializer serializer) {
        StringBuilder content = new StringBuilder();
        for (String fragment : block.innerContent()) {
            if (fragment != null) {
                content.append(fragment);
            }
        }
        content.append(serializer.serializeChildren(block));
        return wrap(block.name(), block.attributes(), content.toString());
    }

    static String heading(BlockNode block, BlockSerializer serializer) {
        Integer parsed = headingLevel(block.attribute("level"));
        int level = parsed == null ? DEFAULT_HEADING_LEVEL : parsed;
        String classes = CssClasses.join("wp-block-heading", CssClasses.textAlign(block.attribute("textAlign")));

        Map<String, Object> attributes = new LinkedHashMap<>(block.attributes());
        if (parsed != null && parsed == DEFAULT_HEADING_LEVEL) {
            attributes.remove("level");
        }

        String html = "<h" + level + " class=\"" + classes + "\">" + block.firstText() + "</h" + level + ">";
        return wrap(block.name(), attributes, html);
    }

    static String paragraph(BlockNode block, BlockSerializer serializer) {
        String classes = CssClasses.textAlign(block.attribute("align"));
        String classAttribute = classes.isEmpty() ? "" : " class=\"" + classes + "\"";
        return wrap(block.name(), block.attributes(), "<p" + classAttribute + ">" + block.firstText() + "</p>");
    }

    static String image(BlockNode block, BlockSerializer serializer) {
        StringBuilder img = new StringBuilder("<img src=\"").append(text(block.attribute("url"))).append('"');
        appendHtmlAttribute(img, "alt", block.attribute("alt"));
        appendHtmlAttribute(img, "width", block.attribute("width"));
        appendHtmlAttribute(img, "height", block.attribute("height"));
        img.append("/>");

        StringBuilder html = new StringBuilder("<figure class=\"wp-block-image\">").append(img);
        Object caption = block.attribute("caption");
        if (isSet(caption)) {
            html.append("<figcaption class=\"wp-element-caption\">").append(text(caption)).append("</figcaption>");
        }
        html.append("</figure>");

        return wrap(block.name(), block.attributes(), html.toString());
    }

    static String group(BlockNode block, BlockSerializer serializer) {
        String classes = CssClasses.join("wp-block-group", CssClasses.backgroundColor(block.attribute("backgroundColor")));
        return wrapChildren(block, serializer, "<div class=\"" + classes + "\">", "</div>");
    }

    static String container(BlockNode block, BlockSerializer serializer, String baseClass) {
        return wrapChildren(block, serializer, "<div class=\"" + baseClass + "\">", "</div>");
    }

    static String button(BlockNode block, BlockSerializer serializer) {
        String classes = CssClasses.join(
            "wp-block-button__link",
            "wp-element-button",
            CssClasses.backgroundColor(block.attribute("backgroundColor"))
        );
        Object url = block.attribute("url");
        String href = isSet(url) ? text(url) : "#";
        String label = block.firstText().isEmpty() ? text(block.attribute("text")) : block.firstText();

        String html = "<div class=\"wp-block-button\"><a class=\"" + classes + "\" href=\"" + href + "\">"
            + label + "</a></div>";
        return wrap(block.name(), block.attributes(), html);
    }

    static String cover(BlockNode block, BlockSerializer serializer) {
        Object url = block.attribute("url");
        Object dimRatio = block.attribute("dimRatio");
        Object overlayColor = block.attribute("overlayColor");

        String classes = CssClasses.join("wp-block-cover", CssClasses.backgroundColor(overlayColor));
        String style = isSet(url) ? " style=\"background-image:url(" + text(url) + ")\"" : "";
        String dim = isSet(dimRatio) ? "has-background-dim-" + text(dimRatio) : "has-background-dim";

        String html = "<div class=\"" + classes + "\"" + style + ">\n"
            + "<span aria-hidden=\"true\" class=\"wp-block-cover__background " + dim + "\"></span>\n"
            + "<div class=\"wp-block-cover__inner-container\">\n"
            + serializer.serializeChildren(block) + "\n"
            + "</div>\n"
            + "</div>";
        return wrap(block.name(), block.attributes(), html);
    }

    static String spacer(BlockNode block, BlockSerializer serializer) {
        Object height = block.attribute("height");
        String value = isSet(height) ? text(height) : DEFAULT_SPACER_HEIGHT;
        String html = "<div style=\"height:" + value + "\" aria-hidden=\"true\" class=\"wp-block-spacer\"></div>";
        return wrap(block.name(), block.attributes(), html);
    }

    static String separator(BlockNode block, BlockSerializer serializer) {
        String classes = CssClasses.join("wp-block-separator", text(block.attribute("className")));
        return wrap(block.name(), block.attributes(), "<hr class=\"" + classes + "\"/>");
    }

    static String list(BlockNode block, BlockSerializer serializer) {
        String tag = Boolean.TRUE.equals(block.attribute("ordered")) ? "ol" : "ul";
        return wrapChildren(block, serializer, "<" + tag + " class=\"wp-block-list\">", "</" + tag + ">");
    }

    static String listItem(BlockNode block, BlockSerializer serializer) {
        return wrap(block.name(), block.attributes(), "<li>" + block.firstText() + "</li>");
    }

    static String quote(BlockNode block, BlockSerializer serializer) {
        String classes = CssClasses.join("wp-block-quote", text(block.attribute("className")));
        return wrapChildren(block, serializer, "<blockquote class=\"" + classes + "\">", "</blockquote>");
    }

    static String details(BlockNode block, BlockSerializer serializer) {
        String opening = "<details class=\"wp-block-details\"><summary>" + text(block.attribute("summary")) + "</summary>";
        return wrapChildren(block, serializer, opening, "</details>");
    }

    private static String wrapChildren(BlockNode block, BlockSerializer serializer, String openTag, String closeTag) {
        String html = openTag + "\n" + serializer.serializeChildren(block) + "\n" + closeTag;
        return wrap(block.name(), block.attributes(), html);
    }

    private static void appendHtmlAttribute(StringBuilder target, String name, Object value) {
        if (isSet(value)) {
            target.append(' ').append(name).append("=\"").append(text(value)).append('"');
        }
    }

    /**
     * Parses a heading level in 1..6.
     *
     * @return the level, or {@code null} when absent or out of range
     */
    private static Integer headingLevel(Object level) {
        if (level instanceof Number number && number.intValue() >= 1 && number.intValue() <= 6) {
            return number.intValue();
        }
        if (level instanceof String s) {
            try {
                int parsed = Integer.parseInt(s.trim());
                return parsed >= 1 && parsed <= 6 ? parsed : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}

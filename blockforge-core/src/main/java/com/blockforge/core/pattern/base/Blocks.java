package com.blockforge.core.pattern.base;

import com.blockforge.core.model.BlockNode;
import com.blockforge.core.model.CoreBlock;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Factory methods for the core blocks used by the pattern generators.
 *
 * <p>Attribute arguments are given as alternating key/value pairs; pairs with a {@code null}
 * value are skipped, so optional attributes never reach the block.
 *
 * <pre>{@code
 * BlockNode title = Blocks.heading(2, "Features", "textAlign", "center");
 * BlockNode row = Blocks.columns(Blocks.map("isStackedOnMobile", true), List.of(left, right));
 * }</pre>
 */
public final class Blocks {

    /** Padding of regular content sections */
    public static final String SECTION_PADDING = "60px";

    private static final List<String> CUSTOM_COLOR_PREFIXES = List.of("#", "rgb", "hsl");

    private Blocks() {
        // Utility class
    }

    // ---------------------------------------------------------------- attribute maps

    /**
     * Builds an ordered map from key/value pairs, skipping null values.
     *
     * @param keyValues alternating String keys and values
     * @return mutable ordered map
     * @throws IllegalArgumentException if the pairs are incomplete or a key is not a String
     */
    public static Map<String, Object> map(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs but got " + keyValues.length + " arguments");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            if (!(keyValues[i] instanceof String key)) {
                throw new IllegalArgumentException("Attribute key must be a String: " + keyValues[i]);
            }
            if (keyValues[i + 1] != null) {
                result.put(key, keyValues[i + 1]);
            }
        }
        return result;
    }

    /**
     * Flow layout constrained to the theme content width.
     *
     * @return layout attribute value
     */
    public static Map<String, Object> constrained() {
        return map("type", "constrained");
    }

    /**
     * Constrained layout with its own content width.
     *
     * @param contentSize content width (e.g. {@code 800px})
     * @return layout attribute value
     */
    public static Map<String, Object> constrained(String contentSize) {
        return map("type", "constrained", "contentSize", contentSize);
    }

    /**
     * Horizontal flex layout.
     *
     * @param justifyContent justification (left, center, right, space-between)
     * @return layout attribute value
     */
    public static Map<String, Object> flex(String justifyContent) {
        return map("type", "flex", "justifyContent", justifyContent);
    }

    /**
     * Style attribute with vertical padding.
     *
     * @param top top padding
     * @param bottom bottom padding
     * @return style attribute value
     */
    public static Map<String, Object> padding(String top, String bottom) {
        return map("spacing", map("padding", map("top", top, "bottom", bottom)));
    }

    /**
     * Style attribute with padding on all four sides.
     *
     * @param top top padding
     * @param bottom bottom padding
     * @param left left padding
     * @param right right padding
     * @return style attribute value
     */
    public static Map<String, Object> padding(String top, String bottom, String left, String right) {
        return map("spacing", map("padding", map("top", top, "bottom", bottom, "left", left, "right", right)));
    }

    /**
     * Style attribute rendering text in italics.
     *
     * @return style attribute value
     */
    public static Map<String, Object> italic() {
        return map("typography", map("fontStyle", "italic"));
    }

    /**
     * Adds a background color to block attributes.
     *
     * <p>Values starting with {@code #}, {@code rgb} or {@code hsl} are custom colors and go to
     * {@code style.color.background}. Any other value is a palette slug and becomes the
     * {@code backgroundColor} attribute (rendered as {@code has-<slug>-background-color}).
     *
     * @param attributes block attributes
     * @param color color value or palette slug, may be null
     * @return copy of the attributes including the background, unchanged when no color is set
     */
    public static Map<String, Object> withBackground(Map<String, Object> attributes, String color) {
        Map<String, Object> result = new LinkedHashMap<>(attributes);
        if (!hasText(color)) {
            return result;
        }
        String value = color.trim();
        if (isCustomColor(value)) {
            Map<String, Object> style = result.get("style") instanceof Map<?, ?> existing
                ? copy(existing)
                : new LinkedHashMap<>();
            style.put("color", map("background", value));
            result.put("style", style);
        } else {
            result.put("backgroundColor", value);
        }
        return result;
    }

    /**
     * Whether a color value is a literal color rather than a palette slug.
     *
     * @param color color value
     * @return true for hex, rgb(a) and hsl(a) values
     */
    public static boolean isCustomColor(String color) {
        if (color == null) {
            return false;
        }
        String value = color.trim().toLowerCase(Locale.ROOT);
        return CUSTOM_COLOR_PREFIXES.stream().anyMatch(value::startsWith);
    }

    // ---------------------------------------------------------------- leaf blocks

    public static BlockNode heading(int level, String text, Object... attributes) {
        Map<String, Object> attrs = map("level", level);
        attrs.putAll(map(attributes));
        return BlockNode.leaf(CoreBlock.HEADING.blockName(), attrs, text);
    }

    /**
     * Level 2 centered heading opening a content section.
     *
     * @param title heading text
     * @return heading block
     */
    public static BlockNode sectionTitle(String title) {
        return heading(2, title, "textAlign", "center");
    }

    public static BlockNode paragraph(String text, Object... attributes) {
        return BlockNode.leaf(CoreBlock.PARAGRAPH.blockName(), map(attributes), text);
    }

    public static BlockNode spacer(String height) {
        return BlockNode.empty(CoreBlock.SPACER.blockName(), map("height", height));
    }

    public static BlockNode separator(Object... attributes) {
        return BlockNode.empty(CoreBlock.SEPARATOR.blockName(), map(attributes));
    }

    public static BlockNode image(String url, String alt, Object... attributes) {
        Map<String, Object> attrs = map("url", url, "alt", alt);
        attrs.putAll(map(attributes));
        return BlockNode.empty(CoreBlock.IMAGE.blockName(), attrs);
    }

    /**
     * Button block; the label is both the visible text and the {@code text} attribute.
     *
     * @param text button label
     * @param url link target, may be null (renders as {@code #})
     * @param attributes additional attributes
     * @return button block
     */
    public static BlockNode button(String text, String url, Object... attributes) {
        Map<String, Object> attrs = map("url", url, "text", text);
        attrs.putAll(map(attributes));
        return BlockNode.leaf(CoreBlock.BUTTON.blockName(), attrs, text);
    }

    public static BlockNode listItem(String html) {
        return BlockNode.leaf(CoreBlock.LIST_ITEM.blockName(), Map.of(), html);
    }

    // ---------------------------------------------------------------- containers

    public static BlockNode group(Map<String, Object> attributes, List<BlockNode> children) {
        return BlockNode.container(CoreBlock.GROUP.blockName(), attributes, children);
    }

    /**
     * Constrained group with vertical padding, the outer block of most sections.
     *
     * @param paddingTop top padding
     * @param paddingBottom bottom padding
     * @param children section content
     * @return section group
     */
    public static BlockNode section(String paddingTop, String paddingBottom, List<BlockNode> children) {
        return group(map("layout", constrained(), "style", padding(paddingTop, paddingBottom)), children);
    }

    public static BlockNode columns(Map<String, Object> attributes, List<BlockNode> children) {
        return BlockNode.container(CoreBlock.COLUMNS.blockName(), attributes, children);
    }

    /**
     * Columns block that stacks on small screens.
     *
     * @param children column blocks
     * @return columns block
     */
    public static BlockNode stackedColumns(List<BlockNode> children) {
        return columns(map("isStackedOnMobile", true), children);
    }

    public static BlockNode column(Map<String, Object> attributes, List<BlockNode> children) {
        return BlockNode.container(CoreBlock.COLUMN.blockName(), attributes, children);
    }

    public static BlockNode buttons(String justifyContent, List<BlockNode> buttons) {
        return BlockNode.container(CoreBlock.BUTTONS.blockName(), map("layout", flex(justifyContent)), buttons);
    }

    public static BlockNode cover(Map<String, Object> attributes, List<BlockNode> children) {
        return BlockNode.container(CoreBlock.COVER.blockName(), attributes, children);
    }

    public static BlockNode list(Map<String, Object> attributes, List<BlockNode> items) {
        return BlockNode.container(CoreBlock.LIST.blockName(), attributes, items);
    }

    public static BlockNode quote(Map<String, Object> attributes, List<BlockNode> children) {
        return BlockNode.container(CoreBlock.QUOTE.blockName(), attributes, children);
    }

    public static BlockNode details(String summary, List<BlockNode> children) {
        return BlockNode.container(CoreBlock.DETAILS.blockName(), map("summary", summary), children);
    }

    // ---------------------------------------------------------------- text and lists

    /**
     * Whether an optional text field is present.
     *
     * @param value field value
     * @return true if non-null and not blank
     */
    public static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    /**
     * Inline link markup.
     *
     * @param url link target
     * @param text link text
     * @return {@code <a href="url">text</a>}
     */
    public static String link(String url, String text) {
        return "<a href=\"" + (hasText(url) ? url : "#") + "\">" + (text == null ? "" : text) + "</a>";
    }

    /**
     * Splits items into consecutive rows of a fixed size; the last row may be shorter.
     *
     * @param items items in input order
     * @param size row size
     * @param <T> item type
     * @return rows in input order
     * @throws IllegalArgumentException if size is not positive
     */
    public static <T> List<List<T>> chunk(List<T> items, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + size);
        }
        List<List<T>> rows = new ArrayList<>();
        for (int start = 0; start < items.size(); start += size) {
            rows.add(List.copyOf(items.subList(start, Math.min(start + size, items.size()))));
        }
        return rows;
    }

    /**
     * Selects the items at even (0, 2, ...) or odd (1, 3, ...) positions.
     *
     * @param items items in input order
     * @param even true for even positions
     * @param <T> item type
     * @return selected items in input order
     */
    public static <T> List<T> byParity(List<T> items, boolean even) {
        List<T> selected = new ArrayList<>();
        for (int i = even ? 0 : 1; i < items.size(); i += 2) {
            selected.add(items.get(i));
        }
        return selected;
    }

    private static Map<String, Object> copy(Map<?, ?> source) {
        Map<String, Object> result = new LinkedHashMap<>();
        source.forEach((key, value) -> result.put(String.valueOf(key), value));
        return result;
    }
}

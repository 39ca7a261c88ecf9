package com.blockforge.core.serializer;

import com.blockforge.core.model.CoreBlock;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Low-level pieces of the block grammar: comment delimiters and attribute value helpers.
 *
 * <pre>{@code
 * <!-- wp:heading {"level":1} -->
 * <h1 class="wp-block-heading">Title</h1>
 * <!-- /wp:heading -->
 * }</pre>
 */
public final class BlockMarkup {

    private static final String OPEN_PREFIX = "<!-- wp:";
    private static final String CLOSE_PREFIX = "<!-- /wp:";
    private static final String COMMENT_SUFFIX = " -->";

    private BlockMarkup() {
        // Utility class
    }

    /**
     * Strips the core namespace from a block name.
     *
     * @param blockName namespaced name (e.g. {@code core/heading})
     * @return short name (e.g. {@code heading}); other namespaces are kept
     */
    public static String shortName(String blockName) {
        if (blockName.startsWith(CoreBlock.NAMESPACE_PREFIX)) {
            return blockName.substring(CoreBlock.NAMESPACE_PREFIX.length());
        }
        return blockName;
    }

    /**
     * Builds the opening comment.
     *
     * @param blockName namespaced block name
     * @param attributes attributes to encode
     * @return {@code <!-- wp:name {json} -->}, without the JSON part when no attribute remains
     */
    public static String openComment(String blockName, Map<String, ?> attributes) {
        String json = AttributeEncoder.encode(attributes);
        if (json.isEmpty()) {
            return OPEN_PREFIX + shortName(blockName) + COMMENT_SUFFIX;
        }
        return OPEN_PREFIX + shortName(blockName) + " " + json + COMMENT_SUFFIX;
    }

    /**
     * Builds the closing comment.
     *
     * @param blockName namespaced block name
     * @return {@code <!-- /wp:name -->}
     */
    public static String closeComment(String blockName) {
        return CLOSE_PREFIX + shortName(blockName) + COMMENT_SUFFIX;
    }

    /**
     * Wraps block HTML in its comment pair, one part per line.
     *
     * @param blockName namespaced block name
     * @param attributes attributes to encode
     * @param html block HTML
     * @return complete block markup
     */
    public static String wrap(String blockName, Map<String, ?> attributes, String html) {
        return openComment(blockName, attributes) + "\n" + html + "\n" + closeComment(blockName);
    }

    /**
     * Whether an attribute value counts as set: not null, false, zero, NaN, infinite or an
     * empty string.
     *
     * @param value attribute value
     * @return true if the value is set
     */
    public static boolean isSet(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return d != 0 && Double.isFinite(d);
        }
        return true;
    }

    /**
     * Renders an attribute value as HTML text.
     *
     * <p>Integral numbers are written without a fractional part; {@code null}, NaN and infinite
     * values become {@code ""}.
     *
     * @param value attribute value
     * @return text form
     */
    public static String text(Object value) {
        if (value == null) {
            return "";
        }
        if ((value instanceof Double || value instanceof Float) && !Double.isFinite(((Number) value).doubleValue())) {
            return "";
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            BigDecimal decimal = new BigDecimal(value.toString()).stripTrailingZeros();
            return decimal.scale() <= 0 ? decimal.toBigInteger().toString() : decimal.toPlainString();
        }
        return value.toString();
    }
}

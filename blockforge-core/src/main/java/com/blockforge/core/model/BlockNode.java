package com.blockforge.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One block instance in a block tree.
 *
 * <p>A block is identified by a namespaced {@code name} (e.g. {@code core/heading}), carries a
 * free-form attribute map and an ordered {@code innerContent} list. Each entry of
 * {@code innerContent} is either a literal text/HTML fragment or {@code null}, which marks the
 * position where the next child block renders. Container blocks hold their children in
 * {@code innerBlocks}; leaf blocks have an empty child list.
 *
 * <p>Instances are immutable: all collections are defensively copied and exposed read-only.
 * Attribute values may be {@code null}; they are dropped when attributes are encoded.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * BlockNode heading = BlockNode.leaf("core/heading", Map.of("level", 1), "Welcome");
 * BlockNode group = BlockNode.container("core/group", Map.of(), List.of(heading));
 * // group.innerContent() == [null]
 * }</pre>
 *
 * @param name namespaced block name
 * @param attributes block attributes, keyed by attribute name
 * @param innerContent text fragments and child placeholders ({@code null})
 * @param innerBlocks child blocks, empty for leaf blocks
 */
public record BlockNode(
    String name,
    Map<String, Object> attributes,
    List<String> innerContent,
    List<BlockNode> innerBlocks
) {
    /**
     * Compact constructor with validation and defensive copies.
     */
    public BlockNode {
        Objects.requireNonNull(name, "name must not be null");
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        // List.copyOf rejects null elements, and null is the child placeholder
        innerContent = innerContent == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(innerContent));
        innerBlocks = innerBlocks == null ? List.of() : List.copyOf(innerBlocks);
    }

    /**
     * Creates a leaf block whose only content is a single text fragment.
     *
     * @param name block name
     * @param attributes block attributes
     * @param text rendered text; {@code null} is stored as an empty string
     * @return leaf block
     */
    public static BlockNode leaf(String name, Map<String, Object> attributes, String text) {
        return new BlockNode(name, attributes, List.of(text == null ? "" : text), List.of());
    }

    /**
     * Creates a leaf block without any content (spacer, separator, image).
     *
     * @param name block name
     * @param attributes block attributes
     * @return content-less block
     */
    public static BlockNode empty(String name, Map<String, Object> attributes) {
        return new BlockNode(name, attributes, List.of(), List.of());
    }

    /**
     * Creates a container block with one placeholder per child.
     *
     * @param name block name
     * @param attributes block attributes
     * @param children child blocks, in render order
     * @return container block
     */
    public static BlockNode container(String name, Map<String, Object> attributes, List<BlockNode> children) {
        List<String> placeholders = new ArrayList<>(children.size());
        for (int i = 0; i < children.size(); i++) {
            placeholders.add(null);
        }
        return new BlockNode(name, attributes, placeholders, children);
    }

    /**
     * Returns whether this block has child blocks.
     *
     * @return true if at least one child block exists
     */
    public boolean hasInnerBlocks() {
        return !innerBlocks.isEmpty();
    }

    /**
     * Counts the child placeholders in {@link #innerContent()}.
     *
     * @return number of {@code null} entries
     */
    public int placeholderCount() {
        int count = 0;
        for (String fragment : innerContent) {
            if (fragment == null) {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns the first text fragment, or an empty string when there is none.
     *
     * @return first content fragment or {@code ""}
     */
    public String firstText() {
        if (innerContent.isEmpty() || innerContent.get(0) == null) {
            return "";
        }
        return innerContent.get(0);
    }

    /**
     * Gets an attribute value.
     *
     * @param key attribute name
     * @return attribute value or null
     */
    public Object attribute(String key) {
        return attributes.get(key);
    }
}

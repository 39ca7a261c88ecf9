package com.blockforge.core.serializer;

import com.blockforge.core.model.BlockNode;
import com.blockforge.core.serializer.impl.CoreBlockRenderers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Serializes block trees into the comment-delimited block grammar.
 *
 * <p>Rendering rules are looked up by block name in an immutable registry. Names without a
 * registered rule use the generic rule (text fragments followed by child markup), so any block
 * tree can be serialized.
 *
 * <p><b>Output layout:</b>
 * <ul>
 *   <li>Each block: opening comment, block HTML and closing comment on separate lines</li>
 *   <li>Children inside a container: joined by a single line break</li>
 *   <li>Root blocks of a sequence: joined by a blank line</li>
 * </ul>
 *
 * <p>Block content is written as-is: it is treated as trusted markup and is not escaped.
 * Attribute JSON uses standard JSON string escaping, and its keys are written in sorted order
 * rather than insertion order (e.g. {@code {"align":"full","layout":{...}}}), see
 * {@link AttributeEncoder}.
 *
 * <p>Serialization recurses once per tree level; trees a few hundred levels deep are supported
 * with the default thread stack size.
 *
 * <p>Instances are immutable and may be shared between threads.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * BlockSerializer serializer = new BlockSerializer();
 * String markup = serializer.serialize(List.of(heroBlock, featuresBlock));
 * }</pre>
 */
public class BlockSerializer {

    private static final Logger log = LoggerFactory.getLogger(BlockSerializer.class);

    /** Separator between root blocks */
    public static final String ROOT_SEPARATOR = "\n\n";

    /** Separator between sibling child blocks */
    public static final String CHILD_SEPARATOR = "\n";

    private final Map<String, BlockRenderer> renderers;

    /**
     * Creates a serializer with the core block rules.
     */
    public BlockSerializer() {
        this(Map.of());
    }

    /**
     * Creates a serializer with the core block rules plus additional rules.
     *
     * <p>Additional rules replace core rules registered under the same name.
     *
     * @param additionalRenderers extra rules keyed by namespaced block name
     */
    public BlockSerializer(Map<String, BlockRenderer> additionalRenderers) {
        Objects.requireNonNull(additionalRenderers, "additionalRenderers must not be null");
        Map<String, BlockRenderer> registry = new HashMap<>(CoreBlockRenderers.defaults());
        registry.putAll(additionalRenderers);
        this.renderers = Map.copyOf(registry);
    }

    /**
     * Serializes a single block and its descendants.
     *
     * @param block root block
     * @return block markup
     */
    public String serialize(BlockNode block) {
        Objects.requireNonNull(block, "block must not be null");
        BlockRenderer renderer = renderers.get(block.name());
        if (renderer == null) {
            log.debug("No rendering rule for block '{}', using generic rule", block.name());
            renderer = CoreBlockRenderers::generic;
        }
        return renderer.render(block, this);
    }

    /**
     * Serializes a sequence of root blocks, separated by blank lines.
     *
     * @param blocks root blocks in document order
     * @return document markup
     */
    public String serialize(List<BlockNode> blocks) {
        Objects.requireNonNull(blocks, "blocks must not be null");
        StringJoiner joiner = new StringJoiner(ROOT_SEPARATOR);
        for (BlockNode block : blocks) {
            joiner.add(serialize(block));
        }
        return joiner.toString();
    }

    /**
     * Serializes the children of a container block, separated by single line breaks.
     *
     * @param block container block
     * @return children markup, or {@code ""} when the block has no children
     */
    public String serializeChildren(BlockNode block) {
        StringJoiner joiner = new StringJoiner(CHILD_SEPARATOR);
        for (BlockNode child : block.innerBlocks()) {
            joiner.add(serialize(child));
        }
        return joiner.toString();
    }

    /**
     * Returns whether a dedicated rule is registered for a block name.
     *
     * @param blockName namespaced block name
     * @return true if a rule exists; false means the generic rule applies
     */
    public boolean hasRenderer(String blockName) {
        return renderers.containsKey(blockName);
    }
}

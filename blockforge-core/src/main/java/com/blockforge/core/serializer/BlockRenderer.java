package com.blockforge.core.serializer;

import com.blockforge.core.model.BlockNode;

/**
 * Rendering rule for one block type.
 *
 * <p>A renderer produces the complete markup of a block: opening comment, block HTML and
 * closing comment. Container renderers obtain their children's markup through
 * {@link BlockSerializer#serializeChildren(BlockNode)}, so nested blocks are dispatched by name
 * like root blocks.
 *
 * <p>Renderers must be total: missing or malformed attributes degrade to defaults instead of
 * throwing.
 */
@FunctionalInterface
public interface BlockRenderer {

    /**
     * Renders a block to markup.
     *
     * @param block the block to render
     * @param serializer serializer used for child blocks
     * @return full block markup
     */
    String render(BlockNode block, BlockSerializer serializer);
}

package com.blockforge.core.model;

/**
 * Core block types emitted by the pattern generators and understood by the serializer.
 */
public enum CoreBlock {
    HEADING("core/heading"),
    PARAGRAPH("core/paragraph"),
    IMAGE("core/image"),
    GROUP("core/group"),
    COLUMNS("core/columns"),
    COLUMN("core/column"),
    BUTTONS("core/buttons"),
    BUTTON("core/button"),
    COVER("core/cover"),
    SPACER("core/spacer"),
    SEPARATOR("core/separator"),
    LIST("core/list"),
    LIST_ITEM("core/list-item"),
    QUOTE("core/quote"),
    DETAILS("core/details");

    /** Namespace prefix stripped from block names in the markup comments */
    public static final String NAMESPACE_PREFIX = "core/";

    private final String blockName;

    CoreBlock(String blockName) {
        this.blockName = blockName;
    }

    /**
     * Returns the namespaced block name (e.g. {@code core/heading}).
     *
     * @return block name
     */
    public String blockName() {
        return blockName;
    }
}

package com.blockforge.core.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link BlockNode}.
 */
class BlockNodeTest {

    @Test
    void leaf_withText_hasSingleFragmentAndNoChildren() {
        BlockNode node = BlockNode.leaf("core/paragraph", Map.of(), "Hello");

        assertThat(node.innerContent()).containsExactly("Hello");
        assertThat(node.innerBlocks()).isEmpty();
        assertThat(node.hasInnerBlocks()).isFalse();
        assertThat(node.placeholderCount()).isZero();
    }

    @Test
    void leaf_withNullText_storesEmptyString() {
        BlockNode node = BlockNode.leaf("core/paragraph", null, null);

        assertThat(node.firstText()).isEmpty();
        assertThat(node.attributes()).isEmpty();
    }

    @Test
    void container_createsOnePlaceholderPerChild() {
        BlockNode child = BlockNode.leaf("core/paragraph", Map.of(), "a");

        BlockNode node = BlockNode.container("core/group", Map.of(), List.of(child, child, child));

        assertThat(node.placeholderCount()).isEqualTo(3);
        assertThat(node.innerContent()).containsOnlyNulls();
        assertThat(node.innerBlocks()).hasSize(3);
    }

    @Test
    void empty_hasNoContent() {
        BlockNode node = BlockNode.empty("core/spacer", Map.of("height", "10px"));

        assertThat(node.innerContent()).isEmpty();
        assertThat(node.firstText()).isEmpty();
        assertThat(node.attribute("height")).isEqualTo("10px");
    }

    @Test
    void constructor_withNullName_throwsException() {
        assertThatThrownBy(() -> new BlockNode(null, Map.of(), List.of(), List.of()))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("name");
    }

    @Test
    void constructor_copiesCollections() {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("level", 1);
        List<String> content = new ArrayList<>(Arrays.asList("x", null));
        List<BlockNode> children = new ArrayList<>(List.of(BlockNode.leaf("core/paragraph", Map.of(), "c")));

        BlockNode node = new BlockNode("core/group", attributes, content, children);
        attributes.put("level", 2);
        content.add("y");
        children.clear();

        assertThat(node.attribute("level")).isEqualTo(1);
        assertThat(node.innerContent()).containsExactly("x", null);
        assertThat(node.innerBlocks()).hasSize(1);
    }

    @Test
    void attributes_acceptNullValues() {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("url", null);

        BlockNode node = BlockNode.empty("core/image", attributes);

        assertThat(node.attributes()).containsKey("url");
        assertThat(node.attribute("url")).isNull();
    }

    @Test
    void collections_areUnmodifiable() {
        BlockNode node = BlockNode.leaf("core/paragraph", Map.of("align", "center"), "x");

        assertThatThrownBy(() -> node.attributes().put("align", "left"))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> node.innerContent().add("y"))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}

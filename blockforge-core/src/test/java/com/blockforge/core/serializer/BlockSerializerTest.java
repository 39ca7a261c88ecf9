package com.blockforge.core.serializer;

import com.blockforge.core.model.BlockNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link BlockSerializer}.
 */
class BlockSerializerTest {

    private BlockSerializer serializer;

    @BeforeEach
    void setUp() {
        serializer = new BlockSerializer();
    }

    @Test
    void serialize_headingWithoutLevel_rendersH2WithoutAttributes() {
        BlockNode heading = BlockNode.leaf("core/heading", Map.of(), "Welcome");

        assertThat(serializer.serialize(heading)).isEqualTo(
            "<!-- wp:heading -->\n<h2 class=\"wp-block-heading\">Welcome</h2>\n<!-- /wp:heading -->");
    }

    @Test
    void serialize_spacerWithHeight_rendersExactMarkup() {
        BlockNode spacer = BlockNode.empty("core/spacer", Map.of("height", "50px"));

        assertThat(serializer.serialize(spacer)).isEqualTo(
            "<!-- wp:spacer {\"height\":\"50px\"} -->\n"
                + "<div style=\"height:50px\" aria-hidden=\"true\" class=\"wp-block-spacer\"></div>\n"
                + "<!-- /wp:spacer -->");
    }

    @Test
    void serialize_twoRoots_joinsWithOneBlankLine() {
        BlockNode first = BlockNode.leaf("core/paragraph", Map.of(), "one");
        BlockNode second = BlockNode.leaf("core/paragraph", Map.of(), "two");

        String markup = serializer.serialize(List.of(first, second));

        assertThat(markup).isEqualTo(
            "<!-- wp:paragraph -->\n<p>one</p>\n<!-- /wp:paragraph -->\n\n"
                + "<!-- wp:paragraph -->\n<p>two</p>\n<!-- /wp:paragraph -->");
    }

    @Test
    void serialize_emptyList_returnsEmptyString() {
        assertThat(serializer.serialize(List.of())).isEmpty();
    }

    @Test
    void serialize_container_nestsChildrenOnSeparateLines() {
        BlockNode group = BlockNode.container("core/group", Map.of(), List.of(
            BlockNode.leaf("core/paragraph", Map.of(), "a"),
            BlockNode.leaf("core/paragraph", Map.of(), "b")
        ));

        assertThat(serializer.serialize(group)).isEqualTo(
            "<!-- wp:group -->\n"
                + "<div class=\"wp-block-group\">\n"
                + "<!-- wp:paragraph -->\n<p>a</p>\n<!-- /wp:paragraph -->\n"
                + "<!-- wp:paragraph -->\n<p>b</p>\n<!-- /wp:paragraph -->\n"
                + "</div>\n"
                + "<!-- /wp:group -->");
    }

    @Test
    void serialize_unknownBlock_usesGenericRuleWithFullName() {
        BlockNode widget = BlockNode.leaf("acme/widget", Map.of("size", 2), "<span>w</span>");

        assertThat(serializer.serialize(widget)).isEqualTo(
            "<!-- wp:acme/widget {\"size\":2} -->\n<span>w</span>\n<!-- /wp:acme/widget -->");
    }

    @Test
    void serialize_unknownBlockWithChildren_appendsChildMarkup() {
        BlockNode wrapper = new BlockNode("acme/wrapper", Map.of(),
            Arrays.asList("<div>", null),
            List.of(BlockNode.leaf("core/paragraph", Map.of(), "x")));

        assertThat(serializer.serialize(wrapper))
            .startsWith("<!-- wp:acme/wrapper -->\n<div><!-- wp:paragraph -->")
            .endsWith("<!-- /wp:acme/wrapper -->");
    }

    @Test
    void serialize_contentIsNotEscaped() {
        BlockNode paragraph = BlockNode.leaf("core/paragraph", Map.of(), "<strong>Bold</strong> & more");

        assertThat(serializer.serialize(paragraph)).contains("<p><strong>Bold</strong> & more</p>");
    }

    @Test
    void serialize_deeplyNestedTree_completes() {
        BlockNode node = BlockNode.leaf("core/paragraph", Map.of(), "deep");
        for (int i = 0; i < 256; i++) {
            node = BlockNode.container("core/group", Map.of(), List.of(node));
        }

        String markup = serializer.serialize(node);

        assertThat(markup.split("<!-- wp:group -->", -1)).hasSize(257);
        assertThat(markup).contains("<p>deep</p>");
    }

    @Test
    void serialize_withAdditionalRenderer_overridesCoreRule() {
        BlockSerializer custom = new BlockSerializer(Map.of(
            "core/paragraph", (block, s) -> "P:" + block.firstText()));

        assertThat(custom.serialize(BlockNode.leaf("core/paragraph", Map.of(), "x"))).isEqualTo("P:x");
        assertThat(custom.hasRenderer("core/heading")).isTrue();
    }

    @Test
    void hasRenderer_forUnknownName_returnsFalse() {
        assertThat(serializer.hasRenderer("acme/widget")).isFalse();
        assertThat(serializer.hasRenderer("core/details")).isTrue();
    }

    @Test
    void serialize_nullBlock_throwsException() {
        assertThatThrownBy(() -> serializer.serialize((BlockNode) null))
            .isInstanceOf(NullPointerException.class);
    }
}

package com.blockforge.core.serializer.impl;

import com.blockforge.core.model.BlockNode;
import com.blockforge.core.model.CoreBlock;
import com.blockforge.core.serializer.BlockSerializer;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the core block rendering rules.
 */
class CoreBlockRenderersTest {

    private final BlockSerializer serializer = new BlockSerializer();

    @Test
    void defaults_coverEveryCoreBlock() {
        Map<String, ?> rules = CoreBlockRenderers.defaults();

        assertThat(rules).hasSize(CoreBlock.values().length);
        for (CoreBlock block : CoreBlock.values()) {
            assertThat(rules).containsKey(block.blockName());
        }
    }

    @Test
    void heading_withLevelAndAlignment_keepsLevelAttribute() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("textAlign", "center");
        attributes.put("level", 3);

        String markup = serializer.serialize(BlockNode.leaf("core/heading", attributes, "Title"));

        assertThat(markup).isEqualTo(
            "<!-- wp:heading {\"level\":3,\"textAlign\":\"center\"} -->\n"
                + "<h3 class=\"wp-block-heading has-text-align-center\">Title</h3>\n"
                + "<!-- /wp:heading -->");
    }

    @Test
    void heading_withLevelTwo_omitsLevelAttribute() {
        String markup = serializer.serialize(BlockNode.leaf("core/heading", Map.of("level", 2), "T"));

        assertThat(markup).startsWith("<!-- wp:heading -->\n<h2 ");
    }

    @Test
    void heading_withOutOfRangeLevel_keepsCallerAttribute() {
        String markup = serializer.serialize(BlockNode.leaf("core/heading", Map.of("level", 7), "T"));

        assertThat(markup).isEqualTo(
            "<!-- wp:heading {\"level\":7} -->\n"
                + "<h2 class=\"wp-block-heading\">T</h2>\n"
                + "<!-- /wp:heading -->");
    }

    @Test
    void heading_withInvalidLevel_fallsBackToH2() {
        assertThat(serializer.serialize(BlockNode.leaf("core/heading", Map.of("level", 9), "T")))
            .contains("<h2 class=\"wp-block-heading\">T</h2>");
        assertThat(serializer.serialize(BlockNode.leaf("core/heading", Map.of("level", "4"), "T")))
            .contains("<h4 class=\"wp-block-heading\">T</h4>");
    }

    @Test
    void paragraph_withAlign_addsAlignmentClass() {
        assertThat(serializer.serialize(BlockNode.leaf("core/paragraph", Map.of("align", "center"), "Hi")))
            .isEqualTo("<!-- wp:paragraph {\"align\":\"center\"} -->\n"
                + "<p class=\"has-text-align-center\">Hi</p>\n"
                + "<!-- /wp:paragraph -->");
    }

    @Test
    void image_withCaption_rendersFigcaption() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("url", "https://example.com/a.png");
        attributes.put("alt", "A");
        attributes.put("caption", "Caption");

        String markup = serializer.serialize(BlockNode.empty("core/image", attributes));

        assertThat(markup).contains(
            "<figure class=\"wp-block-image\"><img src=\"https://example.com/a.png\" alt=\"A\"/>"
                + "<figcaption class=\"wp-element-caption\">Caption</figcaption></figure>");
    }

    @Test
    void image_withoutOptionalAttributes_rendersSourceOnly() {
        String markup = serializer.serialize(BlockNode.empty("core/image", Map.of("url", "a.png")));

        assertThat(markup).contains("<figure class=\"wp-block-image\"><img src=\"a.png\"/></figure>");
    }

    @Test
    void button_withoutUrl_linksToHash() {
        String markup = serializer.serialize(BlockNode.leaf("core/button", Map.of("text", "Go"), "Go"));

        assertThat(markup).contains(
            "<div class=\"wp-block-button\"><a class=\"wp-block-button__link wp-element-button\" href=\"#\">Go</a></div>");
    }

    @Test
    void button_withoutText_usesTextAttribute() {
        BlockNode button = BlockNode.empty("core/button", Map.of("text", "Label", "url", "/x"));

        assertThat(serializer.serialize(button)).contains("href=\"/x\">Label</a>");
    }

    @Test
    void group_withBackgroundSlug_addsColorClass() {
        BlockNode group = BlockNode.container("core/group", Map.of("backgroundColor", "primary"), List.of());

        assertThat(serializer.serialize(group))
            .contains("<div class=\"wp-block-group has-primary-background-color\">");
    }

    @Test
    void columnsAndButtons_useTheirBaseClass() {
        BlockNode column = BlockNode.container("core/column", Map.of(), List.of());
        BlockNode columns = BlockNode.container("core/columns", Map.of(), List.of(column));
        BlockNode buttons = BlockNode.container("core/buttons", Map.of(), List.of());

        assertThat(serializer.serialize(columns))
            .contains("<div class=\"wp-block-columns\">")
            .contains("<div class=\"wp-block-column\">");
        assertThat(serializer.serialize(buttons)).contains("<div class=\"wp-block-buttons\">");
    }

    @Test
    void cover_withImageAndDim_rendersBackgroundAndOverlay() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("url", "bg.jpg");
        attributes.put("dimRatio", 70);

        String markup = serializer.serialize(BlockNode.container("core/cover", attributes,
            List.of(BlockNode.leaf("core/paragraph", Map.of(), "x"))));

        assertThat(markup)
            .contains("<div class=\"wp-block-cover\" style=\"background-image:url(bg.jpg)\">")
            .contains("class=\"wp-block-cover__background has-background-dim-70\"")
            .contains("<div class=\"wp-block-cover__inner-container\">\n<!-- wp:paragraph -->");
    }

    @Test
    void cover_withoutImage_hasNoStyle() {
        String markup = serializer.serialize(BlockNode.container("core/cover", Map.of(), List.of()));

        assertThat(markup)
            .contains("<div class=\"wp-block-cover\">")
            .contains("wp-block-cover__background has-background-dim\"");
    }

    @Test
    void spacer_withoutHeight_usesDefault() {
        assertThat(serializer.serialize(BlockNode.empty("core/spacer", Map.of())))
            .isEqualTo("<!-- wp:spacer -->\n"
                + "<div style=\"height:100px\" aria-hidden=\"true\" class=\"wp-block-spacer\"></div>\n"
                + "<!-- /wp:spacer -->");
    }

    @Test
    void separator_withClassName_appendsClass() {
        assertThat(serializer.serialize(BlockNode.empty("core/separator", Map.of("className", "is-style-wide"))))
            .contains("<hr class=\"wp-block-separator is-style-wide\"/>");
    }

    @Test
    void list_ordered_usesOl() {
        BlockNode item = BlockNode.leaf("core/list-item", Map.of(), "One");

        assertThat(serializer.serialize(BlockNode.container("core/list", Map.of("ordered", true), List.of(item))))
            .contains("<ol class=\"wp-block-list\">\n<!-- wp:list-item -->\n<li>One</li>\n<!-- /wp:list-item -->\n</ol>");
        assertThat(serializer.serialize(BlockNode.container("core/list", Map.of(), List.of(item))))
            .contains("<ul class=\"wp-block-list\">");
    }

    @Test
    void quote_wrapsChildrenInBlockquote() {
        BlockNode quote = BlockNode.container("core/quote", Map.of("className", "is-style-large"),
            List.of(BlockNode.leaf("core/paragraph", Map.of(), "Great")));

        assertThat(serializer.serialize(quote))
            .contains("<blockquote class=\"wp-block-quote is-style-large\">")
            .contains("</blockquote>");
    }

    @Test
    void details_rendersSummaryBeforeChildren() {
        BlockNode details = BlockNode.container("core/details", Map.of("summary", "Why?"),
            List.of(BlockNode.leaf("core/paragraph", Map.of(), "Because")));

        assertThat(serializer.serialize(details)).isEqualTo(
            "<!-- wp:details {\"summary\":\"Why?\"} -->\n"
                + "<details class=\"wp-block-details\"><summary>Why?</summary>\n"
                + "<!-- wp:paragraph -->\n<p>Because</p>\n<!-- /wp:paragraph -->\n"
                + "</details>\n"
                + "<!-- /wp:details -->");
    }

    @Test
    void generic_concatenatesFragmentsAndIgnoresPlaceholders() {
        BlockNode node = new BlockNode("acme/x", Map.of(), Arrays.asList("a", null, "b"), List.of());

        assertThat(CoreBlockRenderers.generic(node, serializer))
            .isEqualTo("<!-- wp:acme/x -->\nab\n<!-- /wp:acme/x -->");
    }
}

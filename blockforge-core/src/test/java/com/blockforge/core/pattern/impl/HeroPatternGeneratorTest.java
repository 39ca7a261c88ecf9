package com.blockforge.core.pattern.impl;

import com.blockforge.core.model.BlockNode;
import com.blockforge.core.model.section.HeroConfig;
import com.blockforge.core.pattern.SectionType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link HeroPatternGenerator}.
 */
class HeroPatternGeneratorTest extends PatternGeneratorTestBase {

    private final HeroPatternGenerator generator = new HeroPatternGenerator();

    private static HeroConfig full() {
        return new HeroConfig("Fresh bread", "Baked daily", "Order", "/order",
            "Menu", "/menu", "https://example.com/bread.jpg", 40, null);
    }

    @Test
    void metadata_describesHeroSection() {
        assertThat(generator.getId()).isEqualTo("hero");
        assertThat(generator.getSectionType()).isEqualTo(SectionType.HERO);
        assertThat(generator.getDefaultLayout()).isEqualTo("centered");
        assertThat(generator.getLayouts())
            .containsExactly("centered", "split-left", "split-right", "minimal", "fullscreen");
    }

    @Test
    void generate_centeredWithoutImage_buildsStackedGroup() {
        BlockNode root = generator.generate(HeroConfig.of("Welcome", "Hello there"), null);

        assertThat(root.name()).isEqualTo("core/group");
        assertThat(root.innerBlocks()).extracting(BlockNode::name)
            .containsExactly("core/heading", "core/paragraph");
        assertThat(root.innerBlocks().get(0).attribute("level")).isEqualTo(1);
        assertThat(findAll(root, "core/buttons")).isEmpty();
        assertWellFormed(root);
    }

    @Test
    void generate_centeredWithImage_buildsCover() {
        BlockNode root = generator.generate(full(), "centered");

        assertThat(root.name()).isEqualTo("core/cover");
        assertThat(root.attribute("url")).isEqualTo("https://example.com/bread.jpg");
        assertThat(root.attribute("dimRatio")).isEqualTo(40);
        assertThat(texts(root, "core/button")).containsExactly("Order", "Menu");
        assertWellFormed(root);
    }

    @Test
    void generate_buttonWithoutUrl_isOmitted() {
        HeroConfig config = new HeroConfig("H", null, "Order", null, null, null, null, null, null);

        BlockNode root = generator.generate(config, "centered");

        assertThat(findAll(root, "core/button")).isEmpty();
        assertThat(root.innerBlocks()).hasSize(1);
    }

    @Test
    void generate_splitLeft_putsContentFirst() {
        BlockNode root = generator.generate(full(), "split-left");

        BlockNode row = findAll(root, "core/columns").get(0);
        assertThat(row.innerBlocks().get(0).innerBlocks().get(0).name()).isEqualTo("core/heading");
        assertThat(row.innerBlocks().get(1).innerBlocks().get(0).name()).isEqualTo("core/image");
        assertWellFormed(root);
    }

    @Test
    void generate_split_resolvesToSplitLeftColumns() {
        assertThat(generator.resolveLayout("split")).isEqualTo(HeroPatternGenerator.Layout.SPLIT_LEFT);
        assertThat(generator.resolveLayout(" Split ")).isEqualTo(HeroPatternGenerator.Layout.SPLIT_LEFT);
        assertThat(generator.supportsLayout("split")).isTrue();

        BlockNode root = generator.generate(full(), "split");

        assertThat(root.name()).isEqualTo("core/group");
        assertThat(root.innerBlocks()).extracting(BlockNode::name).containsExactly("core/columns");
        BlockNode row = root.innerBlocks().get(0);
        assertThat(row.innerBlocks()).hasSize(2);
        assertThat(row.innerBlocks().get(0).innerBlocks().get(0).name()).isEqualTo("core/heading");
        assertThat(root).isEqualTo(generator.generate(full(), "split-left"));
    }

    @Test
    void generate_splitRight_putsMediaFirst() {
        BlockNode root = generator.generate(full(), "split-right");

        BlockNode row = findAll(root, "core/columns").get(0);
        assertThat(row.innerBlocks().get(0).innerBlocks().get(0).name()).isEqualTo("core/image");
    }

    @Test
    void generate_splitWithoutImage_leavesMediaColumnEmpty() {
        BlockNode root = generator.generate(HeroConfig.of("H", null), "split-left");

        assertThat(findAll(root, "core/image")).isEmpty();
        assertThat(findAll(root, "core/column")).hasSize(2);
        assertWellFormed(root);
    }

    @Test
    void generate_fullscreen_usesViewportCover() {
        BlockNode root = generator.generate(HeroConfig.of("H", null), "fullscreen");

        assertThat(root.name()).isEqualTo("core/cover");
        assertThat(root.attribute("minHeightUnit")).isEqualTo("vh");
        assertThat(root.attribute("dimRatio")).isEqualTo(60);
        assertThat(root.attributes()).doesNotContainKey("url");
        assertWellFormed(root);
    }

    @Test
    void generate_minimal_isFramedBySpacers() {
        BlockNode root = generator.generate(full(), "minimal");

        List<BlockNode> children = root.innerBlocks();
        assertThat(children.get(0).name()).isEqualTo("core/spacer");
        assertThat(children.get(children.size() - 1).name()).isEqualTo("core/spacer");
        assertThat(texts(root, "core/button")).containsExactly("Order");
    }

    @Test
    void generate_unknownLayout_fallsBackToCentered() {
        BlockNode fallback = generator.generate(full(), "diagonal");

        assertThat(fallback).isEqualTo(generator.generate(full(), "centered"));
    }

    @Test
    void generate_layoutIdIsCaseInsensitive() {
        assertThat(generator.generate(full(), " Split-Left ")).isEqualTo(generator.generate(full(), "split-left"));
    }

    @Test
    void generate_nullConfig_throwsException() {
        assertThatThrownBy(() -> generator.generate(null, "centered"))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void render_centered_containsLevelOneHeading() {
        String markup = render(generator.generate(HeroConfig.of("Welcome", null), null));

        assertThat(markup).contains("<h1 class=\"wp-block-heading has-text-align-center\">Welcome</h1>");
    }
}

package com.blockforge.core.pattern.impl;

import com.blockforge.core.model.BlockNode;
import com.blockforge.core.model.section.CtaConfig;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CtaPatternGenerator}.
 */
class CtaPatternGeneratorTest extends PatternGeneratorTestBase {

    private final CtaPatternGenerator generator = new CtaPatternGenerator();

    private static CtaConfig config(String backgroundColor, String backgroundImage) {
        return new CtaConfig("Ready?", "Start today", "Sign up", "/signup", "Learn more", "/about",
            backgroundColor, backgroundImage);
    }

    @Test
    void generate_centered_includesBothButtons() {
        BlockNode root = generator.generate(config(null, null), null);

        assertThat(root.name()).isEqualTo("core/group");
        assertThat(texts(root, "core/button")).containsExactly("Sign up", "Learn more");
        assertWellFormed(root);
    }

    @Test
    void generate_centeredWithImage_buildsCover() {
        BlockNode root = generator.generate(config(null, "bg.jpg"), "centered");

        assertThat(root.name()).isEqualTo("core/cover");
        assertThat(root.attribute("dimRatio")).isEqualTo(70);
    }

    @Test
    void generate_paletteSlug_setsBackgroundColorAttribute() {
        BlockNode root = generator.generate(config("primary", null), "centered");

        assertThat(root.attribute("backgroundColor")).isEqualTo("primary");
        assertThat(render(root)).contains("has-primary-background-color");
    }

    @Test
    @SuppressWarnings("unchecked")
    void generate_customColor_setsStyleBackground() {
        BlockNode root = generator.generate(config("#112233", null), "split");

        Map<String, Object> style = (Map<String, Object>) root.attribute("style");
        assertThat(style).containsEntry("color", Map.of("background", "#112233"));
        assertThat(style).containsKey("spacing");
        assertThat(root.attributes()).doesNotContainKey("backgroundColor");
    }

    @Test
    @SuppressWarnings("unchecked")
    void generate_bannerWithoutColor_usesDefaultBackground() {
        BlockNode root = generator.generate(config(null, null), "banner");

        Map<String, Object> style = (Map<String, Object>) root.attribute("style");
        assertThat(style).containsEntry("color", Map.of("background", "#1e40af"));
        assertThat(root.innerBlocks()).extracting(BlockNode::name)
            .containsExactly("core/paragraph", "core/buttons");
        assertWellFormed(root);
    }

    @Test
    void generate_cardWithoutButtonData_stillEmitsButtonLinkingToHash() {
        CtaConfig config = new CtaConfig("Heading", null, null, null, null, null, null, null);

        BlockNode root = generator.generate(config, "card");

        assertThat(findAll(root, "core/button")).hasSize(1);
        assertThat(render(root)).contains("href=\"#\"");
        assertWellFormed(root);
    }
}

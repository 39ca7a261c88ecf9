package com.blockforge.core.pattern.impl;

import com.blockforge.core.model.BlockNode;
import com.blockforge.core.model.section.TestimonialItem;
import com.blockforge.core.model.section.TestimonialsConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TestimonialsPatternGenerator}.
 */
class TestimonialsPatternGeneratorTest extends PatternGeneratorTestBase {

    private final TestimonialsPatternGenerator generator = new TestimonialsPatternGenerator();

    private static final TestimonialsConfig CONFIG = new TestimonialsConfig("Loved by bakers", null, List.of(
        new TestimonialItem("Best bread", "Ann", "Chef", "ann.jpg"),
        new TestimonialItem("So fresh", "Bob", null, null),
        new TestimonialItem("Great crust", "Cid", "Owner", null)
    ));

    @Test
    void generate_cards_oneColumnPerTestimonial() {
        BlockNode root = generator.generate(CONFIG, null);

        assertThat(findAll(root, "core/column")).hasSize(3);
        assertThat(findAll(root, "core/image")).hasSize(1);
        assertThat(render(root)).contains("<strong>Ann</strong><br/><em>Chef</em>");
        assertWellFormed(root);
    }

    @Test
    void generate_singleLarge_quotesFirstTestimonial() {
        BlockNode root = generator.generate(CONFIG, "single-large");

        List<BlockNode> quotes = findAll(root, "core/quote");
        assertThat(quotes).hasSize(1);
        assertThat(quotes.get(0).innerBlocks().get(0).firstText()).isEqualTo("Best bread");
        assertThat(texts(root, "core/paragraph")).contains("— Ann, Chef");
    }

    @Test
    void generate_singleLargeWithoutTestimonials_fallsBackToCards() {
        TestimonialsConfig empty = new TestimonialsConfig("T", null, null);

        BlockNode root = generator.generate(empty, "single-large");

        assertThat(findAll(root, "core/quote")).isEmpty();
        assertWellFormed(root);
    }

    @Test
    void generate_quoteWall_splitsByPosition() {
        BlockNode root = generator.generate(CONFIG, "quote-wall");

        List<BlockNode> columns = findAll(root, "core/column");
        assertThat(columns).hasSize(2);
        assertThat(columns.get(0).innerBlocks()).hasSize(2);
        assertThat(columns.get(1).innerBlocks()).hasSize(1);
        assertThat(render(columns.get(1))).contains("So fresh");
    }

    @Test
    void generate_centered_omitsMissingRole() {
        BlockNode root = generator.generate(CONFIG, "centered");

        assertThat(texts(root, "core/paragraph")).contains("<strong>Bob</strong>");
        assertWellFormed(root);
    }
}

package com.blockforge.core.pattern.impl;

import com.blockforge.core.model.BlockNode;
import com.blockforge.core.model.section.StatItem;
import com.blockforge.core.model.section.StatsConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link StatsPatternGenerator}.
 */
class StatsPatternGeneratorTest extends PatternGeneratorTestBase {

    private final StatsPatternGenerator generator = new StatsPatternGenerator();

    private static final List<StatItem> STATS = List.of(
        new StatItem("10k", "Loaves", null),
        new StatItem("25", "Years", "Since 1999"),
        new StatItem("4.9", "Rating", null)
    );

    @Test
    void generate_rowWithoutTitle_startsWithFigures() {
        BlockNode root = generator.generate(new StatsConfig(null, null, STATS, null), null);

        assertThat(root.innerBlocks()).extracting(BlockNode::name).containsExactly("core/columns");
        assertThat(root.innerBlocks().get(0).innerBlocks()).hasSize(3);
        assertThat(texts(root, "core/paragraph")).startsWith("<strong>10k</strong>", "Loaves");
        assertWellFormed(root);
    }

    @Test
    void generate_gridTwo_chunksByTwo() {
        BlockNode root = generator.generate(new StatsConfig("Numbers", null, STATS, null), "grid-2");

        assertThat(findAll(root, "core/columns")).extracting(row -> row.innerBlocks().size())
            .containsExactly(2, 1);
        assertThat(texts(root, "core/heading")).containsExactly("Numbers");
    }

    @Test
    void generate_bannerWithoutColor_usesPrimarySlug() {
        BlockNode root = generator.generate(new StatsConfig(null, null, STATS, null), "banner");

        assertThat(root.attribute("backgroundColor")).isEqualTo("primary");
        assertThat(render(root)).contains("has-primary-background-color");
        assertWellFormed(root);
    }
}

package com.blockforge.core.pattern.base;

import com.blockforge.core.model.BlockNode;
import com.blockforge.core.pattern.LayoutVariant;
import com.blockforge.core.pattern.SectionType;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AbstractPatternGeneratorTest {

    enum Shape implements LayoutVariant {
        WIDE("wide"),
        NARROW("narrow");

        private final String id;

        Shape(String id) {
            this.id = id;
        }

        @Override
        public String id() {
            return id;
        }
    }

    record Note(String text) {
    }

    static class NoteGenerator extends AbstractPatternGenerator<Note, Shape> {
        NoteGenerator(Map<Shape, Function<Note, BlockNode>> strategies) {
            super(SectionType.FAQ, "Notes", Note.class, Shape.class, Shape.WIDE, strategies);
        }
    }

    private static NoteGenerator complete() {
        return new NoteGenerator(Map.of(
            Shape.WIDE, note -> Blocks.paragraph("wide: " + note.text()),
            Shape.NARROW, note -> Blocks.paragraph("narrow: " + note.text())
        ));
    }

    @Test
    void constructor_missingStrategy_throwsIllegalState() {
        Map<Shape, Function<Note, BlockNode>> partial =
            Map.of(Shape.WIDE, note -> Blocks.paragraph(note.text()));

        assertThatThrownBy(() -> new NoteGenerator(partial))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("No composition strategy for layout 'narrow' of section 'faq'");
    }

    @Test
    void getLayouts_returnsIdsInDeclarationOrder() {
        NoteGenerator generator = complete();

        assertThat(generator.getLayouts()).containsExactly("wide", "narrow");
        assertThat(generator.getDefaultLayout()).isEqualTo("wide");
        assertThat(generator.getId()).isEqualTo("faq");
    }

    @Test
    void resolveLayout_matchesTrimmedIdIgnoringCase() {
        assertThat(complete().resolveLayout(" NARROW ")).isEqualTo(Shape.NARROW);
    }

    @Test
    void resolveLayout_missingOrUnknown_usesDefault() {
        NoteGenerator generator = complete();

        assertThat(generator.resolveLayout(null)).isEqualTo(Shape.WIDE);
        assertThat(generator.resolveLayout("")).isEqualTo(Shape.WIDE);
        assertThat(generator.resolveLayout("diagonal")).isEqualTo(Shape.WIDE);
    }

    @Test
    void generate_dispatchesToStrategy() {
        BlockNode block = complete().generate(new Note("hi"), "narrow");

        assertThat(block.firstText()).isEqualTo("narrow: hi");
    }

    @Test
    void supportsLayout_onlyDeclaredIds() {
        NoteGenerator generator = complete();

        assertThat(generator.supportsLayout("Wide")).isTrue();
        assertThat(generator.supportsLayout("diagonal")).isFalse();
        assertThat(generator.supportsLayout(null)).isFalse();
    }

    @Test
    void generate_nullConfig_throwsNullPointer() {
        assertThatThrownBy(() -> complete().generate(null, "wide"))
            .isInstanceOf(NullPointerException.class);
    }
}

package com.blockforge.core.output.impl;

import com.blockforge.core.output.ArtifactType;
import com.blockforge.core.output.GeneratedFile;
import com.blockforge.core.output.GeneratedOutput;
import com.blockforge.core.output.RenderContext;
import com.blockforge.core.output.RendererTestBase;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest extends RendererTestBase {

    private final FileSystemRenderer renderer = new FileSystemRenderer();

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_writesFilesIntoNestedDirectories() throws IOException {
        // Given
        GeneratedFile home = page("pages/home.html", "<!-- wp:spacer /-->");
        GeneratedFile theme = new GeneratedFile("theme.json", "{}", ArtifactType.THEME_DESCRIPTOR);

        // When
        renderer.render(output(home, theme), context);

        // Then
        assertThat(readFile("pages/home.html")).isEqualTo("<!-- wp:spacer /-->");
        assertThat(readFile("theme.json")).isEqualTo("{}");
    }

    @Test
    void render_preservesUnicodeContent() throws IOException {
        renderer.render(output(page("pages/cafe.html", "Café · 日本語 ★")), context);

        assertThat(readFile("pages/cafe.html")).isEqualTo("Café · 日本語 ★");
    }

    @Test
    void render_overwritesExistingFile() throws IOException {
        renderer.render(output(page("index.html", "old")), context);
        renderer.render(output(page("index.html", "new")), context);

        assertThat(readFile("index.html")).isEqualTo("new");
    }

    @Test
    void render_createsMissingOutputDirectory() throws IOException {
        RenderContext nested = new RenderContext(tempDir.resolve("site/build").toString(), Map.of());

        renderer.render(output(page("a.html", "x")), nested);

        assertThat(readFile("site/build/a.html")).isEqualTo("x");
    }

    @Test
    void render_dryRun_writesNothing() {
        renderer.render(output(page("pages/home.html", "x")), contextWith(Map.of("filesystem.dryRun", "true")));

        assertThat(fileExists("pages/home.html")).isFalse();
    }

    @Test
    void render_pathEscapingOutputDirectory_isRejectedBeforeWriting() {
        GeneratedOutput files = output(page("ok.html", "x"), page("../evil.html", "y"));

        assertThatThrownBy(() -> renderer.render(files, context))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("../evil.html");
        assertThat(fileExists("ok.html")).isFalse();
    }

    @Test
    void render_pathResolvingToOutputDirectory_isRejected() {
        GeneratedOutput files = output(page("pages/..", "x"));

        assertThatThrownBy(() -> renderer.render(files, context))
            .isInstanceOf(IllegalStateException.class);
    }
}

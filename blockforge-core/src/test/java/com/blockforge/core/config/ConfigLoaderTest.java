package com.blockforge.core.config;

import com.blockforge.core.model.section.SectionInput;
import com.blockforge.core.theme.ColorEntry;
import com.blockforge.core.theme.ThemeConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("blockforge.yaml");
        Files.writeString(configFile, """
            site:
              name: "Acme Bakery"
              description: "Bread and more"

            pages:
              - slug: home
                title: Home
                sections:
                  - type: hero
                    layout: split-left
                    config:
                      heading: "Fresh bread daily"
                      backgroundImage: "https://example.com/bread.jpg"
                  - type: faq
                    config:
                      items:
                        - question: "Open Sundays?"
                          answer: "Yes"

            theme:
              colors:
                primary: "#8b4513"

            output:
              directory: "./site"
            """);

        SiteConfig config = ConfigLoader.load(configFile);

        assertThat(config.site().name()).isEqualTo("Acme Bakery");
        assertThat(config.pages()).hasSize(1);

        SiteConfig.PageConfig home = config.pages().get(0);
        assertThat(home.slug()).isEqualTo("home");
        assertThat(home.sections()).extracting(SectionInput::type).containsExactly("hero", "faq");
        assertThat(home.sections().get(0).layout()).isEqualTo("split-left");
        assertThat(home.sections().get(0).config()).containsEntry("heading", "Fresh bread daily");
        assertThat(home.sections().get(1).config().get("items")).isInstanceOf(List.class);

        assertThat(config.theme().colors()).containsEntry("primary", ColorEntry.of("#8b4513"));
        assertThat(config.output().directory()).isEqualTo("./site");
        assertThat(config.output().themeFile()).isEqualTo("theme.json");
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("blockforge.yaml");
        Files.writeString(configFile, """
            pages:
              - slug: about
            """);

        SiteConfig config = ConfigLoader.load(configFile);

        assertThat(config.pages().get(0).sections()).isEmpty();
        assertThat(config.theme()).isEqualTo(ThemeConfig.empty());
        assertThat(config.output()).isEqualTo(SiteConfig.OutputConfig.defaults());
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("blockforge.yaml");
        Files.writeString(configFile, """
            version: 2
            pages:
              - slug: home
                template: wide
            """);

        SiteConfig config = ConfigLoader.load(configFile);

        assertThat(config.pages()).extracting(SiteConfig.PageConfig::slug).containsExactly("home");
    }

    @Test
    void load_missingFile_returnsDefaults() {
        SiteConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(SiteConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("blockforge.yaml");
        Files.writeString(configFile, "pages: [unclosed\n  - : :");

        SiteConfig config = ConfigLoader.load(configFile);

        assertThat(config.pages()).isEmpty();
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(SiteConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("blockforge.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(SiteConfig.defaults());
    }

    @Test
    void loadTheme_jsonFile_isAccepted() throws IOException {
        Path themeFile = tempDir.resolve("theme.json");
        Files.writeString(themeFile, """
            {"name": "bakery", "layout": {"contentSize": "700px"}}
            """);

        ThemeConfig theme = ConfigLoader.loadTheme(themeFile);

        assertThat(theme.name()).isEqualTo("bakery");
        assertThat(theme.layout().contentSize()).isEqualTo("700px");
    }

    @Test
    void loadTheme_missingFile_returnsEmptyTheme() {
        assertThat(ConfigLoader.loadTheme(tempDir.resolve("missing.yaml"))).isEqualTo(ThemeConfig.empty());
    }

    @Test
    void loadSectionConfig_readsRawMap() throws IOException {
        Path sectionFile = tempDir.resolve("hero.yaml");
        Files.writeString(sectionFile, """
            heading: Welcome
            backgroundOverlay: 40
            """);

        Map<String, Object> config = ConfigLoader.loadSectionConfig(sectionFile);

        assertThat(config).containsEntry("heading", "Welcome").containsEntry("backgroundOverlay", 40);
    }

    @Test
    void loadSectionConfig_missingFile_throwsUncheckedIO() {
        Path missing = tempDir.resolve("missing.yaml");

        assertThatThrownBy(() -> ConfigLoader.loadSectionConfig(missing))
            .isInstanceOf(UncheckedIOException.class)
            .hasMessageContaining("missing.yaml");
    }
}

package com.blockforge.core.config;

import com.blockforge.core.theme.ThemeConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Utility for loading BlockForge configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code blockforge.yaml} into {@link SiteConfig} records.
 * If the config file is missing or invalid, returns {@link SiteConfig#defaults()}.
 *
 * <p>YAML is a superset of JSON, so every file read here may also be plain JSON.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SiteConfig config = ConfigLoader.load(Path.of("blockforge.yaml"));
 * for (SiteConfig.PageConfig page : config.pages()) {
 *     // ...
 * }
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Default configuration file name.
     */
    public static final String DEFAULT_FILE_NAME = "blockforge.yaml";

    /**
     * Loads site configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link SiteConfig#defaults()}.
     *
     * @param configPath path to {@code blockforge.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static SiteConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults (no pages).", configPath);
            return SiteConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return SiteConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            SiteConfig config = YAML_MAPPER.readValue(configPath.toFile(), SiteConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return SiteConfig.defaults();
            }
            log.info("Loaded configuration from: {} ({} pages)", configPath, config.pages().size());
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return SiteConfig.defaults();
        }
    }

    /**
     * Loads theme tokens from a YAML or JSON file.
     *
     * <p>A missing or unparsable file yields {@link ThemeConfig#empty()}, so the theme falls back
     * to its defaults.
     *
     * @param themePath path to the theme file
     * @return loaded theme configuration or an empty one
     */
    public static ThemeConfig loadTheme(Path themePath) {
        if (!Files.isRegularFile(themePath) || !Files.isReadable(themePath)) {
            log.warn("Theme file not found or not readable: {}. Using default theme.", themePath);
            return ThemeConfig.empty();
        }

        try {
            ThemeConfig theme = YAML_MAPPER.readValue(themePath.toFile(), ThemeConfig.class);
            log.info("Loaded theme from: {}", themePath);
            return theme == null ? ThemeConfig.empty() : theme;
        } catch (IOException e) {
            log.error("Failed to parse theme file: {}. Using default theme. Error: {}",
                themePath, e.getMessage());
            return ThemeConfig.empty();
        }
    }

    /**
     * Reads a raw section configuration map from a YAML or JSON file.
     *
     * <p>Unlike the site and theme loaders this fails loudly: a section configuration named
     * explicitly on the command line must exist.
     *
     * @param sectionPath path to the section configuration file
     * @return raw configuration map, empty for an empty file
     * @throws UncheckedIOException if the file cannot be read or parsed
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> loadSectionConfig(Path sectionPath) {
        try {
            Map<String, Object> config = YAML_MAPPER.readValue(sectionPath.toFile(), Map.class);
            log.debug("Loaded section configuration from: {}", sectionPath);
            return config == null ? Map.of() : config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read section configuration: " + sectionPath, e);
        }
    }
}

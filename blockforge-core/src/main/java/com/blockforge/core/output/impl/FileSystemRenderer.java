package com.blockforge.core.output.impl;

import com.blockforge.core.output.GeneratedFile;
import com.blockforge.core.output.GeneratedOutput;
import com.blockforge.core.output.OutputRenderer;
import com.blockforge.core.output.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Renderer that writes generated files below the output directory.
 *
 * <p>Creates directories as needed and overwrites existing files. Files are written as UTF-8.
 * A file whose relative path resolves outside the output directory is rejected before anything
 * is written.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code filesystem.dryRun} - log the files instead of writing them (default: "false")</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * GeneratedOutput output = new GeneratedOutput(List.of(
 *     new GeneratedFile("pages/home.html", markup, ArtifactType.PAGE_MARKUP)
 * ));
 * new FileSystemRenderer().render(output, new RenderContext("./build", Map.of()));
 * // Creates: ./build/pages/home.html
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = Paths.get(context.outputDirectory()).toAbsolutePath().normalize();
        boolean dryRun = context.isEnabled("filesystem.dryRun", false);

        for (GeneratedFile file : output.files()) {
            resolve(outputDir, file);
        }

        if (dryRun) {
            for (GeneratedFile file : output.files()) {
                log.info("[dry run] Would write {} ({} chars)", resolve(outputDir, file), file.content().length());
            }
            return;
        }

        log.info("Rendering {} files to filesystem at: {}", output.files().size(), outputDir);
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (GeneratedFile file : output.files()) {
            writeFile(resolve(outputDir, file), file);
        }
        log.info("Successfully rendered {} files to filesystem", output.files().size());
    }

    private Path resolve(Path outputDir, GeneratedFile file) {
        Path target = outputDir.resolve(file.relativePath()).normalize();
        if (!target.startsWith(outputDir) || target.equals(outputDir)) {
            throw new IllegalStateException(
                "Refusing to write outside the output directory: " + file.relativePath());
        }
        return target;
    }

    private void writeFile(Path target, GeneratedFile file) {
        log.debug("Writing file: {}", target);
        try {
            Path parentDir = target.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(target, file.content(), StandardCharsets.UTF_8);
            log.info("Wrote file: {} ({} chars)", file.relativePath(), file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}

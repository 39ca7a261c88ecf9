package com.blockforge.cli;

import com.blockforge.core.config.ConfigLoader;
import com.blockforge.core.config.SiteConfig;
import com.blockforge.core.output.GeneratedOutput;
import com.blockforge.core.output.OutputRenderer;
import com.blockforge.core.output.RenderContext;
import com.blockforge.core.site.PageBuild;
import com.blockforge.core.site.SiteBuild;
import com.blockforge.core.site.SiteBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to build every page of a site and its theme descriptor.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Load {@code blockforge.yaml}</li>
 *   <li>Generate and serialize the sections of each page</li>
 *   <li>Build {@code theme.json} from the theme tokens</li>
 *   <li>Render the files with the filesystem or console renderer</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * blockforge build
 * blockforge build -c site.yaml -o ./out
 * blockforge build --console
 * }</pre>
 */
@Command(
    name = "build",
    description = "Build page markup and theme.json from a site configuration",
    mixinStandardHelpOptions = true
)
public class BuildCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BuildCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: blockforge.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config)"
    )
    private Path outputDir;

    @Option(
        names = {"--console"},
        description = "Print the generated files instead of writing them"
    )
    private boolean console;

    @Option(
        names = {"--dry-run"},
        description = "Build everything but only report the files that would be written"
    )
    private boolean dryRun;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();

        if (!Files.isRegularFile(configPath)) {
            log.error("Configuration file not found: {}", configPath);
            return 1;
        }

        try {
            SiteConfig config = ConfigLoader.load(configPath);
            SiteBuild build = new SiteBuilder().build(config);
            GeneratedOutput output = SiteBuilder.toOutput(build, config.output());

            String rendererId = console ? "console" : "filesystem";
            Optional<OutputRenderer> renderer = findRenderer(rendererId);
            if (renderer.isEmpty()) {
                log.error("Renderer not available: {}", rendererId);
                return 1;
            }

            String directory = outputDir != null ? outputDir.toString() : config.output().directory();
            RenderContext context = new RenderContext(directory,
                Map.of("filesystem.dryRun", String.valueOf(dryRun)));
            renderer.get().render(output, context);

            if (!console) {
                printSummary(out, build, directory);
            }
            return 0;
        } catch (RuntimeException e) {
            log.error("Build failed: {}", e.getMessage(), e);
            return 1;
        }
    }

    private void printSummary(PrintWriter out, SiteBuild build, String directory) {
        out.println("Built " + build.pages().size() + " page(s) into " + directory + (dryRun ? " (dry run)" : ""));
        for (PageBuild page : build.pages()) {
            out.printf("  • %s: %d section(s)%n", page.slug(), page.sectionCount());
            page.skippedSections().forEach(skipped -> out.println("    skipped " + skipped));
        }
    }

    private static Optional<OutputRenderer> findRenderer(String id) {
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            if (renderer.getId().equals(id)) {
                return Optional.of(renderer);
            }
        }
        return Optional.empty();
    }
}

package com.blockforge.cli;

import com.blockforge.core.config.ConfigLoader;
import com.blockforge.core.model.BlockNode;
import com.blockforge.core.model.section.SectionInput;
import com.blockforge.core.pattern.PatternGenerator;
import com.blockforge.core.pattern.PatternRegistry;
import com.blockforge.core.pattern.SectionType;
import com.blockforge.core.serializer.BlockSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to print the markup of one section.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * blockforge pattern hero -f hero.yaml
 * blockforge pattern features -l grid-2 -f features.json
 * blockforge pattern cta --all-layouts
 * }</pre>
 */
@Command(
    name = "pattern",
    description = "Print the block markup of one section",
    mixinStandardHelpOptions = true
)
public class PatternCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PatternCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Section type (e.g. hero, features, cta)")
    private String type;

    @Option(names = {"-l", "--layout"}, description = "Layout variant (default: the section's default layout)")
    private String layout;

    @Option(names = {"-f", "--file"}, description = "Section configuration file (YAML or JSON)")
    private Path configFile;

    @Option(names = {"--all-layouts"}, description = "Print the section once per layout variant")
    private boolean allLayouts;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();

        Optional<SectionType> sectionType = SectionType.fromId(type);
        if (sectionType.isEmpty()) {
            log.error("Unknown section type: {}. Use 'blockforge list sections' to see available types", type);
            return 1;
        }

        try {
            Map<String, Object> config = configFile == null ? Map.of() : ConfigLoader.loadSectionConfig(configFile);
            PatternRegistry registry = PatternRegistry.discover();
            BlockSerializer serializer = new BlockSerializer();

            List<String> layouts = allLayouts
                ? registry.getGenerator(sectionType.get()).map(PatternGenerator::getLayouts).orElse(List.of())
                : List.of();
            if (layouts.isEmpty()) {
                out.println(render(registry, serializer, layout, config));
                return 0;
            }

            for (int i = 0; i < layouts.size(); i++) {
                if (i > 0) {
                    out.println();
                }
                out.println("=== " + sectionType.get().id() + " / " + layouts.get(i) + " ===");
                out.println(render(registry, serializer, layouts.get(i), config));
            }
            return 0;
        } catch (RuntimeException e) {
            log.error("Failed to generate section '{}': {}", type, e.getMessage());
            return 1;
        }
    }

    private String render(PatternRegistry registry, BlockSerializer serializer, String variant,
                          Map<String, Object> config) {
        BlockNode root = registry.createPattern(new SectionInput(type, variant, config))
            .orElseThrow(() -> new IllegalArgumentException("Unknown section type: " + type));
        return serializer.serialize(root);
    }
}

package com.blockforge.cli;

import com.blockforge.core.output.OutputRenderer;
import com.blockforge.core.pattern.PatternGenerator;
import com.blockforge.core.pattern.PatternRegistry;
import com.blockforge.core.pattern.SectionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list section types, layouts or renderers.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * blockforge list sections
 * blockforge list layouts
 * blockforge list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available sections, layouts, or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Type to list: sections, layouts, or renderers"
    )
    private String type;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "sections", "section" -> listSections(out);
            case "layouts", "layout" -> listLayouts(out);
            case "renderers", "renderer" -> listRenderers(out);
            default -> {
                log.error("Unknown type: {}. Use: sections, layouts, or renderers", type);
                yield 1;
            }
        };
    }

    private int listSections(PrintWriter out) {
        out.println("Available Sections:");
        out.println();
        for (SectionType section : SectionType.values()) {
            String aliases = section.aliases().isEmpty() ? "" : " (aliases: " + String.join(", ", section.aliases()) + ")";
            out.printf("  • %s%s%s%n", section.id(), aliases, section.isImplemented() ? "" : " [coming soon]");
        }
        return 0;
    }

    private int listLayouts(PrintWriter out) {
        out.println("Available Layouts:");
        out.println();
        for (PatternGenerator<?> generator : PatternRegistry.discover().getGenerators()) {
            out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            out.printf("    Layouts: %s (default: %s)%n",
                String.join(", ", generator.getLayouts()), generator.getDefaultLayout());
            out.println();
        }
        return 0;
    }

    private int listRenderers(PrintWriter out) {
        out.println("Available Renderers:");
        out.println();
        boolean found = false;
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            found = true;
            out.printf("  • %s%n", renderer.getId());
        }
        if (!found) {
            out.println("  No renderers found.");
        }
        return 0;
    }
}

package com.blockforge.cli;

import com.blockforge.core.config.ConfigLoader;
import com.blockforge.core.config.SiteConfig;
import com.blockforge.core.config.SiteConfig.PageConfig;
import com.blockforge.core.model.section.SectionInput;
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
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Command to check a site configuration without writing anything.
 *
 * <p>Reports pages without a slug, duplicate slugs, unknown section types, unknown layouts
 * and section configurations that cannot be converted. Exits with 1 when any problem is found.
 */
@Command(
    name = "validate",
    description = "Validate a site configuration file",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Config file to validate", defaultValue = ConfigLoader.DEFAULT_FILE_NAME)
    private Path configFile;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        log.info("Validating configuration: {}", configFile);

        if (!Files.isRegularFile(configFile)) {
            log.error("Configuration file not found: {}", configFile);
            return 1;
        }

        List<String> problems = validate(ConfigLoader.load(configFile), PatternRegistry.discover());
        if (problems.isEmpty()) {
            out.println("✓ " + configFile + " is valid");
            return 0;
        }

        out.println("Found " + problems.size() + " problem(s) in " + configFile + ":");
        problems.forEach(problem -> out.println("  ✗ " + problem));
        return 1;
    }

    static List<String> validate(SiteConfig config, PatternRegistry registry) {
        List<String> problems = new ArrayList<>();
        Set<String> slugs = new HashSet<>();

        for (int p = 0; p < config.pages().size(); p++) {
            PageConfig page = config.pages().get(p);
            String pageName;
            if (page.slug() == null || page.slug().isBlank()) {
                pageName = "page " + (p + 1);
                problems.add(pageName + ": missing slug");
            } else {
                pageName = "page '" + page.slug() + "'";
                if (!slugs.add(page.slug())) {
                    problems.add(pageName + ": duplicate slug");
                }
            }

            for (int s = 0; s < page.sections().size(); s++) {
                SectionInput section = page.sections().get(s);
                String where = pageName + ", section " + (s + 1);
                Optional<SectionType> type = SectionType.fromId(section.type());
                if (type.isEmpty()) {
                    problems.add(where + ": unknown section type '" + section.type() + "'");
                    continue;
                }

                Optional<PatternGenerator<?>> generator = registry.getGenerator(type.get());
                if (generator.isPresent() && section.layout() != null && !generator.get().supportsLayout(section.layout())) {
                    problems.add(where + ": unknown layout '" + section.layout() + "' for " + type.get().id()
                        + " (available: " + String.join(", ", generator.get().getLayouts()) + ")");
                }

                try {
                    registry.createPattern(section);
                } catch (IllegalArgumentException e) {
                    problems.add(where + ": " + e.getMessage());
                }
            }
        }
        return problems;
    }
}

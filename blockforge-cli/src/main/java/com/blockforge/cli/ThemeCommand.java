package com.blockforge.cli;

import com.blockforge.core.config.ConfigLoader;
import com.blockforge.core.theme.ThemeConfig;
import com.blockforge.core.theme.ThemeDescriptorBuilder;
import com.blockforge.core.theme.ThemeDescriptorWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to print a theme descriptor.
 *
 * <p>Without a file the descriptor contains only the default tokens.
 */
@Command(
    name = "theme",
    description = "Print theme.json for a theme token file",
    mixinStandardHelpOptions = true
)
public class ThemeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ThemeCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-f", "--file"}, description = "Theme token file (YAML or JSON)")
    private Path themeFile;

    @Override
    public Integer call() {
        ThemeConfig config = themeFile == null ? ThemeConfig.empty() : ConfigLoader.loadTheme(themeFile);
        log.debug("Building theme descriptor from {}", themeFile == null ? "defaults" : themeFile);
        spec.commandLine().getOut().println(ThemeDescriptorWriter.write(new ThemeDescriptorBuilder().build(config)));
        return 0;
    }
}

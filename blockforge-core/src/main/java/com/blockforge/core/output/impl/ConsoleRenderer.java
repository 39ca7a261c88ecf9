package com.blockforge.core.output.impl;

import com.blockforge.core.output.GeneratedFile;
import com.blockforge.core.output.GeneratedOutput;
import com.blockforge.core.output.OutputRenderer;
import com.blockforge.core.output.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Renderer that prints generated pages and theme files to a stream, standard output by default.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - ANSI colored headers ("true"/"false", default: "false")</li>
 *   <li>{@code console.showHeaders} - print a header line per file (default: "true")</li>
 * </ul>
 *
 * <p>With headers disabled only file contents are printed, separated by a blank line, which
 * makes the output pasteable into the editor's code view.
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD_CYAN = "\u001B[1m\u001B[36m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean useColors = context.isEnabled("console.colors", false);
        boolean showHeaders = context.isEnabled("console.showHeaders", true);

        log.info("Rendering {} files to console (colors: {}, headers: {})",
            output.files().size(), useColors, showHeaders);

        for (int i = 0; i < output.files().size(); i++) {
            GeneratedFile file = output.files().get(i);
            if (i > 0) {
                out.println();
            }
            if (showHeaders) {
                printHeader(file, useColors);
            }
            out.println(file.content());
        }
        out.flush();
    }

    private void printHeader(GeneratedFile file, boolean useColors) {
        String pathColor = useColors ? ANSI_BOLD_CYAN : "";
        String metaColor = useColors ? ANSI_YELLOW : "";
        String reset = useColors ? ANSI_RESET : "";
        out.println(pathColor + "=== " + file.relativePath() + " ===" + reset
            + " " + metaColor + "(" + file.type().mediaType() + ")" + reset);
    }
}

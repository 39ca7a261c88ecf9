package com.blockforge.core.output;

/**
 * Writes generated pages and theme files to a destination.
 *
 * <p>Renderers are discovered via the Java Service Provider Interface. Register
 * implementations in {@code META-INF/services/com.blockforge.core.output.OutputRenderer}.
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * <p>Used for selecting the renderer on the command line. Lowercase (e.g. "filesystem").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders the generated output to the target destination.
     *
     * @param output generated files
     * @param context rendering context with destination and settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}

package com.staticpress.core.renderer;

/**
 * Destination of a built site.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI) and selected by id:
 * {@code filesystem} writes the site, {@code console} prints it for a dry run.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.staticpress.core.renderer.OutputRenderer}
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * @return lowercase renderer identifier
     */
    String getId();

    /**
     * Writes the generated files to the destination. Parent directories are created and
     * existing files are overwritten.
     *
     * @param output files to write
     * @param context output directory and renderer settings
     * @throws IllegalStateException if a file cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}

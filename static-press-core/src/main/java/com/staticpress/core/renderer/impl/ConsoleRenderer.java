package com.staticpress.core.renderer.impl;

import com.staticpress.core.renderer.GeneratedFile;
import com.staticpress.core.renderer.GeneratedOutput;
import com.staticpress.core.renderer.OutputRenderer;
import com.staticpress.core.renderer.OutputRenderers;
import com.staticpress.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Renderer for dry runs: prints what a build would write instead of writing it.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - Enable/disable ANSI colors ("true"/"false", default: "true")</li>
 *   <li>{@code console.showContent} - Print file contents too ("true"/"false", default: "false")</li>
 *   <li>{@code console.separator} - Separator between files when contents are shown (default: "---")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    public static final String COLORS = "console.colors";
    public static final String SHOW_CONTENT = "console.showContent";
    public static final String SEPARATOR = "console.separator";

    private static final String DEFAULT_SEPARATOR = "---";

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    /**
     * Creates a renderer printing to the given stream.
     *
     * @param out target stream
     */
    public ConsoleRenderer(PrintStream out) {
        this.out = out;
    }

    @Override
    public String getId() {
        return OutputRenderers.CONSOLE;
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean useColors = context.flag(COLORS, true);
        boolean showContent = context.flag(SHOW_CONTENT, false);
        String separator = context.setting(SEPARATOR, DEFAULT_SEPARATOR);

        logger.debug("Printing {} files (colors: {}, content: {})", output.size(), useColors, showContent);

        out.println(color(ANSI_BOLD + ANSI_GREEN, "Would write " + output.size() + " file(s) to "
            + context.outputDirectory(), useColors));

        for (GeneratedFile file : output.files()) {
            out.println(color(ANSI_CYAN, "  " + file.relativePath(), useColors)
                + color(ANSI_YELLOW, " (" + file.contentType() + ", " + file.content().length() + " chars)", useColors));
            if (showContent) {
                out.println(file.content());
                out.println(color(ANSI_YELLOW, separator.repeat(Math.max(1, 80 / separator.length())), useColors));
            }
        }
        out.flush();
    }

    private static String color(String code, String text, boolean useColors) {
        return useColors ? code + text + ANSI_RESET : text;
    }
}

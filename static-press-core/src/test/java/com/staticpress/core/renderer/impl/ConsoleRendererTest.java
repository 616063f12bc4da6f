package com.staticpress.core.renderer.impl;

import com.staticpress.core.renderer.GeneratedFile;
import com.staticpress.core.renderer.GeneratedOutput;
import com.staticpress.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest {

    private static final Map<String, String> NO_COLORS = Map.of(ConsoleRenderer.COLORS, "false");

    private ByteArrayOutputStream buffer;
    private ConsoleRenderer renderer;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        renderer = new ConsoleRenderer(new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String printed() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void getId_returnsConsole() {
        assertThat(renderer.getId()).isEqualTo("console");
    }

    @Test
    void render_listsEveryFileWithTypeAndSize() {
        // Given
        GeneratedOutput output = GeneratedOutput.of(
            GeneratedFile.html("about.html", "<p>About</p>"),
            new GeneratedFile("sitemap.xml", "<urlset/>", GeneratedFile.XML));

        // When
        renderer.render(output, new RenderContext(Path.of("html"), NO_COLORS));

        // Then
        assertThat(printed())
            .contains("Would write 2 file(s) to " + Path.of("html").toAbsolutePath())
            .contains("  about.html (text/html, 12 chars)")
            .contains("  sitemap.xml (application/xml, 9 chars)")
            .doesNotContain("<p>About</p>")
            .doesNotContain("\u001B[");
    }

    @Test
    void render_withShowContent_printsContentAndSeparator() {
        // Given
        GeneratedOutput output = GeneratedOutput.of(GeneratedFile.html("about.html", "<p>About</p>"));
        Map<String, String> settings = Map.of(
            ConsoleRenderer.COLORS, "false",
            ConsoleRenderer.SHOW_CONTENT, "TRUE",
            ConsoleRenderer.SEPARATOR, "=");

        // When
        renderer.render(output, new RenderContext(Path.of("html"), settings));

        // Then
        assertThat(printed()).contains("<p>About</p>").contains("=".repeat(80));
    }

    @Test
    void render_withDefaultSettings_usesAnsiColors() {
        renderer.render(GeneratedOutput.of(GeneratedFile.html("a.html", "")), RenderContext.of(Path.of("html")));

        assertThat(printed()).contains("\u001B[");
    }
}

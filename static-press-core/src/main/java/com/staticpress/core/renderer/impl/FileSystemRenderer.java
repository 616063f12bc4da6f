package com.staticpress.core.renderer.impl;

import com.staticpress.core.renderer.GeneratedFile;
import com.staticpress.core.renderer.GeneratedOutput;
import com.staticpress.core.renderer.OutputRenderer;
import com.staticpress.core.renderer.OutputRenderers;
import com.staticpress.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renderer that writes the site to the output directory as UTF-8.
 *
 * <p>Creates parent directories automatically and overwrites existing files. Relative paths
 * that would leave the output directory are rejected.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * GeneratedOutput output = GeneratedOutput.of(
 *     GeneratedFile.html("2023/01/02/hello/index.html", "<html>...</html>")
 * );
 *
 * new FileSystemRenderer().render(output, RenderContext.of(Path.of("./html")));
 * // Creates: ./html/2023/01/02/hello/index.html
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return OutputRenderers.FILESYSTEM;
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = context.outputDirectory();
        logger.debug("Writing {} files to {}", output.size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (GeneratedFile file : output.files()) {
            writeFile(context.target(file), file);
        }
    }

    private void writeFile(Path targetPath, GeneratedFile file) {
        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(targetPath, file.content(), StandardCharsets.UTF_8);
            logger.debug("Wrote {} ({} chars)", file.relativePath(), file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}

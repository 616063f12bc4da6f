package com.staticpress.core.renderer;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Where a build's output goes, plus the renderer options chosen on the command line.
 *
 * @param outputDirectory absolute, normalized site root
 * @param settings renderer options such as {@code console.showContent}
 */
public record RenderContext(
    Path outputDirectory,
    Map<String, String> settings
) {
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        outputDirectory = outputDirectory.toAbsolutePath().normalize();
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    /**
     * Creates a context without renderer options.
     *
     * @param outputDirectory site root
     * @return context
     */
    public static RenderContext of(Path outputDirectory) {
        return new RenderContext(outputDirectory, Map.of());
    }

    /**
     * Resolves where a generated file lands under the site root.
     *
     * @param file generated file
     * @return absolute target path
     * @throws IllegalStateException if the file's relative path leaves the site root
     */
    public Path target(GeneratedFile file) {
        Path target = outputDirectory.resolve(file.relativePath()).normalize();
        if (!target.startsWith(outputDirectory)) {
            throw new IllegalStateException("Refusing to write outside the output directory: " + file.relativePath());
        }
        return target;
    }

    public String setting(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }

    /**
     * Reads an on/off option. Anything other than {@code true} (ignoring case) is off.
     *
     * @param key option key
     * @param defaultValue value when the option is not set
     * @return option value
     */
    public boolean flag(String key, boolean defaultValue) {
        String value = settings.get(key);
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }
}

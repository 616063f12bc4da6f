package com.staticpress.core.renderer;

import java.util.Objects;

/**
 * One file of the built site.
 *
 * @param relativePath path below the output directory, always with {@code /} separators
 *                     (e.g., "2023/01/02/hello/index.html")
 * @param content file content
 * @param contentType media type of the content
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    public static final String HTML = "text/html";
    public static final String RSS = "application/rss+xml";
    public static final String XML = "application/xml";

    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (relativePath.startsWith("/")) {
            throw new IllegalArgumentException("relativePath must be relative: " + relativePath);
        }
    }

    /**
     * Creates an HTML file.
     *
     * @param relativePath path below the output directory
     * @param content markup
     * @return generated file
     */
    public static GeneratedFile html(String relativePath, String content) {
        return new GeneratedFile(relativePath, content, HTML);
    }
}

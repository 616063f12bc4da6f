package com.staticpress.core.content;

import java.util.Locale;
import java.util.Optional;

/**
 * Source formats a content body can be written in, keyed by file extension.
 */
public enum ContentFormat {
    /** Markdown, converted to HTML. */
    MARKDOWN("md", "markdown"),
    /** HTML, used as-is. */
    HTML("html", "htm"),
    /** Page expression source, used as-is and typically rendered with {@code template: none}. */
    EXPRESSION("expr");

    private final String[] extensions;

    ContentFormat(String... extensions) {
        this.extensions = extensions;
    }

    /**
     * Finds the format for a file extension.
     *
     * @param extension extension without dot
     * @return matching format, empty if unsupported
     */
    public static Optional<ContentFormat> forExtension(String extension) {
        String normalized = extension.toLowerCase(Locale.ROOT);
        for (ContentFormat format : values()) {
            for (String candidate : format.extensions) {
                if (candidate.equals(normalized)) {
                    return Optional.of(format);
                }
            }
        }
        return Optional.empty();
    }
}

package com.staticpress.core.template;

import java.util.Locale;
import java.util.Optional;

/**
 * The two rendering modes a template can use.
 */
public enum TemplateMode {
    /** Page expressions evaluated against {@code metadata} and {@code content}. */
    EXPRESSION("expr"),
    /** Literal {@code $key$} substitution. */
    SUBSTITUTION("html", "htm", "st");

    private final String[] extensions;

    TemplateMode(String... extensions) {
        this.extensions = extensions;
    }

    /**
     * Selects the mode of a template file by its extension.
     *
     * @param extension extension without dot
     * @return mode, empty if the extension is not a template type
     */
    public static Optional<TemplateMode> forExtension(String extension) {
        String normalized = extension.toLowerCase(Locale.ROOT);
        for (TemplateMode mode : values()) {
            for (String candidate : mode.extensions) {
                if (candidate.equals(normalized)) {
                    return Optional.of(mode);
                }
            }
        }
        return Optional.empty();
    }
}

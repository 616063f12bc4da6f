package com.staticpress.core.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The bindings a template is rendered against.
 *
 * <p>Passed explicitly to every render call; templates never read shared state, so one
 * template instance can render many units concurrently.
 *
 * @param metadata the unit's metadata, exposed to expressions as {@code metadata}
 * @param content the unit's body, exposed as {@code content}
 */
public record RenderEnvironment(
    Map<String, Object> metadata,
    String content
) {
    public static final String METADATA = "metadata";
    public static final String CONTENT = "content";

    /**
     * Compact constructor with defaults.
     */
    public RenderEnvironment {
        metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        if (content == null) {
            content = "";
        }
    }
}

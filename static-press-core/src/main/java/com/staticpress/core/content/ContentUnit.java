package com.staticpress.core.content;

import com.staticpress.core.util.Lazy;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One parsed content file: its metadata header and a lazily produced body.
 *
 * <p>The file and its header are read when the unit is created. Only the body conversion is
 * deferred; it runs at most once per unit, however often {@link #body()} is called.
 *
 * @param path source file
 * @param kind post or page
 * @param metadata header keys and values, in header order
 * @param lazyBody memoized body (HTML for Markdown sources)
 */
public record ContentUnit(
    Path path,
    ContentKind kind,
    Map<String, Object> metadata,
    Lazy<String> lazyBody
) {
    public static final String TITLE = "title";
    public static final String TAGS = "tags";
    public static final String TEMPLATE = "template";
    public static final String EXTENSION = "extension";
    public static final String TYPE = "type";

    /**
     * Compact constructor with validation.
     */
    public ContentUnit {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(lazyBody, "lazyBody must not be null");
        metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Returns the body, computing it on first access.
     *
     * @return body markup
     */
    public String body() {
        return lazyBody.get();
    }

    /**
     * Returns the {@code title} metadata value.
     *
     * @return title, or null if absent
     */
    public String title() {
        return stringValue(TITLE);
    }

    /**
     * Returns the {@code template} metadata value.
     *
     * @return template identifier, or null if absent
     */
    public String template() {
        return stringValue(TEMPLATE);
    }

    /**
     * Returns the {@code extension} metadata value.
     *
     * @return output extension, or null if absent
     */
    public String extension() {
        return stringValue(EXTENSION);
    }

    /**
     * Returns whether the unit declares a {@code tags} key.
     *
     * @return true if tags are present
     */
    public boolean hasTags() {
        return metadata.get(TAGS) != null;
    }

    /**
     * Returns the declared tags. A string value is split on whitespace.
     *
     * @return tags in declaration order, empty if none
     */
    public List<String> tags() {
        Object value = metadata.get(TAGS);
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream()
                .filter(Objects::nonNull)
                .map(Object::toString)
                .filter(tag -> !tag.isBlank())
                .toList();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(text.split("\\s+"));
    }

    /**
     * Returns a copy with one metadata key set, sharing the same lazy body.
     *
     * @param key metadata key
     * @param value metadata value
     * @return updated unit
     */
    public ContentUnit withMetadata(String key, Object value) {
        Map<String, Object> updated = new LinkedHashMap<>(metadata);
        updated.put(key, value);
        return new ContentUnit(path, kind, updated, lazyBody);
    }

    private String stringValue(String key) {
        Object value = metadata.get(key);
        return value != null ? value.toString() : null;
    }
}

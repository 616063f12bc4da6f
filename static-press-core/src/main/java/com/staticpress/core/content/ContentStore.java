package com.staticpress.core.content;

import java.nio.file.Path;
import java.util.List;

/**
 * Source of the content units a site is compiled from.
 *
 * <p>Implementations must enumerate posts in ascending file name order; every newest-first view
 * of the site is derived by reversing that order.
 */
public interface ContentStore {

    /**
     * Lists the units of one kind.
     *
     * @param kind posts or pages
     * @return paths in ascending file name order
     */
    List<Path> list(ContentKind kind);

    /**
     * Reads one unit.
     *
     * @param path a path returned by {@link #list(ContentKind)}
     * @return parsed unit with a lazily computed body
     * @throws ContentParseException if the file cannot be read or its header is malformed
     */
    ContentUnit read(Path path);
}

package com.staticpress.core.content;

import com.staticpress.core.SiteBuildException;

import java.nio.file.Path;

/**
 * Raised when a content file cannot be read or its metadata header is malformed.
 *
 * <p>Scoped to one unit: the build reports it and keeps processing the other units.
 */
public class ContentParseException extends SiteBuildException {

    private final Path path;

    public ContentParseException(Path path, String message) {
        super(path + ": " + message);
        this.path = path;
    }

    public ContentParseException(Path path, String message, Throwable cause) {
        super(path + ": " + message, cause);
        this.path = path;
    }

    /**
     * Returns the offending content file.
     *
     * @return content path
     */
    public Path getPath() {
        return path;
    }
}

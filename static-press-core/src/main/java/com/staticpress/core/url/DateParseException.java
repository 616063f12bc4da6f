package com.staticpress.core.url;

import com.staticpress.core.SiteBuildException;

import java.nio.file.Path;

/**
 * Raised when a post file name does not start with a {@code yyyy-MM-dd-} date token.
 */
public class DateParseException extends SiteBuildException {

    private final Path path;

    public DateParseException(Path path, String reason) {
        super("Post file name must start with yyyy-MM-dd-<slug>: " + path + " (" + reason + ")");
        this.path = path;
    }

    public DateParseException(Path path, String reason, Throwable cause) {
        super("Post file name must start with yyyy-MM-dd-<slug>: " + path + " (" + reason + ")", cause);
        this.path = path;
    }

    /**
     * Returns the offending post path.
     *
     * @return post path
     */
    public Path getPath() {
        return path;
    }
}

package com.staticpress.core;

/**
 * Base class for all failures raised while compiling a site.
 *
 * <p>Subclasses distinguish fatal configuration problems from failures that are
 * scoped to a single content unit.
 */
public class SiteBuildException extends RuntimeException {

    public SiteBuildException(String message) {
        super(message);
    }

    public SiteBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}

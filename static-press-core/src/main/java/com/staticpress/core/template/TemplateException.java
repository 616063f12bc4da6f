package com.staticpress.core.template;

import com.staticpress.core.SiteBuildException;

/**
 * Raised when an expression template cannot be parsed or evaluated.
 */
public class TemplateException extends SiteBuildException {

    public TemplateException(String message) {
        super(message);
    }

    public TemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}

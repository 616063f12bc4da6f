package com.staticpress.core.config;

import com.staticpress.core.SiteBuildException;

/**
 * Raised for invalid site configuration or an unresolvable template.
 *
 * <p>Always fatal: a build that encounters it writes no output.
 */
public class ConfigurationException extends SiteBuildException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

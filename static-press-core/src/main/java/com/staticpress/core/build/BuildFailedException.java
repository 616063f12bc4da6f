package com.staticpress.core.build;

import com.staticpress.core.SiteBuildException;

/**
 * Raised after the successful part of a build has been written, when one or more tasks failed.
 */
public class BuildFailedException extends SiteBuildException {

    private final transient BuildReport report;

    public BuildFailedException(BuildReport report) {
        super(report.failures().size() + " build task(s) failed:\n  " + String.join("\n  ", report.failures()));
        this.report = report;
    }

    public BuildReport getReport() {
        return report;
    }
}

package com.staticpress.core.build;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Summary of a finished build.
 *
 * @param unitsRendered posts and pages rendered successfully
 * @param filesWritten files handed to the output renderer
 * @param failures one line per failed task, in submission order
 * @param elapsed wall-clock time of the whole build
 */
public record BuildReport(
    int unitsRendered,
    int filesWritten,
    List<String> failures,
    Duration elapsed
) {
    public BuildReport {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * Formats a duration as seconds with two decimals.
     *
     * @param duration elapsed time
     * @return e.g. {@code 0.42}
     */
    public static String seconds(Duration duration) {
        return String.format(Locale.ROOT, "%.2f", duration.toMillis() / 1000.0);
    }

    @Override
    public String toString() {
        return "Rendered " + unitsRendered + " units, wrote " + filesWritten + " files in "
            + seconds(elapsed) + " secs" + (hasFailures() ? ", " + failures.size() + " failed" : "");
    }
}

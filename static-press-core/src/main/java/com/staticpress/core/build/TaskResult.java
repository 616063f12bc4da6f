package com.staticpress.core.build;

import com.staticpress.core.renderer.GeneratedOutput;

import java.util.Objects;

/**
 * Outcome of one build task: the files it generated, or the reason it failed.
 *
 * @param taskName unit path or generator id
 * @param output generated files, empty on failure
 * @param failure cause of failure, null on success
 */
public record TaskResult(
    String taskName,
    GeneratedOutput output,
    RuntimeException failure
) {
    /**
     * Compact constructor with validation.
     */
    public TaskResult {
        Objects.requireNonNull(taskName, "taskName must not be null");
        if (output == null) {
            output = GeneratedOutput.empty();
        }
    }

    public static TaskResult success(String taskName, GeneratedOutput output) {
        return new TaskResult(taskName, output, null);
    }

    public static TaskResult failure(String taskName, RuntimeException failure) {
        return new TaskResult(taskName, GeneratedOutput.empty(), Objects.requireNonNull(failure, "failure must not be null"));
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * Describes the failure for the build report.
     *
     * @return {@code task: message}
     */
    public String describeFailure() {
        if (failure == null) {
            return taskName + ": ok";
        }
        String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        return taskName + ": " + message;
    }
}

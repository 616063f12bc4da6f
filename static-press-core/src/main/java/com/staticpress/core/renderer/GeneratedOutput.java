package com.staticpress.core.renderer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Files produced by one build task, or by a whole build.
 *
 * @param files generated files, in the order they were produced
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    public static GeneratedOutput of(GeneratedFile... files) {
        return new GeneratedOutput(List.of(files));
    }

    public static GeneratedOutput empty() {
        return new GeneratedOutput(List.of());
    }

    /**
     * Concatenates outputs, keeping their order.
     *
     * @param outputs outputs to join
     * @return combined output
     */
    public static GeneratedOutput concat(List<GeneratedOutput> outputs) {
        List<GeneratedFile> all = new ArrayList<>();
        outputs.forEach(output -> all.addAll(output.files()));
        return new GeneratedOutput(all);
    }

    /**
     * Finds a file by its relative path.
     *
     * @param relativePath path below the output directory
     * @return the last file with that path, or null
     */
    public GeneratedFile find(String relativePath) {
        GeneratedFile found = null;
        for (GeneratedFile file : files) {
            if (file.relativePath().equals(relativePath)) {
                found = file;
            }
        }
        return found;
    }

    public int size() {
        return files.size();
    }
}

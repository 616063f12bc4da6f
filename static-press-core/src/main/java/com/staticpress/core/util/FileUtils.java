package com.staticpress.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Lists regular, non-hidden files below a directory in ascending order of their path
     * relative to that directory.
     *
     * @param rootPath directory to list
     * @param recursive whether to descend into subdirectories
     * @return sorted list of files, empty if the directory does not exist
     * @throws IOException if directory traversal fails
     */
    public static List<Path> listFiles(Path rootPath, boolean recursive) throws IOException {
        if (!Files.isDirectory(rootPath)) {
            return List.of();
        }

        try (Stream<Path> paths = recursive ? Files.walk(rootPath) : Files.list(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> !isHidden(rootPath.relativize(path)))
                .sorted(Comparator.comparing(path -> toUnixPath(rootPath.relativize(path))))
                .toList();
        }
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1) : "";
    }

    /**
     * Gets the file name without its extension.
     *
     * @param path file path
     * @return base name
     */
    public static String getBaseName(Path path) {
        return removeExtension(path.getFileName().toString());
    }

    /**
     * Removes the extension from a file name or relative path.
     *
     * @param name file name or path
     * @return name without the part after the last dot of the final segment
     */
    public static String removeExtension(String name) {
        int lastSeparator = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        int lastDot = name.lastIndexOf('.');
        return lastDot > lastSeparator + 1 ? name.substring(0, lastDot) : name;
    }

    /**
     * Renders a relative path with forward slashes regardless of platform.
     *
     * @param relativePath relative path
     * @return path string using {@code /} separators
     */
    public static String toUnixPath(Path relativePath) {
        return relativePath.toString().replace('\\', '/');
    }

    /**
     * Deletes a directory and everything below it. Does nothing if it does not exist.
     *
     * @param directory directory to delete
     * @throws IOException if a file cannot be deleted
     */
    public static void deleteRecursively(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            return;
        }

        try (Stream<Path> walk = Files.walk(directory)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(path);
            }
        }
    }

    private static boolean isHidden(Path relativePath) {
        for (Path segment : relativePath) {
            if (segment.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }
}

package com.staticpress.core.url;

import com.staticpress.core.config.SiteConfig;
import com.staticpress.core.util.FileUtils;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Derives site paths for content units from their file names.
 *
 * <p>Posts are published under a date hierarchy taken from the file name:
 * <pre>
 * posts/2023-01-05-hello-world.md  ->  /2023/01/05/hello-world/
 * (post-out-subdir: blog)          ->  /blog/2023/01/05/hello-world/
 * </pre>
 * Pages keep their location below the pages directory with the extension swapped:
 * <pre>
 * site/about/index.md              ->  about/index.html
 * </pre>
 */
public class UrlResolver {

    public static final String DEFAULT_EXTENSION = ".html";

    private final SiteConfig config;
    private final Path pagesRoot;

    /**
     * Creates a resolver.
     *
     * @param config site configuration
     * @param pagesRoot directory that page paths are relative to
     */
    public UrlResolver(SiteConfig config, Path pagesRoot) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.pagesRoot = Objects.requireNonNull(pagesRoot, "pagesRoot must not be null");
    }

    /**
     * Returns the URL of a post.
     *
     * @param path post file
     * @return absolute site path ending with {@code /}
     * @throws DateParseException if the base name is not {@code yyyy-MM-dd-slug}
     */
    public String postUrl(Path path) {
        String[] segments = FileUtils.getBaseName(path).split("-", 4);
        if (segments.length < 4 || segments[3].isEmpty()) {
            throw new DateParseException(path, "expected 4 hyphen-separated segments, found " + segments.length);
        }
        PostDates.parse(path);

        StringBuilder url = new StringBuilder();
        if (config.hasPostOutSubdir()) {
            url.append('/').append(trimSlashes(config.postOutSubdir()));
        }
        for (String segment : segments) {
            url.append('/').append(segment);
        }
        return url.append('/').toString();
    }

    /**
     * Returns the output file of a post, relative to the output root.
     *
     * @param path post file
     * @return relative path such as {@code 2023/01/05/hello-world/index.html}
     */
    public String postOutputPath(Path path) {
        return postUrl(path).substring(1) + "index.html";
    }

    /**
     * Returns the output file of a page with the default extension.
     *
     * @param path page file below the pages root
     * @return relative output path
     */
    public String siteUrl(Path path) {
        return siteUrl(path, null);
    }

    /**
     * Returns the output file of a page.
     *
     * @param path page file below the pages root
     * @param extension output extension with or without leading dot, {@code null} for {@code .html}
     * @return relative output path, always using {@code /}
     */
    public String siteUrl(Path path, String extension) {
        Path relative = path.startsWith(pagesRoot) ? pagesRoot.relativize(path) : path;
        return FileUtils.removeExtension(FileUtils.toUnixPath(relative)) + normalizeExtension(extension);
    }

    private static String normalizeExtension(String extension) {
        if (extension == null || extension.isBlank()) {
            return DEFAULT_EXTENSION;
        }
        String trimmed = extension.trim();
        return trimmed.startsWith(".") ? trimmed : "." + trimmed;
    }

    private static String trimSlashes(String value) {
        String result = value.trim();
        while (result.startsWith("/")) {
            result = result.substring(1);
        }
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}

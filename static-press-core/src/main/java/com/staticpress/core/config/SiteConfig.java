package com.staticpress.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Path;

/**
 * Site-wide settings for a StaticPress build.
 *
 * <p>Loaded from {@code staticpress.yaml}. Every key is optional; unset keys fall back to
 * the values of {@link #defaults()} through {@link #withDefaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * site-title: "Notes"
 * site-description: "Things I wrote down"
 * site-url: "https://notes.example.org"
 * in-dir: "resources/"
 * out-dir: "html/"
 * default-template: "default.html"
 * posts-per-page: 5
 * post-out-subdir: "blog"
 * blog-as-index: true
 * }</pre>
 *
 * @param siteTitle title used by the RSS channel and the latest-posts pages
 * @param siteDescription description used by the RSS channel and the latest-posts pages
 * @param siteUrl absolute base URL of the published site
 * @param inDir input directory holding {@code posts/}, {@code site/} and {@code templates/}
 * @param outDir output directory, cleared at the start of every build
 * @param defaultTemplate template identifier used when a unit names none
 * @param postsPerPage page size of the latest-posts listing
 * @param postOutSubdir optional path segment prepended to every post URL
 * @param encoding character encoding of input files
 * @param blogAsIndex whether the newest latest-posts page is also written to {@code index.html}
 * @param buildThreads size of the worker pool
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SiteConfig(
    @JsonProperty("site-title") String siteTitle,
    @JsonProperty("site-description") String siteDescription,
    @JsonProperty("site-url") String siteUrl,
    @JsonProperty("in-dir") String inDir,
    @JsonProperty("out-dir") String outDir,
    @JsonProperty("default-template") String defaultTemplate,
    @JsonProperty("posts-per-page") Integer postsPerPage,
    @JsonProperty("post-out-subdir") String postOutSubdir,
    @JsonProperty("encoding") String encoding,
    @JsonProperty("blog-as-index") Boolean blogAsIndex,
    @JsonProperty("build-threads") Integer buildThreads
) {

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static SiteConfig defaults() {
        return new SiteConfig(
            "A Static Blog",
            "Default blog description",
            "https://example.com",
            "resources/",
            "html/",
            "default.html",
            2,
            "",
            "UTF-8",
            true,
            Runtime.getRuntime().availableProcessors()
        );
    }

    /**
     * Returns a copy where every unset key takes its default value.
     *
     * @return configuration without null values
     */
    public SiteConfig withDefaults() {
        SiteConfig d = defaults();
        return new SiteConfig(
            siteTitle != null ? siteTitle : d.siteTitle,
            siteDescription != null ? siteDescription : d.siteDescription,
            siteUrl != null ? siteUrl : d.siteUrl,
            inDir != null ? inDir : d.inDir,
            outDir != null ? outDir : d.outDir,
            defaultTemplate != null ? defaultTemplate : d.defaultTemplate,
            postsPerPage != null ? postsPerPage : d.postsPerPage,
            postOutSubdir != null ? postOutSubdir : d.postOutSubdir,
            encoding != null ? encoding : d.encoding,
            blogAsIndex != null ? blogAsIndex : d.blogAsIndex,
            buildThreads != null ? buildThreads : d.buildThreads
        );
    }

    /**
     * Returns a copy with a different output directory.
     *
     * @param directory new output directory
     * @return updated configuration
     */
    public SiteConfig withOutDir(String directory) {
        return new SiteConfig(siteTitle, siteDescription, siteUrl, inDir, directory, defaultTemplate,
            postsPerPage, postOutSubdir, encoding, blogAsIndex, buildThreads);
    }

    /**
     * Returns a copy with a different worker pool size.
     *
     * @param threads new pool size
     * @return updated configuration
     */
    public SiteConfig withBuildThreads(int threads) {
        return new SiteConfig(siteTitle, siteDescription, siteUrl, inDir, outDir, defaultTemplate,
            postsPerPage, postOutSubdir, encoding, blogAsIndex, threads);
    }

    /**
     * Checks the settings a build cannot run without.
     *
     * @return this configuration
     * @throws ConfigurationException if a required key is missing or out of range
     */
    public SiteConfig validate() {
        requireText(siteUrl, "site-url");
        requireText(inDir, "in-dir");
        requireText(outDir, "out-dir");
        requireText(defaultTemplate, "default-template");
        if (postsPerPage == null || postsPerPage < 1) {
            throw new ConfigurationException("posts-per-page must be a positive number, was: " + postsPerPage);
        }
        if (buildThreads == null || buildThreads < 1) {
            throw new ConfigurationException("build-threads must be a positive number, was: " + buildThreads);
        }
        charset();
        return this;
    }

    /**
     * Returns the site URL without a trailing slash, for joining with absolute paths.
     *
     * @return base URL
     */
    public String baseUrl() {
        return siteUrl.endsWith("/") ? siteUrl.substring(0, siteUrl.length() - 1) : siteUrl;
    }

    /**
     * Returns whether posts are published below a subdirectory.
     *
     * @return true if {@code post-out-subdir} is set
     */
    public boolean hasPostOutSubdir() {
        return postOutSubdir != null && !postOutSubdir.isBlank();
    }

    /**
     * Resolves the input directory against a project root.
     *
     * @param root project root
     * @return absolute input directory
     */
    public Path inputDirectory(Path root) {
        return root.resolve(inDir).toAbsolutePath().normalize();
    }

    /**
     * Resolves the output directory against a project root.
     *
     * @param root project root
     * @return absolute output directory
     */
    public Path outputDirectory(Path root) {
        return root.resolve(outDir).toAbsolutePath().normalize();
    }

    /**
     * Returns the charset for reading input files.
     *
     * @return configured charset
     * @throws ConfigurationException if the encoding is unknown
     */
    public Charset charset() {
        try {
            return Charset.forName(encoding);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new ConfigurationException("Unsupported encoding: " + encoding, e);
        }
    }

    private static void requireText(String value, String key) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Missing required configuration key: " + key);
        }
    }
}

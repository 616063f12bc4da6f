package com.staticpress.core.generator;

import com.staticpress.core.renderer.GeneratedOutput;

/**
 * Produces site-wide files derived from the whole post set: index pages, feeds, sitemaps.
 *
 * <p>Each generator runs as one build task and folds over the posts on its own. Generators
 * are discovered via Java Service Provider Interface (SPI) and run in {@link #order()}.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class SitemapGenerator implements SiteGenerator {
 *     @Override
 *     public String getId() {
 *         return "sitemap";
 *     }
 *
 *     @Override
 *     public String getDisplayName() {
 *         return "Sitemap";
 *     }
 *
 *     @Override
 *     public GeneratedOutput generate(GenerationContext context) {
 *         String xml = new SitemapBuilder(context.config(), context.urls())
 *             .build(context.postPaths(), context.pagePaths());
 *         return GeneratedOutput.of(new GeneratedFile("sitemap.xml", xml, GeneratedFile.XML));
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.staticpress.core.generator.SiteGenerator}
 *
 * @see GenerationContext
 * @see SiteGenerators
 */
public interface SiteGenerator {

    /**
     * Returns unique identifier for this generator.
     *
     * <p>Used in CLI output and failure reports. Should be lowercase (e.g., "tags", "rss").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the position of this generator among all generators; lower runs first.
     *
     * @return sort key
     */
    default int order() {
        return 100;
    }

    /**
     * Generates the files of this generator.
     *
     * @param context build-wide inputs
     * @return generated files
     * @throws com.staticpress.core.SiteBuildException if a post cannot be processed
     */
    GeneratedOutput generate(GenerationContext context);
}

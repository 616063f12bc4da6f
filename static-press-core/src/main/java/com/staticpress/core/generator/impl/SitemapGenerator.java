package com.staticpress.core.generator.impl;

import com.staticpress.core.feed.SitemapBuilder;
import com.staticpress.core.generator.GenerationContext;
import com.staticpress.core.generator.SiteGenerator;
import com.staticpress.core.renderer.GeneratedFile;
import com.staticpress.core.renderer.GeneratedOutput;

/**
 * Writes {@code sitemap.xml} listing the site root, every post and every page.
 */
public class SitemapGenerator implements SiteGenerator {

    static final String OUTPUT_PATH = "sitemap.xml";

    @Override
    public String getId() {
        return "sitemap";
    }

    @Override
    public String getDisplayName() {
        return "Sitemap";
    }

    @Override
    public int order() {
        return 50;
    }

    @Override
    public GeneratedOutput generate(GenerationContext context) {
        String xml = new SitemapBuilder(context.config(), context.urls())
            .build(context.postPaths(), context.pagePaths());
        return GeneratedOutput.of(new GeneratedFile(OUTPUT_PATH, xml, GeneratedFile.XML));
    }
}

package com.staticpress.core.generator.impl;

import com.staticpress.core.feed.RssFeedBuilder;
import com.staticpress.core.generator.GenerationContext;
import com.staticpress.core.generator.SiteGenerator;
import com.staticpress.core.renderer.GeneratedFile;
import com.staticpress.core.renderer.GeneratedOutput;

/**
 * Writes the RSS 2.0 feed of the ten newest posts to {@code rss-feed}.
 */
public class RssFeedGenerator implements SiteGenerator {

    static final String OUTPUT_PATH = "rss-feed";

    @Override
    public String getId() {
        return "rss";
    }

    @Override
    public String getDisplayName() {
        return "RSS Feed";
    }

    @Override
    public int order() {
        return 40;
    }

    @Override
    public GeneratedOutput generate(GenerationContext context) {
        String feed = new RssFeedBuilder(context.config(), context.urls())
            .build(context.posts(), context.itemExecutor());
        return GeneratedOutput.of(new GeneratedFile(OUTPUT_PATH, feed, GeneratedFile.RSS));
    }
}

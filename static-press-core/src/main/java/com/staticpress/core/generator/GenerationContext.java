package com.staticpress.core.generator;

import com.staticpress.core.config.SiteConfig;
import com.staticpress.core.content.ContentKind;
import com.staticpress.core.content.ContentStore;
import com.staticpress.core.content.ContentUnit;
import com.staticpress.core.template.TemplateEngine;
import com.staticpress.core.url.UrlResolver;
import com.staticpress.core.util.Lazy;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * Inputs shared by all generators of one build.
 *
 * <p>The post list is read from the store on first use and then shared, so the posts are
 * parsed once however many generators ask for them. {@link #itemExecutor()} is a pool
 * separate from the build's task pool, for parallel work inside a generator.
 */
public final class GenerationContext {

    private final SiteConfig config;
    private final UrlResolver urls;
    private final TemplateEngine templates;
    private final ExecutorService itemExecutor;
    private final Lazy<List<Path>> postPaths;
    private final Lazy<List<Path>> pagePaths;
    private final Lazy<List<ContentUnit>> posts;

    /**
     * Creates a context.
     *
     * @param config site configuration
     * @param store content source
     * @param urls URL resolver
     * @param templates template engine
     * @param itemExecutor pool for per-item work inside a generator
     */
    public GenerationContext(SiteConfig config, ContentStore store, UrlResolver urls,
                             TemplateEngine templates, ExecutorService itemExecutor) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(store, "store must not be null");
        this.urls = Objects.requireNonNull(urls, "urls must not be null");
        this.templates = Objects.requireNonNull(templates, "templates must not be null");
        this.itemExecutor = Objects.requireNonNull(itemExecutor, "itemExecutor must not be null");
        this.postPaths = Lazy.of(() -> List.copyOf(store.list(ContentKind.POSTS)));
        this.pagePaths = Lazy.of(() -> List.copyOf(store.list(ContentKind.PAGES)));
        this.posts = Lazy.of(() -> postPaths.get().stream()
            .map(store::read)
            .map(unit -> unit.withMetadata(ContentUnit.TYPE, ContentKind.POSTS.typeName()))
            .toList());
    }

    public SiteConfig config() {
        return config;
    }

    public UrlResolver urls() {
        return urls;
    }

    public TemplateEngine templates() {
        return templates;
    }

    public ExecutorService itemExecutor() {
        return itemExecutor;
    }

    /**
     * Returns the post paths in store order.
     *
     * @return post files, oldest first
     */
    public List<Path> postPaths() {
        return postPaths.get();
    }

    /**
     * Returns the page paths in store order.
     *
     * @return page files
     */
    public List<Path> pagePaths() {
        return pagePaths.get();
    }

    /**
     * Returns the parsed posts in store order.
     *
     * @return posts, oldest first
     * @throws com.staticpress.core.content.ContentParseException if a post cannot be parsed
     */
    public List<ContentUnit> posts() {
        return posts.get();
    }

    /**
     * Renders a generated page through the default template.
     *
     * @param metadata page metadata, usually just a title
     * @param content page body
     * @return rendered document
     */
    public String renderPage(Map<String, Object> metadata, String content) {
        return templates.render(metadata, content);
    }
}

package com.staticpress.core.generator;

import com.staticpress.core.config.SiteConfig;
import com.staticpress.core.content.ContentKind;
import com.staticpress.core.content.ContentStore;
import com.staticpress.core.content.ContentUnit;
import com.staticpress.core.template.TemplateEngine;
import com.staticpress.core.template.TemplateLoader;
import com.staticpress.core.url.UrlResolver;
import com.staticpress.core.util.Lazy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link GenerationContext}.
 */
class GenerationContextTest {

    @TempDir
    Path tempDir;

    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void posts_areReadOnceAndTypedAsPosts() {
        CountingStore store = new CountingStore(List.of(
            tempDir.resolve("posts/2023-01-02-first.md"),
            tempDir.resolve("posts/2023-01-20-second.md")));
        GenerationContext context = context(store);

        List<ContentUnit> first = context.posts();
        List<ContentUnit> second = context.posts();

        assertThat(second).isSameAs(first);
        assertThat(store.reads.get()).isEqualTo(2);
        assertThat(first).extracting(unit -> unit.metadata().get(ContentUnit.TYPE)).containsOnly("post");
        assertThat(context.postPaths()).containsExactlyElementsOf(store.posts);
    }

    @Test
    void posts_areNotReadUntilAsked() {
        CountingStore store = new CountingStore(List.of(tempDir.resolve("posts/2023-01-02-first.md")));

        GenerationContext context = context(store);

        assertThat(context.pagePaths()).isEmpty();
        assertThat(store.reads.get()).isZero();
    }

    private GenerationContext context(ContentStore store) {
        SiteConfig config = SiteConfig.defaults();
        UrlResolver urls = new UrlResolver(config, tempDir.resolve("site"));
        TemplateEngine templates = new TemplateEngine(
            new TemplateLoader(tempDir.resolve("templates"), StandardCharsets.UTF_8), config.defaultTemplate());
        return new GenerationContext(config, store, urls, templates, executor);
    }

    private static final class CountingStore implements ContentStore {

        private final List<Path> posts;
        private final AtomicInteger reads = new AtomicInteger();

        private CountingStore(List<Path> posts) {
            this.posts = posts;
        }

        @Override
        public List<Path> list(ContentKind kind) {
            return kind == ContentKind.POSTS ? posts : List.of();
        }

        @Override
        public ContentUnit read(Path path) {
            reads.incrementAndGet();
            return new ContentUnit(path, ContentKind.POSTS, Map.of(ContentUnit.TITLE, "t"), Lazy.value(""));
        }
    }
}

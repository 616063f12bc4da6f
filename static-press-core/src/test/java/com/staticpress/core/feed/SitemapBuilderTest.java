package com.staticpress.core.feed;

import com.staticpress.core.config.SiteConfig;
import com.staticpress.core.url.UrlResolver;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SitemapBuilder}.
 */
class SitemapBuilderTest {

    private static final Path PAGES = Path.of("resources", "site");
    private static final SiteConfig CONFIG = new SiteConfig("t", "d", "https://example.com/",
        "resources/", "html/", "default.html", 2, "blog", "UTF-8", true, 1);

    private final SitemapBuilder builder = new SitemapBuilder(CONFIG, new UrlResolver(CONFIG, PAGES));

    private final List<Path> posts = List.of(
        Path.of("resources", "posts", "2023-01-02-first.md"),
        Path.of("resources", "posts", "2023-02-03-second.md"));
    private final List<Path> pages = List.of(PAGES.resolve("about.md"), PAGES.resolve(Path.of("docs", "index.html")));

    @Test
    void entries_rootThenPostsThenPages() {
        assertThat(builder.entries(posts, pages)).extracting(SitemapUrl::loc).containsExactly(
            "https://example.com/",
            "https://example.com/blog/2023/01/02/first/",
            "https://example.com/blog/2023/02/03/second/",
            "https://example.com/about.html",
            "https://example.com/docs/index.html");
    }

    @Test
    void build_writesSitemapNamespaceAndOneUrlPerEntry() {
        String xml = builder.build(posts, pages);

        assertThat(xml).contains("<urlset xmlns=\"http://www.sitemaps.org/schemas/sitemap/0.9\">");
        assertThat(xml.split("<url>", -1)).hasSize(1 + 1 + posts.size() + pages.size());
        assertThat(xml).contains("<loc>https://example.com/about.html</loc>");
        assertThat(xml).doesNotContain("priority", "changefreq");
    }

    @Test
    void build_emptySite_listsOnlyRoot() {
        String xml = builder.build(List.of(), List.of());

        assertThat(xml.split("<url>", -1)).hasSize(2);
    }
}

package com.staticpress.core.url;

import com.staticpress.core.config.SiteConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link UrlResolver}.
 */
class UrlResolverTest {

    private static final Path PAGES = Path.of("resources", "site");

    private static UrlResolver resolver(String postOutSubdir) {
        SiteConfig config = new SiteConfig("t", "d", "https://example.com", "resources/", "html/",
            "default.html", 2, postOutSubdir, "UTF-8", true, 1);
        return new UrlResolver(config, PAGES);
    }

    @Test
    void postUrl_usesDateHierarchy() {
        Path post = Path.of("resources", "posts", "2023-01-05-hello-world.md");

        assertThat(resolver("").postUrl(post)).isEqualTo("/2023/01/05/hello-world/");
        assertThat(resolver("").postOutputPath(post)).isEqualTo("2023/01/05/hello-world/index.html");
    }

    @Test
    void postUrl_withSubdir_prefixesIt() {
        Path post = Path.of("posts", "2023-01-05-hello.md");

        assertThat(resolver("blog").postUrl(post)).isEqualTo("/blog/2023/01/05/hello/");
        assertThat(resolver("/blog/").postUrl(post)).isEqualTo("/blog/2023/01/05/hello/");
        assertThat(resolver("blog").postOutputPath(post)).isEqualTo("blog/2023/01/05/hello/index.html");
    }

    @ParameterizedTest
    @ValueSource(strings = {"hello.md", "2023-01.md", "2023-01-05.md", "2023-01-05-.md", "2023-13-05-hello.md",
        "2023-02-30-hello.md", "hello-world-post-again.md"})
    void postUrl_invalidName_throwsDateParseException(String fileName) {
        Path post = Path.of("posts", fileName);

        assertThatThrownBy(() -> resolver("").postUrl(post))
            .isInstanceOf(DateParseException.class)
            .hasMessageContaining(fileName)
            .satisfies(e -> assertThat(((DateParseException) e).getPath()).isEqualTo(post));
    }

    @Test
    void siteUrl_swapsExtensionRelativeToPagesRoot() {
        UrlResolver urls = resolver("");

        assertThat(urls.siteUrl(PAGES.resolve("about.md"))).isEqualTo("about.html");
        assertThat(urls.siteUrl(PAGES.resolve(Path.of("docs", "guide", "index.md")))).isEqualTo("docs/guide/index.html");
        assertThat(urls.siteUrl(PAGES.resolve("feed.md"), "xml")).isEqualTo("feed.xml");
        assertThat(urls.siteUrl(PAGES.resolve("feed.md"), ".txt")).isEqualTo("feed.txt");
    }
}

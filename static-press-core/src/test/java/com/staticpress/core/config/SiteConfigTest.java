package com.staticpress.core.config;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SiteConfig}.
 */
class SiteConfigTest {

    private static SiteConfig config(String siteUrl, Integer postsPerPage, String defaultTemplate) {
        return new SiteConfig("t", "d", siteUrl, "resources/", "html/", defaultTemplate,
            postsPerPage, "", "UTF-8", true, 2);
    }

    @Test
    void defaults_areValid() {
        assertThat(SiteConfig.defaults().validate()).isEqualTo(SiteConfig.defaults());
    }

    @Test
    void validate_missingSiteUrl_throws() {
        assertThatThrownBy(() -> config(null, 2, "default.html").validate())
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("site-url");
    }

    @Test
    void validate_nonPositivePostsPerPage_throws() {
        assertThatThrownBy(() -> config("https://example.com", 0, "default.html").validate())
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("posts-per-page");
    }

    @Test
    void validate_blankDefaultTemplate_throws() {
        assertThatThrownBy(() -> config("https://example.com", 2, " ").validate())
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("default-template");
    }

    @Test
    void validate_unknownEncoding_throws() {
        SiteConfig config = new SiteConfig("t", "d", "https://example.com", "in", "out", "default.html",
            2, "", "NOT-A-CHARSET", true, 2);

        assertThatThrownBy(config::validate).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void baseUrl_stripsTrailingSlash() {
        assertThat(config("https://example.com/", 2, "default.html").baseUrl()).isEqualTo("https://example.com");
        assertThat(config("https://example.com", 2, "default.html").baseUrl()).isEqualTo("https://example.com");
    }

    @Test
    void directories_resolveAgainstRoot() {
        SiteConfig config = SiteConfig.defaults();
        Path root = Path.of("/srv/blog");

        assertThat(config.inputDirectory(root)).isEqualTo(Path.of("/srv/blog/resources").toAbsolutePath());
        assertThat(config.outputDirectory(root)).isEqualTo(Path.of("/srv/blog/html").toAbsolutePath());
    }

    @Test
    void withOverrides_replaceOnlyTheirKey() {
        SiteConfig config = SiteConfig.defaults().withOutDir("public").withBuildThreads(7);

        assertThat(config.outDir()).isEqualTo("public");
        assertThat(config.buildThreads()).isEqualTo(7);
        assertThat(config.inDir()).isEqualTo("resources/");
        assertThat(config.charset()).isEqualTo(StandardCharsets.UTF_8);
    }
}

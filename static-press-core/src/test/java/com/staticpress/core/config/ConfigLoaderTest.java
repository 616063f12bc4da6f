package com.staticpress.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("staticpress.yaml");
        Files.writeString(configFile, """
            site-title: "Notes"
            site-description: "Things I wrote down"
            site-url: "https://notes.example.org/"
            in-dir: "content/"
            out-dir: "public/"
            default-template: "page.expr"
            posts-per-page: 5
            post-out-subdir: "blog"
            encoding: "ISO-8859-1"
            blog-as-index: false
            build-threads: 3
            """);

        SiteConfig config = ConfigLoader.load(configFile);

        assertThat(config.siteTitle()).isEqualTo("Notes");
        assertThat(config.siteDescription()).isEqualTo("Things I wrote down");
        assertThat(config.siteUrl()).isEqualTo("https://notes.example.org/");
        assertThat(config.inDir()).isEqualTo("content/");
        assertThat(config.outDir()).isEqualTo("public/");
        assertThat(config.defaultTemplate()).isEqualTo("page.expr");
        assertThat(config.postsPerPage()).isEqualTo(5);
        assertThat(config.postOutSubdir()).isEqualTo("blog");
        assertThat(config.encoding()).isEqualTo("ISO-8859-1");
        assertThat(config.blogAsIndex()).isFalse();
        assertThat(config.buildThreads()).isEqualTo(3);
    }

    @Test
    void load_partialYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("staticpress.yaml");
        Files.writeString(configFile, """
            site-title: "Notes"
            posts-per-page: 4
            """);

        SiteConfig config = ConfigLoader.load(configFile);
        SiteConfig defaults = SiteConfig.defaults();

        assertThat(config.siteTitle()).isEqualTo("Notes");
        assertThat(config.postsPerPage()).isEqualTo(4);
        assertThat(config.siteUrl()).isEqualTo(defaults.siteUrl());
        assertThat(config.inDir()).isEqualTo("resources/");
        assertThat(config.outDir()).isEqualTo("html/");
        assertThat(config.defaultTemplate()).isEqualTo("default.html");
        assertThat(config.blogAsIndex()).isTrue();
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("staticpress.yaml");
        Files.writeString(configFile, """
            site-title: "Notes"
            comments-provider: "none"
            """);

        assertThat(ConfigLoader.load(configFile).siteTitle()).isEqualTo("Notes");
    }

    @Test
    void load_fileDoesNotExist_returnsDefaults() {
        SiteConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(SiteConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("staticpress.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(SiteConfig.defaults());
    }

    @Test
    void load_invalidYaml_throwsConfigurationException() throws IOException {
        Path configFile = tempDir.resolve("staticpress.yaml");
        Files.writeString(configFile, """
            site-title: "Notes
            posts-per-page: [
            """);

        assertThatThrownBy(() -> ConfigLoader.load(configFile))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void load_wrongValueType_throwsConfigurationException() throws IOException {
        Path configFile = tempDir.resolve("staticpress.yaml");
        Files.writeString(configFile, "posts-per-page: many\n");

        assertThatThrownBy(() -> ConfigLoader.load(configFile))
            .isInstanceOf(ConfigurationException.class);
    }
}

package com.staticpress.core.content;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ContentReader}.
 */
class ContentReaderTest {

    private final ContentReader reader = new ContentReader(StandardCharsets.UTF_8);

    @TempDir
    Path tempDir;

    @Test
    void parse_markdownWithHeader_readsMetadataAndConvertsBody() {
        ContentUnit unit = reader.parse(Path.of("2023-01-02-hello.md"), ContentKind.POSTS, ContentFormat.MARKDOWN, """
            ---
            title: "Hello, World"
            # a comment

            tags: java  web
            template: post.expr
            ---
            Some *emphasis*.
            """);

        assertThat(unit.metadata()).containsKeys("title", "tags", "template");
        assertThat(unit.title()).isEqualTo("Hello, World");
        assertThat(unit.tags()).containsExactly("java", "web");
        assertThat(unit.template()).isEqualTo("post.expr");
        assertThat(unit.body()).isEqualTo("<p>Some <em>emphasis</em>.</p>\n");
    }

    @Test
    void parse_withoutHeader_hasNoMetadata() {
        ContentUnit unit = reader.parse(Path.of("about.html"), ContentKind.PAGES, ContentFormat.HTML,
            "<p>About me</p>\n");

        assertThat(unit.metadata()).isEmpty();
        assertThat(unit.hasTags()).isFalse();
        assertThat(unit.body()).isEqualTo("<p>About me</p>");
    }

    @Test
    void parse_bodyIsConvertedLazily() {
        ContentUnit unit = reader.parse(Path.of("a.md"), ContentKind.PAGES, ContentFormat.MARKDOWN, "# Title");

        assertThat(unit.lazyBody().isComputed()).isFalse();
        assertThat(unit.body()).isEqualTo("<h1>Title</h1>\n");
        assertThat(unit.lazyBody().isComputed()).isTrue();
    }

    @Test
    void parse_stripsByteOrderMark() {
        ContentUnit unit = reader.parse(Path.of("a.html"), ContentKind.PAGES, ContentFormat.HTML,
            "\uFEFF---\ntitle: BOM\n---\nbody");

        assertThat(unit.title()).isEqualTo("BOM");
        assertThat(unit.body()).isEqualTo("body");
    }

    @Test
    void parse_yamlHeader_keepsListsAndStripsQuotesAndComments() {
        ContentUnit unit = reader.parse(Path.of("2023-03-04-yaml.md"), ContentKind.POSTS, ContentFormat.MARKDOWN, """
            ---
            title: "Don't: stop" # trailing comment
            tags: [java, web]
            draft: false
            ---
            Body
            """);

        assertThat(unit.title()).isEqualTo("Don't: stop");
        assertThat(unit.metadata().get("tags")).isInstanceOf(List.class);
        assertThat(unit.tags()).containsExactly("java", "web");
        assertThat(unit.metadata()).containsEntry("draft", false);
    }

    @Test
    void parse_emptyHeader_hasNoMetadata() {
        ContentUnit unit = reader.parse(Path.of("a.html"), ContentKind.PAGES, ContentFormat.HTML,
            "---\n# only a comment\n---\nbody");

        assertThat(unit.metadata()).isEmpty();
        assertThat(unit.body()).isEqualTo("body");
    }

    @Test
    void parse_headerWithoutKeyValuePairs_throws() {
        Path path = Path.of("broken.md");

        assertThatThrownBy(() -> reader.parse(path, ContentKind.PAGES, ContentFormat.MARKDOWN, """
            ---
            title Hello
            ---
            body
            """))
            .isInstanceOf(ContentParseException.class)
            .hasMessageContaining("broken.md")
            .hasMessageContaining("malformed metadata header");
    }

    @Test
    void parse_invalidYamlHeader_throws() {
        assertThatThrownBy(() -> reader.parse(Path.of("bad.md"), ContentKind.PAGES, ContentFormat.MARKDOWN,
            "---\ntags: [java, web\n---\nbody"))
            .isInstanceOf(ContentParseException.class)
            .hasMessageContaining("bad.md")
            .hasMessageContaining("malformed metadata header")
            .hasCauseInstanceOf(JsonProcessingException.class);
    }

    @Test
    void parse_unclosedHeader_throws() {
        assertThatThrownBy(() -> reader.parse(Path.of("open.md"), ContentKind.PAGES, ContentFormat.MARKDOWN,
            "---\ntitle: Hello\nauthor: me\n"))
            .isInstanceOf(ContentParseException.class)
            .hasMessageContaining("not closed");
    }

    @Test
    void read_unsupportedExtension_throws() throws IOException {
        Path file = tempDir.resolve("notes.txt");
        Files.writeString(file, "plain");

        assertThatThrownBy(() -> reader.read(file, ContentKind.PAGES))
            .isInstanceOf(ContentParseException.class)
            .hasMessageContaining(".txt");
    }

    @Test
    void read_usesConfiguredCharset() throws IOException {
        Path file = tempDir.resolve("latin.html");
        Files.writeString(file, "---\ntitle: Café\n---\nnaïve", StandardCharsets.ISO_8859_1);

        ContentUnit unit = new ContentReader(StandardCharsets.ISO_8859_1).read(file, ContentKind.PAGES);

        assertThat(unit.title()).isEqualTo("Café");
        assertThat(unit.body()).isEqualTo("naïve");
    }

    @Test
    void withMetadata_keepsBodyAndAddsKey() {
        ContentUnit unit = reader.parse(Path.of("a.md"), ContentKind.POSTS, ContentFormat.MARKDOWN, "text");

        ContentUnit typed = unit.withMetadata(ContentUnit.TYPE, "post");

        assertThat(typed.metadata()).containsEntry("type", "post");
        assertThat(typed.lazyBody()).isSameAs(unit.lazyBody());
        assertThat(unit.metadata()).doesNotContainKey("type");
    }
}

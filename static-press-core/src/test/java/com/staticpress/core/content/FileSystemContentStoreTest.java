package com.staticpress.core.content;

import com.staticpress.core.TestSite;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FileSystemContentStore}.
 */
class FileSystemContentStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void list_postsAreFlatAndSorted_pagesAreRecursive() {
        TestSite site = TestSite.create(tempDir)
            .post("2023-02-01-second.md", "b")
            .post("2023-01-01-first.md", "a")
            .post("drafts/2023-03-01-draft.md", "ignored")
            .page("about.md", "about")
            .page("docs/guide.html", "guide")
            .page(".hidden.md", "hidden");
        FileSystemContentStore store = new FileSystemContentStore(site.input(), StandardCharsets.UTF_8);

        List<Path> posts = store.list(ContentKind.POSTS);
        List<Path> pages = store.list(ContentKind.PAGES);

        assertThat(posts).extracting(path -> path.getFileName().toString())
            .containsExactly("2023-01-01-first.md", "2023-02-01-second.md");
        assertThat(pages).extracting(path -> store.directory(ContentKind.PAGES).relativize(path).toString().replace('\\', '/'))
            .containsExactly("about.md", "docs/guide.html");
    }

    @Test
    void list_missingDirectory_isEmpty() {
        FileSystemContentStore store = new FileSystemContentStore(tempDir.resolve("nothing"), StandardCharsets.UTF_8);

        assertThat(store.list(ContentKind.POSTS)).isEmpty();
    }

    @Test
    void read_infersKindFromDirectory() {
        TestSite site = TestSite.create(tempDir)
            .post("2023-01-01-first.md", "---\ntitle: First\n---\nHello")
            .page("about.html", "<p>About</p>");
        FileSystemContentStore store = new FileSystemContentStore(site.input(), StandardCharsets.UTF_8);

        ContentUnit post = store.read(store.list(ContentKind.POSTS).get(0));
        ContentUnit page = store.read(store.list(ContentKind.PAGES).get(0));

        assertThat(post.kind()).isEqualTo(ContentKind.POSTS);
        assertThat(post.title()).isEqualTo("First");
        assertThat(page.kind()).isEqualTo(ContentKind.PAGES);
        assertThat(page.body()).isEqualTo("<p>About</p>");
    }
}

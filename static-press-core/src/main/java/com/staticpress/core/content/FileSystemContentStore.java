package com.staticpress.core.content;

import com.staticpress.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Content store backed by the input directory.
 *
 * <p><b>Layout:</b>
 * <pre>
 * resources/
 * ├── posts/       # yyyy-MM-dd-slug.md, flat
 * ├── site/        # standalone pages, any depth
 * └── templates/   # see TemplateLoader
 * </pre>
 *
 * <p>Every call re-reads the filesystem; nothing is cached between calls.
 */
public class FileSystemContentStore implements ContentStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemContentStore.class);

    private final Path inputDirectory;
    private final ContentReader reader;

    /**
     * Creates a store.
     *
     * @param inputDirectory directory containing {@code posts/} and {@code site/}
     * @param charset encoding of content files
     */
    public FileSystemContentStore(Path inputDirectory, Charset charset) {
        this.inputDirectory = Objects.requireNonNull(inputDirectory, "inputDirectory must not be null");
        this.reader = new ContentReader(charset);
    }

    /**
     * Returns the directory holding units of one kind.
     *
     * @param kind posts or pages
     * @return directory path
     */
    public Path directory(ContentKind kind) {
        return inputDirectory.resolve(kind.directoryName());
    }

    @Override
    public List<Path> list(ContentKind kind) {
        Path directory = directory(kind);
        try {
            List<Path> files = FileUtils.listFiles(directory, kind == ContentKind.PAGES);
            log.debug("Found {} {} in {}", files.size(), kind.directoryName(), directory);
            return files;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to list content directory: " + directory, e);
        }
    }

    @Override
    public ContentUnit read(Path path) {
        ContentKind kind = path.startsWith(directory(ContentKind.POSTS)) ? ContentKind.POSTS : ContentKind.PAGES;
        return reader.read(path, kind);
    }
}

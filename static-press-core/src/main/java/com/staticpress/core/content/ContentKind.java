package com.staticpress.core.content;

/**
 * The two kinds of content unit a site is compiled from.
 */
public enum ContentKind {
    /** Dated blog posts, read from {@code posts/}. */
    POSTS("posts", "post"),
    /** Standalone pages, read recursively from {@code site/}. */
    PAGES("site", "site");

    private final String directoryName;
    private final String typeName;

    ContentKind(String directoryName, String typeName) {
        this.directoryName = directoryName;
        this.typeName = typeName;
    }

    /**
     * Returns the directory below the input directory holding this kind.
     *
     * @return directory name
     */
    public String directoryName() {
        return directoryName;
    }

    /**
     * Returns the value stored under the {@code type} metadata key while rendering.
     *
     * @return type name
     */
    public String typeName() {
        return typeName;
    }
}

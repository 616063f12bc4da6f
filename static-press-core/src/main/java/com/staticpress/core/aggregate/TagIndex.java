package com.staticpress.core.aggregate;

import com.staticpress.core.content.ContentUnit;
import com.staticpress.core.url.UrlResolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Posts grouped by tag.
 *
 * <p>Tags are sorted; within a tag, posts keep the order of the list they were built from.
 * Posts without a {@code tags} key are skipped.
 */
public final class TagIndex {

    private final SortedMap<String, List<PostLink>> postsByTag;

    private TagIndex(SortedMap<String, List<PostLink>> postsByTag) {
        this.postsByTag = postsByTag;
    }

    /**
     * Builds the index.
     *
     * @param posts posts in store order
     * @param urls resolver for post URLs
     * @return tag index
     */
    public static TagIndex build(List<ContentUnit> posts, UrlResolver urls) {
        SortedMap<String, List<PostLink>> index = new TreeMap<>();
        for (ContentUnit post : posts) {
            if (!post.hasTags()) {
                continue;
            }
            PostLink link = new PostLink(urls.postUrl(post.path()), post.title());
            for (String tag : post.tags()) {
                index.computeIfAbsent(tag, key -> new ArrayList<>()).add(link);
            }
        }
        index.replaceAll((tag, links) -> List.copyOf(links));
        return new TagIndex(Collections.unmodifiableSortedMap(index));
    }

    public SortedMap<String, List<PostLink>> postsByTag() {
        return postsByTag;
    }

    public Set<String> tags() {
        return postsByTag.keySet();
    }

    /**
     * Returns the posts carrying a tag.
     *
     * @param tag tag name
     * @return links in store order, empty for an unknown tag
     */
    public List<PostLink> postsFor(String tag) {
        return postsByTag.getOrDefault(tag, List.of());
    }

    public boolean isEmpty() {
        return postsByTag.isEmpty();
    }
}

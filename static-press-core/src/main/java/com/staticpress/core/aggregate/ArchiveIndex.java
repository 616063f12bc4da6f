package com.staticpress.core.aggregate;

import com.staticpress.core.content.ContentUnit;
import com.staticpress.core.url.PostDates;
import com.staticpress.core.util.FileUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Post counts per {@code yyyy-MM} month, newest month first.
 */
public final class ArchiveIndex {

    private final List<ContentUnit> posts;
    private final SortedMap<String, Integer> monthCounts;

    private ArchiveIndex(List<ContentUnit> posts, SortedMap<String, Integer> monthCounts) {
        this.posts = posts;
        this.monthCounts = monthCounts;
    }

    /**
     * Builds the index.
     *
     * @param posts posts in store order
     * @return archive index
     * @throws com.staticpress.core.url.DateParseException if a post has no valid date token
     */
    public static ArchiveIndex build(List<ContentUnit> posts) {
        SortedMap<String, Integer> counts = new TreeMap<>(Comparator.reverseOrder());
        for (ContentUnit post : posts) {
            counts.merge(PostDates.monthKey(post.path()), 1, Integer::sum);
        }
        return new ArchiveIndex(List.copyOf(posts), Collections.unmodifiableSortedMap(counts));
    }

    /**
     * Returns the number of posts per month.
     *
     * @return month key to count, newest month first
     */
    public SortedMap<String, Integer> monthCounts() {
        return monthCounts;
    }

    /**
     * Returns the posts published in a month.
     *
     * @param monthKey {@code yyyy-MM}
     * @return posts whose file name starts with the key, newest first
     */
    public List<ContentUnit> postsForMonth(String monthKey) {
        List<ContentUnit> matching = new ArrayList<>();
        for (ContentUnit post : posts) {
            if (FileUtils.getBaseName(post.path()).startsWith(monthKey)) {
                matching.add(post);
            }
        }
        Collections.reverse(matching);
        return matching;
    }
}

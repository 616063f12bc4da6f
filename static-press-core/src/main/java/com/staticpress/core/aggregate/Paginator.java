package com.staticpress.core.aggregate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits posts into the pages of the latest-posts listing.
 *
 * <p>Page {@code 0} holds the oldest posts and the highest index the newest ones. Every page
 * except the oldest links to the next older page; every page except the newest links to the
 * next newer one. A single page carries no links.
 */
public final class Paginator {

    private Paginator() {
        // Utility class
    }

    /**
     * One page of the listing.
     *
     * @param index page number, {@code 0} is the oldest
     * @param items items on the page, newest first
     * @param hasOlder whether an "older entries" link is shown
     * @param hasNewer whether a "newer entries" link is shown
     * @param olderIndex target of the older link, {@code -1} without one
     * @param newerIndex target of the newer link, {@code -1} without one
     * @param <T> item type
     */
    public record Page<T>(
        int index,
        List<T> items,
        boolean hasOlder,
        boolean hasNewer,
        int olderIndex,
        int newerIndex
    ) {
        public Page {
            items = List.copyOf(items);
        }
    }

    /**
     * Paginates items.
     *
     * @param newestFirst items, newest first
     * @param pageSize maximum items per page
     * @param <T> item type
     * @return pages in index order, empty for no items
     * @throws IllegalArgumentException if pageSize is not positive
     */
    public static <T> List<Page<T>> paginate(List<T> newestFirst, int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be positive, was: " + pageSize);
        }

        List<List<T>> chunks = new ArrayList<>();
        for (int start = 0; start < newestFirst.size(); start += pageSize) {
            chunks.add(newestFirst.subList(start, Math.min(start + pageSize, newestFirst.size())));
        }
        Collections.reverse(chunks);

        int max = chunks.size() - 1;
        List<Page<T>> pages = new ArrayList<>(chunks.size());
        for (int index = 0; index <= max; index++) {
            boolean hasOlder = index > 0;
            boolean hasNewer = index < max;
            pages.add(new Page<>(index, chunks.get(index), hasOlder, hasNewer,
                hasOlder ? index - 1 : -1,
                hasNewer ? index + 1 : -1));
        }
        return pages;
    }
}

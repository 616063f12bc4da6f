package com.staticpress.core.feed;

/**
 * One {@code <url>} entry of the sitemap.
 *
 * @param loc absolute URL
 */
public record SitemapUrl(String loc) {
}

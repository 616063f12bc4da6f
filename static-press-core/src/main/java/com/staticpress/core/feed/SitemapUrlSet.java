package com.staticpress.core.feed;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

import java.util.List;

/**
 * Root {@code <urlset>} element of a sitemap.
 *
 * @param xmlns sitemap schema namespace
 * @param urls entries in output order
 */
@JacksonXmlRootElement(localName = "urlset")
@JsonPropertyOrder({"xmlns", "url"})
public record SitemapUrlSet(
    @JacksonXmlProperty(isAttribute = true, localName = "xmlns") String xmlns,
    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "url")
    List<SitemapUrl> urls
) {
    public static final String NAMESPACE = "http://www.sitemaps.org/schemas/sitemap/0.9";

    public SitemapUrlSet(List<SitemapUrl> urls) {
        this(NAMESPACE, urls);
    }

    public SitemapUrlSet {
        urls = urls == null ? List.of() : List.copyOf(urls);
    }
}

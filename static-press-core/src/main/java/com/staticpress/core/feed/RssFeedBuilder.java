package com.staticpress.core.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.staticpress.core.config.SiteConfig;
import com.staticpress.core.content.ContentUnit;
import com.staticpress.core.url.PostDates;
import com.staticpress.core.url.UrlResolver;
import com.staticpress.core.util.ParallelMapper;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * Builds the RSS 2.0 feed of the newest posts.
 *
 * <p><b>Output:</b>
 * <pre>{@code
 * <?xml version="1.0" encoding="UTF-8"?>
 * <!DOCTYPE html PUBLIC "-//W3C//DTD XHTML 1.0 Strict//EN" "...">
 * <rss version="2.0">
 *   <channel>
 *     <title>...</title><link>...</link><description>...</description>
 *     <item><title/><link/><pubDate/><description/></item>
 *   </channel>
 * </rss>
 * }</pre>
 */
public class RssFeedBuilder {

    public static final int MAX_ITEMS = 10;

    static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";
    static final String DOCTYPE = "<!DOCTYPE html PUBLIC \"-//W3C//DTD XHTML 1.0 Strict//EN\" "
        + "\"http://www.w3.org/TR/xhtml1/DTD/xhtml1-strict.dtd\">";

    private static final XmlMapper XML_MAPPER = XmlMapper.builder()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .build();

    private final SiteConfig config;
    private final UrlResolver urls;

    /**
     * Creates a builder.
     *
     * @param config site title, description and URL
     * @param urls resolver for post URLs
     */
    public RssFeedBuilder(SiteConfig config, UrlResolver urls) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.urls = Objects.requireNonNull(urls, "urls must not be null");
    }

    /**
     * Builds the feed.
     *
     * @param posts posts in store order, oldest first
     * @param executor pool used to build items
     * @return feed document
     * @throws com.staticpress.core.url.DateParseException if an item's date cannot be read
     */
    public String build(List<ContentUnit> posts, ExecutorService executor) {
        List<ContentUnit> newest = new ArrayList<>(posts);
        Collections.reverse(newest);
        newest = newest.subList(0, Math.min(MAX_ITEMS, newest.size()));

        List<RssItem> items = ParallelMapper.map(executor, newest, this::item);
        RssDocument document = new RssDocument(
            new RssChannel(config.siteTitle(), config.siteUrl(), config.siteDescription(), items));
        return XML_DECLARATION + "\n" + DOCTYPE + "\n" + write(document);
    }

    RssItem item(ContentUnit post) {
        String link = URI.create(config.siteUrl()).resolve(urls.postUrl(post.path())).toString();
        return new RssItem(
            Objects.toString(post.title(), ""),
            link,
            PostDates.rfc822(post.path()),
            post.body());
    }

    private static String write(RssDocument document) {
        try {
            return XML_MAPPER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize RSS feed", e);
        }
    }
}

package com.staticpress.core.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;
import com.staticpress.core.config.SiteConfig;
import com.staticpress.core.url.UrlResolver;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds {@code sitemap.xml} (sitemap protocol 0.9).
 *
 * <p>Entries are the site root, then every post, then every page, each in store order. Only
 * {@code <loc>} is written.
 */
public class SitemapBuilder {

    private static final XmlMapper XML_MAPPER = XmlMapper.builder()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .build();

    private final SiteConfig config;
    private final UrlResolver urls;

    public SitemapBuilder(SiteConfig config, UrlResolver urls) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.urls = Objects.requireNonNull(urls, "urls must not be null");
    }

    /**
     * Lists the sitemap entries.
     *
     * @param posts post paths in store order
     * @param pages page paths in store order
     * @return entries, root first
     */
    public List<SitemapUrl> entries(List<Path> posts, List<Path> pages) {
        String base = config.baseUrl();
        List<SitemapUrl> entries = new ArrayList<>(1 + posts.size() + pages.size());
        entries.add(new SitemapUrl(config.siteUrl()));
        for (Path post : posts) {
            entries.add(new SitemapUrl(base + urls.postUrl(post)));
        }
        for (Path page : pages) {
            entries.add(new SitemapUrl(base + "/" + urls.siteUrl(page)));
        }
        return entries;
    }

    /**
     * Builds the sitemap document.
     *
     * @param posts post paths in store order
     * @param pages page paths in store order
     * @return XML document
     */
    public String build(List<Path> posts, List<Path> pages) {
        SitemapUrlSet urlSet = new SitemapUrlSet(entries(posts, pages));
        try {
            return XML_MAPPER.writer()
                .with(ToXmlGenerator.Feature.WRITE_XML_DECLARATION)
                .writeValueAsString(urlSet);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize sitemap", e);
        }
    }
}

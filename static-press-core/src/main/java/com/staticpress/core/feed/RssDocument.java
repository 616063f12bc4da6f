package com.staticpress.core.feed;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

/**
 * Root {@code <rss version="2.0">} element.
 *
 * @param version RSS version attribute
 * @param channel the single channel
 */
@JacksonXmlRootElement(localName = "rss")
@JsonPropertyOrder({"version", "channel"})
public record RssDocument(
    @JacksonXmlProperty(isAttribute = true) String version,
    RssChannel channel
) {
    public static final String VERSION = "2.0";

    public RssDocument(RssChannel channel) {
        this(VERSION, channel);
    }
}

package com.staticpress.core.feed;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;

import java.util.List;

/**
 * The {@code <channel>} element: site details followed by the items.
 *
 * @param title site title
 * @param link site URL
 * @param description site description
 * @param items newest posts first
 */
@JsonPropertyOrder({"title", "link", "description", "item"})
public record RssChannel(
    String title,
    String link,
    String description,
    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "item")
    List<RssItem> items
) {
    public RssChannel {
        items = items == null ? List.of() : List.copyOf(items);
    }
}

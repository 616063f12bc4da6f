package com.staticpress.core.feed;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One {@code <item>} of the RSS feed.
 *
 * @param title post title
 * @param link absolute post URL
 * @param pubDate RFC-822 publication date
 * @param description post body, escaped by the XML writer
 */
@JsonPropertyOrder({"title", "link", "pubDate", "description"})
public record RssItem(
    String title,
    String link,
    String pubDate,
    String description
) {
}

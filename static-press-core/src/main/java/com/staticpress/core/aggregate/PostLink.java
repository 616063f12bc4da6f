package com.staticpress.core.aggregate;

/**
 * Link to a post as listed on the tags page.
 *
 * @param url post URL, {@code /yyyy/MM/dd/slug/}
 * @param title post title, empty if the post has none
 */
public record PostLink(String url, String title) {

    public PostLink {
        if (title == null) {
            title = "";
        }
    }
}

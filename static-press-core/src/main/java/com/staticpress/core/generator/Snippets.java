package com.staticpress.core.generator;

import com.staticpress.core.content.ContentUnit;
import com.staticpress.core.url.PostDates;
import com.staticpress.core.url.UrlResolver;
import j2html.tags.DomContent;

import java.util.List;
import java.util.Objects;

import static j2html.TagCreator.a;
import static j2html.TagCreator.div;
import static j2html.TagCreator.h2;
import static j2html.TagCreator.p;
import static j2html.TagCreator.rawHtml;

/**
 * Post summaries used by the archive and latest-posts pages.
 *
 * <pre>{@code
 * <div>
 *   <h2><a href="/2023/01/02/hello/">Hello</a></h2>
 *   <p class="publish_date">02 Jan 2023</p>
 *   <p>...body...</p>
 * </div>
 * }</pre>
 */
public final class Snippets {

    private Snippets() {
        // Utility class
    }

    /**
     * Builds the snippet of one post.
     *
     * @param post post to summarize
     * @param urls resolver for the post URL
     * @return snippet element
     */
    public static DomContent snippet(ContentUnit post, UrlResolver urls) {
        return div(
            h2(a(Objects.toString(post.title(), "")).withHref(urls.postUrl(post.path()))),
            p(PostDates.snippetDate(post.path())).withClass("publish_date"),
            p(rawHtml(post.body()))
        );
    }

    /**
     * Renders the snippets of several posts, in the given order.
     *
     * @param posts posts to summarize
     * @param urls resolver for post URLs
     * @return concatenated markup
     */
    public static String render(List<ContentUnit> posts, UrlResolver urls) {
        StringBuilder out = new StringBuilder();
        for (ContentUnit post : posts) {
            out.append(snippet(post, urls).render());
        }
        return out.toString();
    }
}

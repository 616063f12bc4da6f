package com.staticpress.core.generator.impl;

import com.staticpress.core.aggregate.Paginator;
import com.staticpress.core.content.ContentUnit;
import com.staticpress.core.generator.GenerationContext;
import com.staticpress.core.generator.SiteGenerator;
import com.staticpress.core.generator.Snippets;
import com.staticpress.core.renderer.GeneratedFile;
import com.staticpress.core.renderer.GeneratedOutput;
import com.staticpress.core.util.ParallelMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static j2html.TagCreator.a;
import static j2html.TagCreator.div;
import static j2html.TagCreator.rawHtml;

/**
 * Writes the paginated post listing {@code latest-posts/{n}/index.html}.
 *
 * <p>Page {@code 0} holds the oldest posts. Each page carries up to {@code posts-per-page}
 * snippets, newest first, followed by pager links:
 * <pre>{@code
 * <div class="pager-left"><a href="/latest-posts/0/">&laquo; Older Entries</a></div>
 * <div class="pager-right"><a href="/latest-posts/2/">Newer Entries &raquo;</a></div>
 * }</pre>
 */
public class LatestPostsGenerator implements SiteGenerator {

    public static final String DIRECTORY = "latest-posts";

    @Override
    public String getId() {
        return "latest-posts";
    }

    @Override
    public String getDisplayName() {
        return "Latest Posts";
    }

    @Override
    public int order() {
        return 30;
    }

    @Override
    public GeneratedOutput generate(GenerationContext context) {
        List<ContentUnit> newestFirst = new ArrayList<>(context.posts());
        Collections.reverse(newestFirst);
        List<Paginator.Page<ContentUnit>> pages = Paginator.paginate(newestFirst, context.config().postsPerPage());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(ContentUnit.TITLE, context.config().siteTitle());
        metadata.put("description", context.config().siteDescription());
        metadata.put(ContentUnit.TEMPLATE, context.config().defaultTemplate());

        return new GeneratedOutput(ParallelMapper.map(context.itemExecutor(), pages, page ->
            GeneratedFile.html(pagePath(page.index()), context.renderPage(metadata, body(page, context)))));
    }

    /**
     * Returns the output path of a listing page.
     *
     * @param index page index
     * @return {@code latest-posts/{index}/index.html}
     */
    public static String pagePath(int index) {
        return DIRECTORY + "/" + index + "/index.html";
    }

    private static String body(Paginator.Page<ContentUnit> page, GenerationContext context) {
        StringBuilder out = new StringBuilder(Snippets.render(page.items(), context.urls()));
        if (page.hasOlder()) {
            out.append(div(a(rawHtml("&laquo; Older Entries")).withHref(pageUrl(page.olderIndex())))
                .withClass("pager-left").render());
        }
        if (page.hasNewer()) {
            out.append(div(a(rawHtml("Newer Entries &raquo;")).withHref(pageUrl(page.newerIndex())))
                .withClass("pager-right").render());
        }
        return out.toString();
    }

    private static String pageUrl(int index) {
        return "/" + DIRECTORY + "/" + index + "/";
    }
}

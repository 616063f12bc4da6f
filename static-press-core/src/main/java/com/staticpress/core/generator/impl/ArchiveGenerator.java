package com.staticpress.core.generator.impl;

import com.staticpress.core.aggregate.ArchiveIndex;
import com.staticpress.core.content.ContentUnit;
import com.staticpress.core.generator.GenerationContext;
import com.staticpress.core.generator.SiteGenerator;
import com.staticpress.core.generator.Snippets;
import com.staticpress.core.renderer.GeneratedFile;
import com.staticpress.core.renderer.GeneratedOutput;
import com.staticpress.core.url.PostDates;
import com.staticpress.core.util.ParallelMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static j2html.TagCreator.a;
import static j2html.TagCreator.each;
import static j2html.TagCreator.h2;
import static j2html.TagCreator.li;
import static j2html.TagCreator.text;
import static j2html.TagCreator.ul;

/**
 * Writes the archives: {@code archives/index.html} lists every month with its post count,
 * and {@code archives/yyyy/MM/index.html} holds the snippets of that month, newest first.
 */
public class ArchiveGenerator implements SiteGenerator {

    static final String INDEX_PATH = "archives/index.html";
    static final String TITLE = "Archives";

    @Override
    public String getId() {
        return "archives";
    }

    @Override
    public String getDisplayName() {
        return "Monthly Archives";
    }

    @Override
    public int order() {
        return 20;
    }

    @Override
    public GeneratedOutput generate(GenerationContext context) {
        ArchiveIndex index = ArchiveIndex.build(context.posts());
        Map<String, Object> metadata = Map.of(ContentUnit.TITLE, TITLE);

        String body = h2(TITLE).render()
            + ul(each(index.monthCounts().entrySet(), month -> li(
                a(PostDates.monthHeading(month.getKey())).withHref(monthUrl(month.getKey())),
                text(" (" + month.getValue() + ")")))).render();

        List<GeneratedFile> files = new ArrayList<>();
        files.add(GeneratedFile.html(INDEX_PATH, context.renderPage(metadata, body)));

        List<String> months = new ArrayList<>(index.monthCounts().keySet());
        files.addAll(ParallelMapper.map(context.itemExecutor(), months, month -> GeneratedFile.html(
            monthUrl(month).substring(1) + "index.html",
            context.renderPage(metadata, Snippets.render(index.postsForMonth(month), context.urls())))));

        return new GeneratedOutput(files);
    }

    /**
     * Returns the URL of a month page.
     *
     * @param monthKey {@code yyyy-MM}
     * @return {@code /archives/yyyy/MM/}
     */
    static String monthUrl(String monthKey) {
        return "/archives/" + monthKey.replace('-', '/') + "/";
    }
}

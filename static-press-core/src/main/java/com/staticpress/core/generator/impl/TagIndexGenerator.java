package com.staticpress.core.generator.impl;

import com.staticpress.core.aggregate.PostLink;
import com.staticpress.core.aggregate.TagIndex;
import com.staticpress.core.content.ContentUnit;
import com.staticpress.core.generator.GenerationContext;
import com.staticpress.core.generator.SiteGenerator;
import com.staticpress.core.renderer.GeneratedFile;
import com.staticpress.core.renderer.GeneratedOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

import static j2html.TagCreator.a;
import static j2html.TagCreator.each;
import static j2html.TagCreator.h2;
import static j2html.TagCreator.h4;
import static j2html.TagCreator.li;
import static j2html.TagCreator.ul;

/**
 * Writes {@code tags/index.html}: every tag with an anchor and the posts carrying it.
 *
 * <p><b>Generated body:</b>
 * <pre>{@code
 * <h2>Tags</h2>
 * <h4><a name="java">java</a></h4>
 * <ul><li><a href="/2023/01/02/hello/">Hello</a></li></ul>
 * }</pre>
 */
public class TagIndexGenerator implements SiteGenerator {

    private static final Logger log = LoggerFactory.getLogger(TagIndexGenerator.class);

    static final String OUTPUT_PATH = "tags/index.html";
    static final String TITLE = "Tags";

    @Override
    public String getId() {
        return "tags";
    }

    @Override
    public String getDisplayName() {
        return "Tag Index";
    }

    @Override
    public int order() {
        return 10;
    }

    @Override
    public GeneratedOutput generate(GenerationContext context) {
        TagIndex index = TagIndex.build(context.posts(), context.urls());
        log.debug("Indexed {} tags", index.tags().size());

        StringBuilder body = new StringBuilder(h2(TITLE).render());
        index.postsByTag().forEach((tag, links) -> body.append(tagSection(tag, links)));

        String page = context.renderPage(Map.of(ContentUnit.TITLE, TITLE), body.toString());
        return GeneratedOutput.of(GeneratedFile.html(OUTPUT_PATH, page));
    }

    private static String tagSection(String tag, List<PostLink> links) {
        return h4(a(tag).attr("name", tag)).render()
            + ul(each(links, link -> li(a(link.title()).withHref(link.url())))).render();
    }
}

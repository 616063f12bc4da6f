package com.staticpress.core.template;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ExpressionTemplate} and the page expression language.
 */
class ExpressionTemplateTest {

    private static String render(String source, Map<String, Object> metadata, String content) {
        return ExpressionTemplate.compile("test.expr", source).render(new RenderEnvironment(metadata, content));
    }

    private static String render(String source) {
        return render(source, Map.of(), "");
    }

    @Test
    void render_pageLayout() {
        String source = """
            doctype("html5")
            html(
              head(title(metadata.title)),
              body(h1(metadata.title), div({class: "post"}, content))
            )
            """;

        String html = render(source, Map.of("title", "Hello"), "<p>Hi</p>");

        assertThat(html).isEqualTo("<!DOCTYPE html><html><head><title>Hello</title></head>"
            + "<body><h1>Hello</h1><div class=\"post\"><p>Hi</p></div></body></html>");
    }

    @Test
    void render_stringsAreUnescaped_textEscapes() {
        assertThat(render("p(\"<b>bold</b>\")")).isEqualTo("<p><b>bold</b></p>");
        assertThat(render("p(text(\"a < b & c\"))")).isEqualTo("<p>a &lt; b &amp; c</p>");
    }

    @Test
    void render_literals() {
        assertThat(render("str(1, \" \", 2.5, \" \", true, \" \", null, \"|\")")).isEqualTo("1 2.5 true |");
        assertThat(render("get([\"a\", \"b\"], 1)")).isEqualTo("b");
        assertThat(render("get({\"x-y\": 1, z: 2}, \"x-y\")")).isEqualTo("1");
        assertThat(render("'single \\'quoted\\''")).isEqualTo("single 'quoted'");
        assertThat(render("\"line\\nbreak\"")).isEqualTo("line\nbreak");
    }

    @Test
    void render_memberAccessOnMissingValue_isEmpty() {
        assertThat(render("p(metadata.missing.deeper)", Map.of(), "")).isEqualTo("<p></p>");
    }

    @Test
    void render_indexAccessWithHyphenatedKey() {
        assertThat(render("metadata[\"post-date\"]", Map.of("post-date", "2023-01-02"), "")).isEqualTo("2023-01-02");
    }

    @Test
    void render_conditionals() {
        String source = "if(metadata.draft, \"draft\", \"live\") when(metadata.tags, ul(li(\"tagged\"))) or(metadata.x, \"fallback\")";

        assertThat(render(source, Map.of("draft", true, "tags", List.of("a")), ""))
            .isEqualTo("draft<ul><li>tagged</li></ul>fallback");
        assertThat(render(source, Map.of("tags", List.of()), ""))
            .isEqualTo("livefallback");
    }

    @Test
    void render_listsAreSplicedIntoElements() {
        String source = "ul(split(metadata.tags)) join(split(\"a,b,c\", \",\"), \"-\")";

        assertThat(render(source, Map.of("tags", "java web"), "")).isEqualTo("<ul>javaweb</ul>a-b-c");
    }

    @Test
    void render_builtinLinks() {
        assertThat(render("linkTo(\"/about.html\", \"About\")")).isEqualTo("<a href=\"/about.html\">About</a>");
        assertThat(render("includeJs(\"/app.js\")"))
            .isEqualTo("<script type=\"text/javascript\" src=\"/app.js\"></script>");
    }

    @Test
    void render_voidElementsAndBooleanAttributes() {
        assertThat(render("br()")).isEqualTo("<br>");
        assertThat(render("input({type: \"checkbox\", checked: true, disabled: false})"))
            .isEqualTo("<input type=\"checkbox\" checked=\"checked\">");
    }

    @Test
    void render_sameContentBindingAsSubstitution() {
        String body = "<article>Body & <em>markup</em></article>";
        Template expression = ExpressionTemplate.compile("t.expr", "content");
        Template substitution = new SubstitutionTemplate("t.html", "$content$");
        RenderEnvironment environment = new RenderEnvironment(Map.of(), body);

        assertThat(expression.render(environment)).isEqualTo(body);
        assertThat(substitution.render(environment)).isEqualTo(body);
    }

    @Test
    void render_unknownName_throws() {
        assertThatThrownBy(() -> render("p(System)"))
            .isInstanceOf(TemplateException.class)
            .hasMessageContaining("System");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "Foo()              | unknown function or element",
        "br(\"text\")       | void element",
        "if(true)           | expects",
        "doctype(\"html9\") | Unknown doctype",
        "p({a: 1}, {b: 2})  | Attributes must be the first argument"
    })
    void render_invalidCalls_throw(String source, String message) {
        assertThatThrownBy(() -> render(source))
            .isInstanceOf(TemplateException.class)
            .hasMessageContaining("test.expr")
            .hasMessageContaining(message);
    }

    @Test
    void compile_syntaxError_namesTemplateAndPosition() {
        assertThatThrownBy(() -> ExpressionTemplate.compile("layout.expr", "html(\n  body(\n"))
            .isInstanceOf(TemplateException.class)
            .hasMessageContaining("layout.expr")
            .hasMessageContaining("Syntax error");
    }

    @Test
    void compiledTemplate_rendersConcurrently() {
        Template template = ExpressionTemplate.compile("t.expr", "p(metadata.n)");

        List<String> rendered = IntStream.range(0, 50).parallel()
            .mapToObj(i -> template.render(new RenderEnvironment(Map.of("n", i), "")))
            .toList();

        assertThat(rendered).hasSize(50).contains("<p>0</p>", "<p>49</p>");
    }
}

package com.staticpress.core.template.expr;

import com.staticpress.core.template.TemplateException;
import j2html.TagCreator;
import j2html.tags.ContainerTag;
import j2html.tags.DomContent;
import j2html.tags.EmptyTag;
import j2html.tags.Tag;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Built-in functions and element builders available to page expressions.
 *
 * <p>A call whose name is not a built-in builds an HTML element with that name. A leading map
 * argument supplies attributes; the remaining arguments become children. Children follow the
 * hiccup conventions: strings are inserted as markup without escaping, lists are spliced in,
 * {@code null} is dropped. Use {@code text(...)} to escape.
 *
 * <table>
 *   <caption>Built-ins</caption>
 *   <tr><td>{@code raw(x...)}</td><td>markup, unescaped</td></tr>
 *   <tr><td>{@code text(x...)}</td><td>text, HTML-escaped</td></tr>
 *   <tr><td>{@code str(x...)}</td><td>plain string concatenation</td></tr>
 *   <tr><td>{@code if(cond, then, else?)}</td><td>conditional value</td></tr>
 *   <tr><td>{@code when(cond, x...)}</td><td>values if cond is truthy, else nothing</td></tr>
 *   <tr><td>{@code or(x...)}</td><td>first truthy value</td></tr>
 *   <tr><td>{@code get(coll, key, default?)}</td><td>map or list lookup</td></tr>
 *   <tr><td>{@code split(s, sep?)}</td><td>split on a literal separator or whitespace</td></tr>
 *   <tr><td>{@code join(list, sep?)}</td><td>join values</td></tr>
 *   <tr><td>{@code doctype(kind?)}</td><td>html5, xhtml-strict, xhtml-transitional, html4</td></tr>
 *   <tr><td>{@code linkTo(url, x...)}</td><td>anchor element</td></tr>
 *   <tr><td>{@code includeCss(url...)}</td><td>stylesheet links</td></tr>
 *   <tr><td>{@code includeJs(url...)}</td><td>script elements</td></tr>
 * </table>
 */
final class MarkupFunctions {

    private static final Set<String> BUILTINS = Set.of(
        "raw", "text", "str", "if", "when", "or", "get", "split", "join",
        "doctype", "linkTo", "includeCss", "includeJs"
    );

    private static final Set<String> VOID_ELEMENTS = Set.of(
        "area", "base", "br", "col", "embed", "hr", "img", "input",
        "link", "meta", "source", "track", "wbr"
    );

    private static final Pattern ELEMENT_NAME = Pattern.compile("[a-z][a-z0-9]*");

    private static final Map<String, String> DOCTYPES = Map.of(
        "html5", "<!DOCTYPE html>",
        "xhtml-strict", "<!DOCTYPE html PUBLIC \"-//W3C//DTD XHTML 1.0 Strict//EN\" "
            + "\"http://www.w3.org/TR/xhtml1/DTD/xhtml1-strict.dtd\">",
        "xhtml-transitional", "<!DOCTYPE html PUBLIC \"-//W3C//DTD XHTML 1.0 Transitional//EN\" "
            + "\"http://www.w3.org/TR/xhtml1/DTD/xhtml1-transitional.dtd\">",
        "html4", "<!DOCTYPE html PUBLIC \"-//W3C//DTD HTML 4.01//EN\" "
            + "\"http://www.w3.org/TR/html4/strict.dtd\">"
    );

    private MarkupFunctions() {
        // Utility class
    }

    static boolean isBuiltin(String name) {
        return BUILTINS.contains(name);
    }

    static boolean isElementName(String name) {
        return ELEMENT_NAME.matcher(name).matches();
    }

    /**
     * Invokes a built-in function.
     *
     * @param name built-in name
     * @param args evaluated arguments
     * @return function result
     */
    static Object invoke(String name, List<Object> args) {
        return switch (name) {
            case "raw" -> TagCreator.rawHtml(concat(args));
            case "text" -> TagCreator.text(concat(args));
            case "str" -> concat(args);
            case "if" -> {
                requireArity(name, args, 2, 3);
                yield truthy(args.get(0)) ? args.get(1) : (args.size() == 3 ? args.get(2) : null);
            }
            case "when" -> {
                requireArity(name, args, 1, Integer.MAX_VALUE);
                yield truthy(args.get(0)) ? new ArrayList<>(args.subList(1, args.size())) : null;
            }
            case "or" -> args.stream().filter(MarkupFunctions::truthy).findFirst().orElse(null);
            case "get" -> {
                requireArity(name, args, 2, 3);
                Object value = lookup(args.get(0), args.get(1));
                yield value != null ? value : (args.size() == 3 ? args.get(2) : null);
            }
            case "split" -> split(name, args);
            case "join" -> join(name, args);
            case "doctype" -> doctype(name, args);
            case "linkTo" -> {
                requireArity(name, args, 1, Integer.MAX_VALUE);
                List<Object> elementArgs = new ArrayList<>();
                elementArgs.add(Map.of("href", toMarkup(args.get(0))));
                elementArgs.addAll(args.subList(1, args.size()));
                yield element("a", elementArgs);
            }
            case "includeCss" -> args.stream()
                .map(url -> (DomContent) TagCreator.emptyTag("link")
                    .attr("type", "text/css")
                    .attr("href", toMarkup(url))
                    .attr("rel", "stylesheet"))
                .toList();
            case "includeJs" -> args.stream()
                .map(url -> (DomContent) TagCreator.tag("script")
                    .attr("type", "text/javascript")
                    .attr("src", toMarkup(url)))
                .toList();
            default -> throw new TemplateException("Unknown function: " + name);
        };
    }

    /**
     * Builds an HTML element.
     *
     * @param name element name
     * @param args optional attribute map followed by children
     * @return element
     */
    static DomContent element(String name, List<Object> args) {
        int firstChild = 0;
        Map<?, ?> attributes = Map.of();
        if (!args.isEmpty() && args.get(0) instanceof Map<?, ?> map) {
            attributes = map;
            firstChild = 1;
        }
        List<Object> children = args.subList(firstChild, args.size());

        if (VOID_ELEMENTS.contains(name)) {
            if (children.stream().anyMatch(child -> child != null)) {
                throw new TemplateException("<" + name + "> is a void element and cannot have content");
            }
            EmptyTag<?> tag = TagCreator.emptyTag(name);
            applyAttributes(tag, attributes);
            return tag;
        }

        ContainerTag<?> tag = TagCreator.tag(name);
        applyAttributes(tag, attributes);
        List<DomContent> content = new ArrayList<>();
        children.forEach(child -> collectChildren(child, content));
        for (DomContent child : content) {
            tag.with(child);
        }
        return tag;
    }

    /**
     * Renders any expression value as markup.
     *
     * @param value evaluated value
     * @return markup string
     */
    static String toMarkup(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof DomContent dom) {
            return dom.render();
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream().map(MarkupFunctions::toMarkup).collect(Collectors.joining());
        }
        if (value instanceof Map<?, ?>) {
            throw new TemplateException("A map cannot be rendered as markup: " + value);
        }
        return value.toString();
    }

    /**
     * Truthiness: null, false and empty strings, lists and maps are false.
     *
     * @param value evaluated value
     * @return truthiness
     */
    static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof CharSequence text) {
            return text.length() > 0;
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        return true;
    }

    /**
     * Looks up a key in a map or an index in a list.
     *
     * @param target map, list or null
     * @param key key or index
     * @return value, or null if absent
     */
    static Object lookup(Object target, Object key) {
        if (target == null || key == null) {
            return null;
        }
        if (target instanceof Map<?, ?> map) {
            return map.get(key.toString());
        }
        if (target instanceof List<?> list && key instanceof Number number) {
            int index = number.intValue();
            return index >= 0 && index < list.size() ? list.get(index) : null;
        }
        throw new TemplateException("Cannot look up '" + key + "' in a " + target.getClass().getSimpleName());
    }

    private static void collectChildren(Object child, List<DomContent> into) {
        if (child == null) {
            return;
        }
        if (child instanceof DomContent dom) {
            into.add(dom);
        } else if (child instanceof Collection<?> collection) {
            collection.forEach(element -> collectChildren(element, into));
        } else if (child instanceof Map<?, ?>) {
            throw new TemplateException("Attributes must be the first argument of an element");
        } else {
            into.add(TagCreator.rawHtml(child.toString()));
        }
    }

    private static void applyAttributes(Tag<?> tag, Map<?, ?> attributes) {
        attributes.forEach((key, value) -> {
            String attribute = key.toString();
            if (value == null || Boolean.FALSE.equals(value)) {
                return;
            }
            if (Boolean.TRUE.equals(value)) {
                tag.attr(attribute, attribute);
            } else if (value instanceof Collection<?> collection) {
                tag.attr(attribute, collection.stream().map(MarkupFunctions::toMarkup).collect(Collectors.joining(" ")));
            } else {
                tag.attr(attribute, toMarkup(value));
            }
        });
    }

    private static String concat(List<Object> args) {
        return args.stream().map(MarkupFunctions::toMarkup).collect(Collectors.joining());
    }

    private static List<String> split(String name, List<Object> args) {
        requireArity(name, args, 1, 2);
        String text = toMarkup(args.get(0)).trim();
        if (text.isEmpty()) {
            return List.of();
        }
        String separator = args.size() == 2 ? Pattern.quote(toMarkup(args.get(1))) : "\\s+";
        return Arrays.stream(text.split(separator)).map(String::trim).filter(part -> !part.isEmpty()).toList();
    }

    private static String join(String name, List<Object> args) {
        requireArity(name, args, 1, 2);
        String separator = args.size() == 2 ? toMarkup(args.get(1)) : "";
        Object values = args.get(0);
        if (values instanceof Collection<?> collection) {
            return collection.stream().map(MarkupFunctions::toMarkup).collect(Collectors.joining(separator));
        }
        return toMarkup(values);
    }

    private static DomContent doctype(String name, List<Object> args) {
        requireArity(name, args, 0, 1);
        String kind = args.isEmpty() ? "html5" : toMarkup(args.get(0));
        String declaration = DOCTYPES.get(kind);
        if (declaration == null) {
            throw new TemplateException("Unknown doctype '" + kind + "', expected one of " + DOCTYPES.keySet());
        }
        return TagCreator.rawHtml(declaration);
    }

    private static void requireArity(String name, List<Object> args, int min, int max) {
        if (args.size() < min || args.size() > max) {
            String expected = max == Integer.MAX_VALUE ? "at least " + min : (min == max ? "" + min : min + " to " + max);
            throw new TemplateException(name + "() expects " + expected + " argument(s), got " + args.size());
        }
    }
}

package com.staticpress.core.content;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.staticpress.core.util.FileUtils;
import com.staticpress.core.util.Lazy;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.html.HtmlRenderer;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses content files made of an optional front-matter header and a body.
 *
 * <p><b>File layout:</b>
 * <pre>
 * ---
 * title: Hello World
 * tags: [java, blogging]
 * template: post.html
 * ---
 * Body in Markdown, HTML or page expressions.
 * </pre>
 *
 * <p>The header between the {@code ---} lines is a YAML mapping. The file text and its header
 * are read when the unit is parsed; Markdown bodies are converted to HTML with commonmark on
 * first access.
 */
public class ContentReader {

    private static final String HEADER_DELIMITER = "---";
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private static final Parser MARKDOWN_PARSER = Parser.builder().build();
    private static final HtmlRenderer HTML_RENDERER = HtmlRenderer.builder().build();

    private final Charset charset;

    /**
     * Creates a reader.
     *
     * @param charset encoding of content files
     */
    public ContentReader(Charset charset) {
        this.charset = charset;
    }

    /**
     * Reads a content file and parses its header.
     *
     * @param path content file
     * @param kind post or page
     * @return parsed unit; only the body conversion is deferred
     * @throws ContentParseException if the file is unreadable, its format unsupported or its header malformed
     */
    public ContentUnit read(Path path, ContentKind kind) {
        ContentFormat format = ContentFormat.forExtension(FileUtils.getExtension(path))
            .orElseThrow(() -> new ContentParseException(path,
                "unsupported content format '." + FileUtils.getExtension(path) + "'"));

        String text;
        try {
            text = Files.readString(path, charset);
        } catch (IOException e) {
            throw new ContentParseException(path, "cannot read file: " + e.getMessage(), e);
        }

        return parse(path, kind, format, text);
    }

    /**
     * Parses already loaded content.
     *
     * @param path source path, used for error messages and URL derivation
     * @param kind post or page
     * @param format body format
     * @param text full file text
     * @return parsed unit
     * @throws ContentParseException if the header is malformed
     */
    public ContentUnit parse(Path path, ContentKind kind, ContentFormat format, String text) {
        String source = text.startsWith("\uFEFF") ? text.substring(1) : text;
        String[] lines = source.split("\\R", -1);

        Map<String, Object> metadata = Map.of();
        int bodyStart = 0;

        if (lines.length > 0 && lines[0].trim().equals(HEADER_DELIMITER)) {
            int closing = -1;
            for (int i = 1; i < lines.length; i++) {
                if (lines[i].trim().equals(HEADER_DELIMITER)) {
                    closing = i;
                    break;
                }
            }
            if (closing < 0) {
                throw new ContentParseException(path, "metadata header is not closed with '---'");
            }
            metadata = readHeader(path, String.join("\n", Arrays.copyOfRange(lines, 1, closing)));
            bodyStart = closing + 1;
        }

        String rawBody = String.join("\n", Arrays.copyOfRange(lines, bodyStart, lines.length));
        Lazy<String> body = format == ContentFormat.MARKDOWN
            ? Lazy.of(() -> HTML_RENDERER.render(MARKDOWN_PARSER.parse(rawBody)))
            : Lazy.of(rawBody::strip);

        return new ContentUnit(path, kind, metadata, body);
    }

    private static Map<String, Object> readHeader(Path path, String header) {
        JsonNode tree;
        try {
            tree = YAML_MAPPER.readTree(header);
        } catch (JsonProcessingException e) {
            throw new ContentParseException(path, "malformed metadata header: " + e.getOriginalMessage(), e);
        }
        if (tree == null || tree.isMissingNode() || tree.isNull()) {
            return Map.of();
        }
        if (!tree.isObject()) {
            throw new ContentParseException(path,
                "malformed metadata header: expected 'key: value' pairs but found " + tree.getNodeType());
        }
        return YAML_MAPPER.convertValue(tree, METADATA_TYPE);
    }
}

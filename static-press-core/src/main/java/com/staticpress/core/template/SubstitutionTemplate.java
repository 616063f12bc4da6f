package com.staticpress.core.template;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stringtemplate.v4.NoIndentWriter;
import org.stringtemplate.v4.ST;
import org.stringtemplate.v4.STErrorListener;
import org.stringtemplate.v4.STGroup;
import org.stringtemplate.v4.misc.ErrorType;
import org.stringtemplate.v4.misc.STMessage;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * StringTemplate template using {@code $} delimiters.
 *
 * <p>Attributes are the unit's metadata with every value converted to a string (lists joined
 * with a space) plus the reserved attribute {@code content} holding the body. An attribute
 * without a value renders as an empty string and logs a warning. {@code \$} is a literal
 * dollar sign. Metadata keys that are not plain identifiers cannot be referenced and are not
 * bound.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * <html><head><title>$title$</title></head>
 * <body><h1>$title$</h1>$content$</body></html>
 * }</pre>
 */
public class SubstitutionTemplate implements Template {

    private static final Logger log = LoggerFactory.getLogger(SubstitutionTemplate.class);

    private static final char DELIMITER = '$';
    private static final Pattern ATTRIBUTE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String name;
    private final String source;

    /**
     * Creates a template, checking its syntax.
     *
     * @param name template identifier
     * @param source template text
     * @throws TemplateException if the source is not a valid template
     */
    public SubstitutionTemplate(String name, String source) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
        compile(new RenderErrors(name));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public TemplateMode mode() {
        return TemplateMode.SUBSTITUTION;
    }

    // ST instances carry per-render attribute state, so each render compiles its own.
    @Override
    public String render(RenderEnvironment environment) {
        RenderErrors errors = new RenderErrors(name);
        ST template = compile(errors);
        environment.metadata().forEach((key, value) -> {
            if (RenderEnvironment.CONTENT.equals(key)) {
                return;
            }
            if (ATTRIBUTE_NAME.matcher(key).matches()) {
                template.add(key, stringify(value));
            } else {
                log.debug("Template {}: metadata key '{}' is not an attribute name, skipped", name, key);
            }
        });
        template.add(RenderEnvironment.CONTENT, environment.content());

        StringWriter out = new StringWriter(source.length() + environment.content().length());
        try {
            template.write(new NoIndentWriter(out));
        } catch (IOException e) {
            throw new TemplateException("Failed to render template " + name, e);
        }
        errors.throwIfFailed("Failed to render template " + name);
        return out.toString();
    }

    private ST compile(RenderErrors errors) {
        STGroup group = new STGroup(DELIMITER, DELIMITER);
        group.setListener(errors);
        ST template;
        try {
            template = new ST(group, source);
        } catch (RuntimeException e) {
            throw new TemplateException("Syntax error in template " + name + ": " + e.getMessage(), e);
        }
        errors.throwIfFailed("Syntax error in template " + name);
        return template;
    }

    private static String stringify(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream()
                .map(SubstitutionTemplate::stringify)
                .collect(Collectors.joining(" "));
        }
        return value.toString();
    }

    /**
     * Collects StringTemplate errors. Missing attributes only log a warning.
     */
    private static final class RenderErrors implements STErrorListener {

        private final String templateName;
        private final List<String> errors = new ArrayList<>();

        private RenderErrors(String templateName) {
            this.templateName = templateName;
        }

        @Override
        public void compileTimeError(STMessage msg) {
            errors.add(msg.toString());
        }

        @Override
        public void runTimeError(STMessage msg) {
            if (msg.error == ErrorType.NO_SUCH_ATTRIBUTE) {
                log.warn("Template {} references unknown key ${}$; rendering it empty", templateName, msg.arg);
                return;
            }
            errors.add(msg.toString());
        }

        @Override
        public void IOError(STMessage msg) {
            errors.add(msg.toString());
        }

        @Override
        public void internalError(STMessage msg) {
            errors.add(msg.toString());
        }

        private void throwIfFailed(String message) {
            if (!errors.isEmpty()) {
                throw new TemplateException(message + ": " + String.join("; ", errors));
            }
        }
    }
}

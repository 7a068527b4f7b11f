package com.chainflow.chainflow_backend.executor;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills {{...}} placeholders in node configuration (prompts, URLs, bodies) from the node's input.
 *
 * {{input}} is the whole input: objects and arrays as JSON, primitives as text, null as "".
 * {{input.a.b}} or {{a.b}} walks into an object input. Unresolvable paths stay as written.
 */
@Component
public class TemplateResolver {

    private static final Logger log = LoggerFactory.getLogger(TemplateResolver.class);

    private static final Pattern REF_PATTERN = Pattern.compile("\\{\\{\\s*([^}]+?)\\s*}}");

    private final ObjectMapper objectMapper;

    public TemplateResolver(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String resolve(String template, Object input) {
        if (template == null || !template.contains("{{")) return template;

        Matcher matcher = REF_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String path = matcher.group(1).trim();
            String replacement;
            if (path.equals("input")) {
                replacement = stringify(input);
            } else {
                String inner = path.startsWith("input.") ? path.substring(6) : path;
                Object value = input instanceof Map<?, ?> || input instanceof List<?>
                        ? ValuePaths.extract(input, inner)
                        : null;
                if (value == null) {
                    log.debug("Template reference {{{}}} did not resolve, leaving it in place", path);
                    replacement = matcher.group(0);
                } else {
                    replacement = stringify(value);
                }
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /** Text form of a value: null as "", strings as-is, whole numbers without a fraction, containers as JSON. */
    public String stringify(Object value) {
        if (value == null) return "";
        if (value instanceof String s) return s;
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d == Math.floor(d) && !Double.isInfinite(d)) {
                return BigDecimal.valueOf(d).toBigInteger().toString();
            }
            return value.toString();
        }
        if (value instanceof Number || value instanceof Boolean || value instanceof Character) {
            return value.toString();
        }
        return toJson(value);
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialise {} to JSON: {}", value.getClass().getSimpleName(), e.getOriginalMessage());
            return String.valueOf(value);
        }
    }

    public String toPrettyJson(Object value) {
        try {
            return objectMapper.writer(new TwoSpacePrettyPrinter()).writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialise {} to JSON: {}", value.getClass().getSimpleName(), e.getOriginalMessage());
            return String.valueOf(value);
        }
    }

    /** Parses JSON text into Map/List/scalar; returns null when the text is not JSON. */
    public Object parseJson(String text) {
        if (text == null || text.isBlank()) return null;
        try {
            return objectMapper.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    /**
     * Two-space indentation for objects and arrays, {@code "key": value} entries and
     * {@code {}}/{@code []} for empty containers.
     */
    static final class TwoSpacePrettyPrinter extends DefaultPrettyPrinter {

        private static final DefaultIndenter INDENTER = new DefaultIndenter("  ", "\n");

        TwoSpacePrettyPrinter() {
            indentObjectsWith(INDENTER);
            indentArraysWith(INDENTER);
        }

        private TwoSpacePrettyPrinter(TwoSpacePrettyPrinter base) {
            super(base);
        }

        @Override
        public DefaultPrettyPrinter createInstance() {
            return new TwoSpacePrettyPrinter(this);
        }

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }

        @Override
        public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
            if (nrOfEntries > 0) {
                super.writeEndObject(g, nrOfEntries);
                return;
            }
            if (!_objectIndenter.isInline()) --_nesting;
            g.writeRaw('}');
        }

        @Override
        public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
            if (nrOfValues > 0) {
                super.writeEndArray(g, nrOfValues);
                return;
            }
            if (!_arrayIndenter.isInline()) --_nesting;
            g.writeRaw(']');
        }
    }
}

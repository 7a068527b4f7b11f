package com.chainflow.chainflow_backend.executor.impl;

import com.chainflow.chainflow_backend.exception.NodeExecutionException;
import com.chainflow.chainflow_backend.executor.NodeConfig;
import com.chainflow.chainflow_backend.executor.NodeConfigResolver;
import com.chainflow.chainflow_backend.executor.NodeExecutor;
import com.chainflow.chainflow_backend.model.context.ExecutionContext;
import com.chainflow.chainflow_backend.model.domain.FlowNode;
import com.chainflow.chainflow_backend.model.domain.NodeType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pulls values out of HTML with CSS selectors.
 *
 * Input is an HTML string or an object carrying one under {@code html}, {@code text} or any field
 * that looks like markup (a web crawler result, typically). Each entry of {@code extractionRules}
 * names a value:
 * <ul>
 *   <li>{@code name}: key in the output object</li>
 *   <li>{@code cssSelector} (or {@code selector}): elements to read</li>
 *   <li>{@code type} (or {@code target}): {@code text}, {@code attribute} or {@code html}</li>
 *   <li>{@code attribute} (or {@code attributeName}): attribute read when type is {@code attribute}</li>
 *   <li>{@code multiple}: always return a list</li>
 * </ul>
 * A rule matching nothing yields {@code ""}, one value yields the value and several yield a list.
 * Input without HTML, or a node without rules, is passed through unchanged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HtmlParserExecutor implements NodeExecutor {

    private final NodeConfigResolver configResolver;

    @Override
    public String supportedType() {
        return NodeType.HTML_PARSER.getTag();
    }

    @Override
    public Object execute(FlowNode node, List<Object> inputs, ExecutionContext context) throws NodeExecutionException {
        Object input = inputs == null || inputs.isEmpty() ? null : inputs.get(0);

        String html = htmlFrom(input);
        if (html == null || html.isBlank()) {
            log.debug("HTML parser {}: no HTML in input, passing it through", node.getId());
            return input;
        }

        NodeConfig config = configResolver.resolve(node);
        List<Object> rules = config.getList("extractionRules");
        if (rules.isEmpty()) {
            log.warn("HTML parser {} has no extraction rules, passing input through", node.getId());
            return input;
        }

        Document document = Jsoup.parse(html);
        Map<String, Object> result = new LinkedHashMap<>();
        for (Object raw : rules) {
            if (!(raw instanceof Map<?, ?> rule)) continue;
            String name = text(rule, "name");
            String selector = firstText(rule, "cssSelector", "selector");
            if (name == null || selector == null) continue;

            result.put(name, extract(node, document, rule, selector));
        }
        log.debug("HTML parser {}: extracted {} field(s)", node.getId(), result.size());
        return result;
    }

    private Object extract(FlowNode node, Document document, Map<?, ?> rule, String selector)
            throws NodeExecutionException {
        Elements elements;
        try {
            elements = document.select(selector);
        } catch (Selector.SelectorParseException | IllegalArgumentException ex) {
            throw new NodeExecutionException(node.getId(), "Invalid CSS selector '" + selector + "': " + ex.getMessage(), ex);
        }

        String type = firstText(rule, "type", "target");
        String attribute = firstText(rule, "attribute", "attributeName");
        List<String> values = new ArrayList<>();
        for (Element element : elements) {
            String value = valueOf(element, type == null ? "text" : type, attribute);
            if (value != null && !value.isEmpty()) values.add(value);
        }

        if (Boolean.TRUE.equals(rule.get("multiple"))) return values;
        if (values.isEmpty()) return "";
        return values.size() == 1 ? values.get(0) : values;
    }

    private static String valueOf(Element element, String type, String attribute) {
        switch (type) {
            case "text":
                return element.text();
            case "html":
                return element.outerHtml();
            case "attribute":
                return attribute != null ? element.attr(attribute) : null;
            default:
                return null;
        }
    }

    private static String htmlFrom(Object input) {
        if (input instanceof String s) return s;
        if (!(input instanceof Map<?, ?> map)) return null;

        for (String key : List.of("html", "text")) {
            if (map.get(key) instanceof String s && !s.isBlank()) return s;
        }
        for (Object value : map.values()) {
            if (value instanceof String s) {
                String trimmed = s.trim();
                if (trimmed.startsWith("<") && trimmed.endsWith(">")) return s;
            }
        }
        return null;
    }

    private static String firstText(Map<?, ?> rule, String key, String fallbackKey) {
        String value = text(rule, key);
        return value != null ? value : text(rule, fallbackKey);
    }

    private static String text(Map<?, ?> rule, String key) {
        Object value = rule.get(key);
        return value == null || value.toString().isBlank() ? null : value.toString();
    }
}

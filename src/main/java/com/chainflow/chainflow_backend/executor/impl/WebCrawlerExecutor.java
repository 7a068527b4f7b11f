package com.chainflow.chainflow_backend.executor.impl;

import com.chainflow.chainflow_backend.config.EngineProperties;
import com.chainflow.chainflow_backend.exception.NodeExecutionException;
import com.chainflow.chainflow_backend.exception.NodeTimeoutException;
import com.chainflow.chainflow_backend.executor.NodeConfig;
import com.chainflow.chainflow_backend.executor.NodeConfigResolver;
import com.chainflow.chainflow_backend.executor.NodeExecutor;
import com.chainflow.chainflow_backend.executor.TemplateResolver;
import com.chainflow.chainflow_backend.executor.capability.CrawlRequest;
import com.chainflow.chainflow_backend.executor.capability.CrawlResult;
import com.chainflow.chainflow_backend.executor.capability.WebCrawler;
import com.chainflow.chainflow_backend.model.context.ExecutionContext;
import com.chainflow.chainflow_backend.model.domain.FlowNode;
import com.chainflow.chainflow_backend.model.domain.NodeType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;

import java.net.SocketTimeoutException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fetches a page through the crawler capability.
 *
 * The URL comes from a string input, an input object's {@code url}, or the configured {@code url}.
 * {@code outputFormat}: {@code full} (default), {@code text}, {@code html} or {@code extracted}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebCrawlerExecutor implements NodeExecutor {

    private final NodeConfigResolver configResolver;
    private final TemplateResolver   templates;
    private final WebCrawler         crawler;
    private final EngineProperties   properties;

    @Override
    public String supportedType() {
        return NodeType.WEB_CRAWLER.getTag();
    }

    @Override
    public Object execute(FlowNode node, List<Object> inputs, ExecutionContext context) throws NodeExecutionException {
        NodeConfig config = configResolver.resolve(node);
        Object input = inputs == null || inputs.isEmpty() ? null : inputs.get(0);

        String url = templates.resolve(targetUrl(config, input), input);
        if (url == null || url.isBlank()) {
            throw new NodeExecutionException(node.getId(),
                    "No URL provided. Configure a URL or connect a node that provides one.");
        }
        url = url.trim();

        String outputFormat = config.getString("outputFormat", "full").toLowerCase(Locale.ROOT);
        int timeoutMs = config.getInt("timeout", properties.getCrawler().getDefaultTimeoutMs());

        CrawlRequest request = new CrawlRequest(
                url,
                config.getString("waitForSelector"),
                config.getString("iframeSelector"),
                config.getString("extractElementSelector"),
                stringMap(config.getMap("extractSelectors")),
                timeoutMs,
                stringMap(config.getMap("headers")),
                config.getBoolean("includeHtml", false) || "html".equals(outputFormat));

        CrawlResult result;
        try {
            result = crawler.crawl(request);
        } catch (ResourceAccessException ex) {
            if (ex.getCause() instanceof SocketTimeoutException) {
                throw new NodeTimeoutException(node.getId(), timeoutMs, ex);
            }
            throw new NodeExecutionException(node.getId(), "Web crawler error: " + ex.getMessage(), ex);
        }
        if (result.isError()) {
            throw new NodeExecutionException(node.getId(), "Crawler error: " + result.error());
        }
        log.info("Crawled {} for node {} ({})", url, node.getId(), outputFormat);

        switch (outputFormat) {
            case "text":
                return result.text();
            case "html":
                return result.html() != null ? result.html() : "";
            case "extracted":
                return result.extractedData() != null ? result.extractedData() : Map.of();
            default:
                Map<String, Object> full = new LinkedHashMap<>();
                full.put("url",           result.url());
                full.put("title",         result.title());
                full.put("text",          result.text());
                full.put("html",          result.html());
                full.put("extractedData", result.extractedData());
                return full;
        }
    }

    private static String targetUrl(NodeConfig config, Object input) {
        if (input instanceof String s && !s.isBlank()) return s;
        if (input instanceof Map<?, ?> map && map.get("url") != null) return map.get("url").toString();
        return config.getString("url", "");
    }

    private static Map<String, String> stringMap(Map<String, Object> source) {
        if (source.isEmpty()) return null;
        Map<String, String> result = new LinkedHashMap<>();
        source.forEach((k, v) -> {
            if (v != null) result.put(k, v.toString());
        });
        return result;
    }
}

package com.chainflow.chainflow_backend.executor.impl;

import com.chainflow.chainflow_backend.config.EngineProperties;
import com.chainflow.chainflow_backend.exception.FlowValidationException;
import com.chainflow.chainflow_backend.exception.NodeExecutionException;
import com.chainflow.chainflow_backend.exception.NodeTimeoutException;
import com.chainflow.chainflow_backend.executor.NodeConfig;
import com.chainflow.chainflow_backend.executor.NodeConfigResolver;
import com.chainflow.chainflow_backend.executor.NodeExecutor;
import com.chainflow.chainflow_backend.executor.TemplateResolver;
import com.chainflow.chainflow_backend.executor.capability.ApiCallRequest;
import com.chainflow.chainflow_backend.executor.capability.ApiCallResponse;
import com.chainflow.chainflow_backend.executor.capability.ApiClient;
import com.chainflow.chainflow_backend.model.context.ExecutionContext;
import com.chainflow.chainflow_backend.model.domain.FlowNode;
import com.chainflow.chainflow_backend.model.domain.NodeType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpTimeoutException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Calls an HTTP endpoint.
 *
 * Config: {@code method} (GET), {@code url}, {@code headers} (map or JSON object text),
 * {@code body} (JSON text), {@code timeout} in ms. {{input}} in url and body is replaced with the input.
 * Output: {@code {status, data, headers, durationMs}} where data is the parsed JSON body when it parses.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiExecutor implements NodeExecutor {

    private static final Set<String> METHODS = Set.of("GET", "POST", "PUT", "PATCH", "DELETE", "HEAD", "OPTIONS");

    private final NodeConfigResolver configResolver;
    private final TemplateResolver   templates;
    private final ApiClient          apiClient;
    private final EngineProperties   properties;

    @Override
    public String supportedType() {
        return NodeType.API.getTag();
    }

    @Override
    public Object execute(FlowNode node, List<Object> inputs, ExecutionContext context) throws NodeExecutionException {
        NodeConfig config = configResolver.resolve(node);
        Object input = inputs == null || inputs.isEmpty() ? null : inputs.get(0);
        String nodeId = node.getId();

        String url = templates.resolve(config.getString("url", ""), input).trim();
        validateUrl(url);

        String method = config.getString("method", "GET").trim().toUpperCase();
        if (!METHODS.contains(method)) {
            throw new FlowValidationException("Unsupported HTTP method: " + method);
        }

        Map<String, String> headers = headers(nodeId, config.get("headers"));
        String body = body(nodeId, config.get("body"), input);
        int timeoutMs = config.getInt("timeout", properties.getHttp().getDefaultTimeoutMs());

        ApiCallResponse response;
        try {
            response = apiClient.call(new ApiCallRequest(method, url, headers, body, timeoutMs));
        } catch (ResourceAccessException ex) {
            if (isTimeout(ex)) {
                throw new NodeTimeoutException(nodeId, timeoutMs, ex);
            }
            throw new NodeExecutionException(nodeId, "API call to " + url + " failed: " + ex.getMessage(), ex);
        }

        Object data = parseBody(response.body());
        if (!response.isSuccessful()) {
            throw new NodeExecutionException(nodeId, "API call error (HTTP " + response.status() + "): "
                    + truncate(templates.stringify(data), 300));
        }

        log.info("API node {} {} {} -> {} in {} ms", nodeId, method, url, response.status(), response.durationMs());
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("status",     response.status());
        output.put("data",       data);
        output.put("headers",    response.headers());
        output.put("durationMs", response.durationMs());
        return output;
    }

    /** Absolute http(s) URL with a host. */
    static void validateUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new FlowValidationException("API node has no URL configured");
        }
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                    || uri.getHost() == null) {
                throw new FlowValidationException("Invalid URL: " + url);
            }
        } catch (URISyntaxException e) {
            throw new FlowValidationException("Invalid URL: " + url);
        }
    }

    private Map<String, String> headers(String nodeId, Object raw) throws NodeExecutionException {
        Map<String, String> headers = new LinkedHashMap<>();
        Object source = raw;
        if (raw instanceof String s && !s.isBlank()) {
            source = s.trim().startsWith("{") ? templates.parseJson(s) : null;
            if (source == null) {
                throw new NodeExecutionException(nodeId, "Failed to parse headers JSON: " + truncate(s, 100));
            }
        }
        if (source instanceof Map<?, ?> map) {
            map.forEach((k, v) -> {
                if (k != null && v != null) headers.put(k.toString(), v.toString());
            });
        }
        return headers;
    }

    private String body(String nodeId, Object raw, Object input) throws NodeExecutionException {
        if (raw == null) return null;
        if (raw instanceof Map<?, ?> || raw instanceof List<?>) return templates.toJson(raw);

        String text = raw.toString();
        if (text.isBlank()) return null;
        String resolved = templates.resolve(text, input);
        if (templates.parseJson(resolved) == null && !"null".equals(resolved.trim())) {
            throw new NodeExecutionException(nodeId, "Failed to parse body JSON: " + truncate(resolved, 100));
        }
        return resolved;
    }

    private Object parseBody(String body) {
        if (body == null || body.isBlank()) return null;
        Object parsed = templates.parseJson(body);
        return parsed != null ? parsed : body;
    }

    private static boolean isTimeout(Throwable ex) {
        for (Throwable t = ex; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException) return true;
        }
        return false;
    }

    private static String truncate(String s, int max) {
        if (s == null) return "";
        return s.length() > max ? s.substring(0, max) + "..." : s;
    }
}

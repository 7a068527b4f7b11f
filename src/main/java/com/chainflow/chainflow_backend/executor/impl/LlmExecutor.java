package com.chainflow.chainflow_backend.executor.impl;

import com.chainflow.chainflow_backend.config.EngineProperties;
import com.chainflow.chainflow_backend.exception.NodeExecutionException;
import com.chainflow.chainflow_backend.executor.NodeConfig;
import com.chainflow.chainflow_backend.executor.NodeConfigResolver;
import com.chainflow.chainflow_backend.executor.NodeExecutor;
import com.chainflow.chainflow_backend.executor.TemplateResolver;
import com.chainflow.chainflow_backend.executor.llm.LlmClient;
import com.chainflow.chainflow_backend.executor.llm.LlmClientFactory;
import com.chainflow.chainflow_backend.model.context.ExecutionContext;
import com.chainflow.chainflow_backend.model.domain.FlowNode;
import com.chainflow.chainflow_backend.model.domain.LlmProvider;
import com.chainflow.chainflow_backend.model.domain.NodeType;
import com.chainflow.chainflow_backend.model.llm.LlmRequest;
import com.chainflow.chainflow_backend.model.llm.LlmResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Sends a prompt to a language model and emits {@code {text, model, provider}}.
 *
 * Config: {@code provider} (ollama), {@code model}, {@code prompt} with {{input}} placeholders,
 * {@code temperature}, {@code maxTokens}, {@code ollamaUrl} / {@code endpoint}, {@code apiKey},
 * {@code mode} ({@code text} or {@code vision}). A prompt that resolves to blank yields no output.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmExecutor implements NodeExecutor {

    private static final Set<String> IMAGE_EXTENSIONS = Set.of("png", "jpg", "jpeg", "gif", "webp", "bmp");
    private static final Pattern BASE64 = Pattern.compile("^[A-Za-z0-9+/\\r\\n]+={0,2}$");

    private final NodeConfigResolver configResolver;
    private final TemplateResolver   templates;
    private final LlmClientFactory   clientFactory;
    private final EngineProperties   properties;

    @Override
    public String supportedType() {
        return NodeType.LLM.getTag();
    }

    @Override
    public Object execute(FlowNode node, List<Object> inputs, ExecutionContext context) throws NodeExecutionException {
        NodeConfig config = configResolver.resolve(node);
        String nodeId = node.getId();
        Object input = inputs == null || inputs.isEmpty() ? null : inputs.get(0);

        String prompt = templates.resolve(config.getString("prompt", ""), input);
        if (prompt == null || prompt.isBlank()) {
            log.debug("LLM node {}: prompt is empty after resolution, nothing to send", nodeId);
            return null;
        }

        LlmProvider provider;
        try {
            provider = LlmProvider.fromName(config.getString("provider"));
        } catch (IllegalArgumentException e) {
            throw new NodeExecutionException(nodeId, "Unsupported LLM provider: " + config.getString("provider"));
        }
        LlmClient client = clientFactory.getClient(provider);

        LlmRequest request = LlmRequest.builder()
                .prompt(prompt)
                .systemPrompt(config.getString("system"))
                .model(config.getString("model", client.getDefaultModel()))
                .temperature(config.getDouble("temperature", properties.getLlm().getDefaultTemperature()))
                .maxTokens(config.getInt("maxTokens", 0))
                .build();

        if ("vision".equalsIgnoreCase(config.getString("mode", "text"))) {
            List<String> images = collectImages(inputs);
            if (images.isEmpty()) {
                throw new NodeExecutionException(nodeId, "Vision mode needs at least one image input");
            }
            request.setImages(images);
            log.info("LLM node {}: vision request with {} image(s)", nodeId, images.size());
        }

        String endpoint = provider == LlmProvider.OLLAMA
                ? config.getString("ollamaUrl", config.getString("endpoint"))
                : config.getString("endpoint");
        String apiKey = config.getString("apiKey",
                provider == LlmProvider.OPENAI ? properties.getLlm().getOpenaiApiKey() : null);

        LlmResponse response = client.call(request, apiKey, endpoint);
        if (!response.isSuccess()) {
            throw new NodeExecutionException(nodeId, "LLM execution failed: " + response.getErrorMessage());
        }

        log.info("LLM node {} completed with {} ({}in/{}out tokens)",
                nodeId, response.getModel(), response.getInputTokens(), response.getOutputTokens());

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("text",     response.getText());
        output.put("model",    response.getModel() != null ? response.getModel() : request.getModel());
        output.put("provider", provider.name().toLowerCase(Locale.ROOT));
        return output;
    }

    // ── Vision inputs ─────────────────────────────────────────────────────────

    List<String> collectImages(List<Object> inputs) {
        List<String> images = new ArrayList<>();
        if (inputs != null) inputs.forEach(value -> collect(value, images));
        return images;
    }

    private void collect(Object value, List<String> images) {
        if (value instanceof List<?> list) {
            list.forEach(item -> collect(item, images));
        } else if (value instanceof String s) {
            String image = fromString(s.trim());
            if (image != null) images.add(image);
        } else if (value instanceof Map<?, ?> map) {
            Object data = map.get("data") != null ? map.get("data") : map.get("content");
            Object name = map.get("name") != null ? map.get("name") : map.get("path");
            if (data instanceof String d && name != null && isImagePath(name.toString())) {
                String image = fromString(d.trim());
                if (image != null) images.add(image);
            } else if (map.get("path") instanceof String p && isImagePath(p)) {
                String image = readFile(p);
                if (image != null) images.add(image);
            }
        }
    }

    private String fromString(String s) {
        if (s.startsWith("data:image/")) {
            int comma = s.indexOf(',');
            return comma > 0 ? s.substring(comma + 1) : null;
        }
        if (isImagePath(s)) return readFile(s);
        if (s.length() >= 64 && BASE64.matcher(s).matches()) return s.replaceAll("\\s", "");
        return null;
    }

    private static boolean isImagePath(String path) {
        int dot = path.lastIndexOf('.');
        return dot > 0 && IMAGE_EXTENSIONS.contains(path.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private String readFile(String path) {
        try {
            return Base64.getEncoder().encodeToString(Files.readAllBytes(Path.of(path)));
        } catch (IOException | RuntimeException e) {
            log.warn("Skipping image {}: {}", path, e.getMessage());
            return null;
        }
    }
}

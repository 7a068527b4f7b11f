package com.chainflow.chainflow_backend.executor.llm;

import com.chainflow.chainflow_backend.config.EngineProperties;
import com.chainflow.chainflow_backend.model.domain.LlmProvider;
import com.chainflow.chainflow_backend.model.llm.LlmRequest;
import com.chainflow.chainflow_backend.model.llm.LlmResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat-completions client for OpenAI and every server speaking the same protocol (Groq, self-hosted).
 * Vision requests send the prompt and images as a multi-part user message.
 */
@Component
public class OpenAiCompatibleLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleLlmClient.class);

    private final HttpClient httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
    private final ObjectMapper mapper = new ObjectMapper();

    private final LlmProvider provider;
    private final String defaultEndpoint;
    private final String defaultModel;
    private final String[] knownModels;
    private final int timeoutSeconds;

    @Autowired
    public OpenAiCompatibleLlmClient(EngineProperties properties) {
        this(LlmProvider.OPENAI,
             LlmProvider.OPENAI.getDefaultEndpoint(),
             "gpt-4o-mini",
             new String[]{"gpt-4o-mini", "gpt-4o", "gpt-4-turbo", "gpt-3.5-turbo"},
             properties.getLlm().getTimeoutSeconds());
    }

    public OpenAiCompatibleLlmClient(LlmProvider p, String ep, String model, String[] models, int timeoutSeconds) {
        this.provider = p;
        this.defaultEndpoint = ep;
        this.defaultModel = model;
        this.knownModels = models;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public LlmProvider getProvider() { return provider; }

    @Override
    public String getDefaultModel() { return defaultModel; }

    @Override
    public String[] getKnownModels() { return knownModels; }

    @Override
    public LlmResponse call(LlmRequest req, String apiKey, String endpoint) {
        String url = (endpoint != null && !endpoint.isBlank()) ? endpoint : defaultEndpoint;
        if (url == null || url.isBlank()) {
            return LlmResponse.error(provider.getDisplayName() + " requires an endpoint");
        }
        String model = (req.getModel() != null && !req.getModel().isBlank()) ? req.getModel() : defaultModel;
        try {
            List<Map<String, Object>> messages = new ArrayList<>();
            if (req.getSystemPrompt() != null && !req.getSystemPrompt().isBlank()) {
                messages.add(Map.of("role", "system", "content", req.getSystemPrompt()));
            }
            messages.add(Map.of("role", "user", "content", userContent(req)));

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model", model);
            body.put("messages", messages);
            body.put("temperature", req.getTemperature());
            if (req.getMaxTokens() > 0) body.put("max_tokens", req.getMaxTokens());
            String jsonBody = mapper.writeValueAsString(body);

            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody));
            if (apiKey != null && !apiKey.isBlank()) {
                builder.header("Authorization", "Bearer " + apiKey);
            }

            HttpResponse<String> httpResp = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (httpResp.statusCode() != 200) {
                log.error("[{}] HTTP {}", provider, httpResp.statusCode());
                return LlmResponse.error(provider.getDisplayName() + " API error " + httpResp.statusCode() + ": " + extractError(httpResp.body()));
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> resp = mapper.readValue(httpResp.body(), Map.class);
            @SuppressWarnings("unchecked")
            List<Map<String, Object>> choices = (List<Map<String, Object>>) resp.get("choices");
            if (choices == null || choices.isEmpty()) {
                return LlmResponse.error(provider.getDisplayName() + " returned no choices");
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
            String text = message != null && message.get("content") != null ? message.get("content").toString() : "";
            @SuppressWarnings("unchecked")
            Map<String, Object> usage = (Map<String, Object>) resp.get("usage");
            int inputTokens = usage != null ? ((Number) usage.getOrDefault("prompt_tokens", 0)).intValue() : 0;
            int outputTokens = usage != null ? ((Number) usage.getOrDefault("completion_tokens", 0)).intValue() : 0;
            String usedModel = (String) resp.getOrDefault("model", model);
            return LlmResponse.ok(text, usedModel, inputTokens, outputTokens);

        } catch (IOException e) {
            log.error("[{}] Exception calling API", provider, e);
            return LlmResponse.error(provider.getDisplayName() + " client exception: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return LlmResponse.error(provider.getDisplayName() + " call interrupted");
        }
    }

    private Object userContent(LlmRequest req) {
        if (!req.hasImages()) return req.getPrompt();
        List<Map<String, Object>> parts = new ArrayList<>();
        parts.add(Map.of("type", "text", "text", req.getPrompt()));
        for (String image : req.getImages()) {
            parts.add(Map.of("type", "image_url", "image_url", Map.of("url", "data:image/png;base64," + image)));
        }
        return parts;
    }

    private String extractError(String body) {
        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> parsed = mapper.readValue(body, Map.class);
            Object err = parsed.get("error");
            if (err instanceof Map) {
                Object msg = ((Map<?, ?>) err).get("message");
                return msg != null ? msg.toString() : fallbackBody(body);
            }
        } catch (JsonProcessingException e) {
            log.debug("[{}] Error body is not JSON", provider);
        }
        return fallbackBody(body);
    }

    private static String fallbackBody(String body) {
        return body != null && body.length() > 200 ? body.substring(0, 200) : (body != null ? body : "");
    }
}

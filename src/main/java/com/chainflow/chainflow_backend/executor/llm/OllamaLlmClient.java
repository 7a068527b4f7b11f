package com.chainflow.chainflow_backend.executor.llm;

import com.chainflow.chainflow_backend.config.EngineProperties;
import com.chainflow.chainflow_backend.model.domain.LlmProvider;
import com.chainflow.chainflow_backend.model.llm.LlmRequest;
import com.chainflow.chainflow_backend.model.llm.LlmResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Client for a local or remote Ollama server ({@code POST {baseUrl}/api/generate}, non-streaming).
 * No API key. Images go in the request's {@code images} field for vision models.
 */
@Component
public class OllamaLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaLlmClient.class);
    private static final String DEFAULT_MODEL = "llama3";
    private static final String[] KNOWN_MODELS = new String[]{"llama3", "llama3.2", "mistral", "gemma3", "llava"};

    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    private final ObjectMapper mapper = new ObjectMapper();
    private final EngineProperties properties;

    public OllamaLlmClient(EngineProperties properties) {
        this.properties = properties;
    }

    @Override
    public LlmProvider getProvider() {
        return LlmProvider.OLLAMA;
    }

    @Override
    public String getDefaultModel() {
        return DEFAULT_MODEL;
    }

    @Override
    public String[] getKnownModels() {
        return KNOWN_MODELS;
    }

    /** {@code endpoint} is the server base URL, e.g. http://localhost:11434. */
    @Override
    public LlmResponse call(LlmRequest req, String apiKey, String endpoint) {
        String model = req.getModel() != null && !req.getModel().isBlank() ? req.getModel() : DEFAULT_MODEL;
        String base = (endpoint != null && !endpoint.isBlank()) ? endpoint : properties.getLlm().getOllamaUrl();
        String url = stripTrailingSlash(base) + "/api/generate";

        String fullPrompt = req.getPrompt();
        if (req.getSystemPrompt() != null && !req.getSystemPrompt().isBlank()) {
            fullPrompt = req.getSystemPrompt() + "\n\n" + fullPrompt;
        }

        try {
            Map<String, Object> options = new LinkedHashMap<>();
            options.put("temperature", req.getTemperature());
            if (req.getMaxTokens() > 0) options.put("num_predict", req.getMaxTokens());

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model", model);
            body.put("prompt", fullPrompt);
            body.put("stream", false);
            body.put("options", options);
            if (req.hasImages()) body.put("images", req.getImages());
            String jsonBody = mapper.writeValueAsString(body);

            HttpRequest httpReq = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(properties.getLlm().getTimeoutSeconds()))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();

            HttpResponse<String> httpResp = httpClient.send(httpReq, HttpResponse.BodyHandlers.ofString());

            if (httpResp.statusCode() != 200) {
                log.error("[Ollama] HTTP {} from {}: {}", httpResp.statusCode(), url, extractError(httpResp.body()));
                return LlmResponse.error("Ollama API returned " + httpResp.statusCode() + ": " + extractError(httpResp.body()));
            }

            @SuppressWarnings("unchecked")
            Map<String, Object> resp = mapper.readValue(httpResp.body(), Map.class);
            Object text = resp.get("response");
            if (text == null) {
                return LlmResponse.error("Ollama returned no 'response' field");
            }
            int in  = resp.get("prompt_eval_count") instanceof Number n ? n.intValue() : 0;
            int out = resp.get("eval_count") instanceof Number n ? n.intValue() : 0;
            return LlmResponse.ok(text.toString().trim(), model, in, out);

        } catch (IOException e) {
            log.error("[Ollama] Call to {} failed", url, e);
            return LlmResponse.error("Ollama client exception: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return LlmResponse.error("Ollama call interrupted");
        }
    }

    private String extractError(String body) {
        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> parsed = mapper.readValue(body, Map.class);
            Object err = parsed.get("error");
            if (err != null) return err.toString();
        } catch (JsonProcessingException e) {
            log.debug("[Ollama] Error body is not JSON");
        }
        return body != null && body.length() > 200 ? body.substring(0, 200) : (body != null ? body : "");
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}

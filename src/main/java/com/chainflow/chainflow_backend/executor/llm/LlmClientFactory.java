package com.chainflow.chainflow_backend.executor.llm;

import com.chainflow.chainflow_backend.config.EngineProperties;
import com.chainflow.chainflow_backend.model.domain.LlmProvider;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class LlmClientFactory {

    private final Map<LlmProvider, LlmClient> clientMap = new EnumMap<>(LlmProvider.class);

    public LlmClientFactory(List<LlmClient> clients, EngineProperties properties) {
        for (LlmClient client : clients) {
            clientMap.put(client.getProvider(), client);
        }
        int timeout = properties.getLlm().getTimeoutSeconds();
        clientMap.putIfAbsent(LlmProvider.GROQ, new OpenAiCompatibleLlmClient(
            LlmProvider.GROQ,
            LlmProvider.GROQ.getDefaultEndpoint(),
            "llama-3.3-70b-versatile",
            new String[]{"llama-3.3-70b-versatile", "llama-3.1-8b-instant", "llama-3.2-11b-vision-preview"},
            timeout
        ));
        clientMap.putIfAbsent(LlmProvider.CUSTOM, new OpenAiCompatibleLlmClient(
            LlmProvider.CUSTOM,
            "",
            "",
            new String[]{},
            timeout
        ));
    }

    public LlmClient getClient(LlmProvider provider) {
        LlmClient client = clientMap.get(provider);
        if (client == null) {
            throw new IllegalArgumentException("No LlmClient registered for provider: " + provider);
        }
        return client;
    }

    public Map<LlmProvider, LlmClient> getAllClients() {
        return clientMap;
    }
}

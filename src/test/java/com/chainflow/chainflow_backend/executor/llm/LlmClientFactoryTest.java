package com.chainflow.chainflow_backend.executor.llm;

import com.chainflow.chainflow_backend.config.EngineProperties;
import com.chainflow.chainflow_backend.model.domain.LlmProvider;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LlmClientFactoryTest {

    @Test
    void shouldRegisterBeansAndFillCompatibleProviders() {
        EngineProperties properties = new EngineProperties();
        OllamaLlmClient ollama = new OllamaLlmClient(properties);

        LlmClientFactory factory = new LlmClientFactory(List.of(ollama), properties);

        assertThat(factory.getClient(LlmProvider.OLLAMA)).isSameAs(ollama);
        assertThat(factory.getClient(LlmProvider.GROQ)).isInstanceOf(OpenAiCompatibleLlmClient.class);
        assertThat(factory.getClient(LlmProvider.GROQ).getDefaultModel()).isEqualTo("llama-3.3-70b-versatile");
        assertThat(factory.getAllClients()).containsKeys(LlmProvider.OLLAMA, LlmProvider.GROQ, LlmProvider.CUSTOM);
    }

    @Test
    void shouldDefaultBlankProviderNameToOllama() {
        assertThat(LlmProvider.fromName(" ")).isEqualTo(LlmProvider.OLLAMA);
        assertThat(LlmProvider.fromName("openai")).isEqualTo(LlmProvider.OPENAI);
    }
}

package com.chainflow.chainflow_backend.executor.impl;

import com.chainflow.chainflow_backend.config.EngineProperties;
import com.chainflow.chainflow_backend.exception.NodeExecutionException;
import com.chainflow.chainflow_backend.executor.NodeConfigResolver;
import com.chainflow.chainflow_backend.executor.TemplateResolver;
import com.chainflow.chainflow_backend.executor.llm.LlmClient;
import com.chainflow.chainflow_backend.executor.llm.LlmClientFactory;
import com.chainflow.chainflow_backend.model.context.ExecutionContext;
import com.chainflow.chainflow_backend.model.domain.FlowNode;
import com.chainflow.chainflow_backend.model.domain.LlmProvider;
import com.chainflow.chainflow_backend.model.llm.LlmRequest;
import com.chainflow.chainflow_backend.model.llm.LlmResponse;
import com.chainflow.chainflow_backend.repository.InMemoryNodeContentStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmExecutorTest {

    private LlmClient ollama;
    private LlmExecutor executor;
    private final ExecutionContext context = ExecutionContext.create("f");

    @BeforeEach
    void setUp() {
        ollama = mock(LlmClient.class);
        when(ollama.getProvider()).thenReturn(LlmProvider.OLLAMA);
        when(ollama.getDefaultModel()).thenReturn("llama3");
        EngineProperties properties = new EngineProperties();
        executor = new LlmExecutor(new NodeConfigResolver(new InMemoryNodeContentStore()),
                new TemplateResolver(new ObjectMapper()),
                new LlmClientFactory(List.of(ollama), properties),
                properties);
    }

    private static FlowNode llmNode(Map<String, Object> data) {
        return FlowNode.builder().id("llm1").type("llm").data(new LinkedHashMap<>(data)).build();
    }

    @Nested
    class TextMode {

        @Test
        void shouldSendTemplatedPromptWithDefaults() throws Exception {
            // Given
            when(ollama.call(any(), any(), any())).thenReturn(LlmResponse.ok("Bonjour", "llama3", 5, 2));

            // When
            Object output = executor.execute(llmNode(Map.of("prompt", "Translate: {{input}}")), List.of("Hello"), context);

            // Then
            ArgumentCaptor<LlmRequest> request = ArgumentCaptor.forClass(LlmRequest.class);
            verify(ollama).call(request.capture(), isNull(), isNull());
            assertThat(request.getValue().getPrompt()).isEqualTo("Translate: Hello");
            assertThat(request.getValue().getModel()).isEqualTo("llama3");
            assertThat(request.getValue().getTemperature()).isEqualTo(0.7);
            assertThat(output).isEqualTo(Map.of("text", "Bonjour", "model", "llama3", "provider", "ollama"));
        }

        @Test
        void shouldReturnNothingForEmptyPrompt() throws Exception {
            assertThat(executor.execute(llmNode(Map.of("prompt", "")), List.of("x"), context)).isNull();
            verify(ollama, never()).call(any(), any(), any());
        }

        @Test
        void shouldFailOnUnknownProvider() {
            FlowNode node = llmNode(Map.of("prompt", "hi", "provider", "mystery"));

            assertThatThrownBy(() -> executor.execute(node, List.of(), context))
                    .isInstanceOf(NodeExecutionException.class)
                    .hasMessageContaining("Unsupported LLM provider");
        }

        @Test
        void shouldSurfaceProviderErrors() {
            when(ollama.call(any(), any(), any())).thenReturn(LlmResponse.error("model not loaded"));

            assertThatThrownBy(() -> executor.execute(llmNode(Map.of("prompt", "hi")), List.of(), context))
                    .isInstanceOf(NodeExecutionException.class)
                    .hasMessageContaining("model not loaded");
        }
    }

    @Nested
    class VisionMode {

        @Test
        void shouldPassDataUriImagesAsBase64() throws Exception {
            when(ollama.call(any(), any(), any())).thenReturn(LlmResponse.ok("a cat", "llava", 0, 0));
            FlowNode node = llmNode(Map.of("prompt", "Describe", "mode", "vision", "model", "llava"));

            executor.execute(node, List.of("data:image/png;base64,iVBORw0KGgo="), context);

            ArgumentCaptor<LlmRequest> request = ArgumentCaptor.forClass(LlmRequest.class);
            verify(ollama).call(request.capture(), any(), any());
            assertThat(request.getValue().getImages()).containsExactly("iVBORw0KGgo=");
        }

        @Test
        void shouldFailWithoutImages() {
            FlowNode node = llmNode(Map.of("prompt", "Describe", "mode", "vision"));

            assertThatThrownBy(() -> executor.execute(node, List.of("just text"), context))
                    .isInstanceOf(NodeExecutionException.class)
                    .hasMessageContaining("image");
            verify(ollama, never()).call(any(), anyString(), anyString());
        }
    }
}

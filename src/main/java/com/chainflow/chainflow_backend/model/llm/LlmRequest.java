package com.chainflow.chainflow_backend.model.llm;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Provider-agnostic request the LLM node builds.
 * Each LlmClient translates it into its provider's API format.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LlmRequest {

    private String systemPrompt;
    private String prompt;
    private String model;

    @Builder.Default
    private double temperature = 0.7;

    // 0 leaves the provider default
    private int maxTokens;

    // Base64 payloads without a data: prefix; non-empty only in vision mode
    @Builder.Default
    private List<String> images = new ArrayList<>();

    public boolean hasImages() {
        return images != null && !images.isEmpty();
    }
}

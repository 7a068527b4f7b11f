package com.chainflow.chainflow_backend.model.domain;

/**
 * Supported LLM providers for the LLM node.
 * Each provider maps to a concrete LlmClient implementation.
 */
public enum LlmProvider {

    OLLAMA("Ollama",                 "http://localhost:11434/api/generate"),
    OPENAI("OpenAI GPT",             "https://api.openai.com/v1/chat/completions"),
    GROQ("Groq (Fast inference)",    "https://api.groq.com/openai/v1/chat/completions"),
    CUSTOM("Custom / Self-hosted",   "");  // OpenAI-compatible endpoint supplied per node

    private final String displayName;
    private final String defaultEndpoint;

    LlmProvider(String displayName, String defaultEndpoint) {
        this.displayName    = displayName;
        this.defaultEndpoint = defaultEndpoint;
    }

    public String getDisplayName()    { return displayName; }
    public String getDefaultEndpoint() { return defaultEndpoint; }

    public static LlmProvider fromName(String name) {
        if (name == null || name.isBlank()) return OLLAMA;
        return LlmProvider.valueOf(name.trim().toUpperCase());
    }
}

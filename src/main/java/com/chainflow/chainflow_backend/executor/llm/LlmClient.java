package com.chainflow.chainflow_backend.executor.llm;

import com.chainflow.chainflow_backend.model.domain.LlmProvider;
import com.chainflow.chainflow_backend.model.llm.LlmRequest;
import com.chainflow.chainflow_backend.model.llm.LlmResponse;

public interface LlmClient {

    LlmProvider getProvider();

    /**
     * @param apiKey   may be null for providers that need none
     * @param endpoint overrides the provider's default endpoint when not blank
     */
    LlmResponse call(LlmRequest request, String apiKey, String endpoint);

    String getDefaultModel();

    String[] getKnownModels();
}

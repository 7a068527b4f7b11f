package com.chainflow.chainflow_backend.model.llm;

import lombok.Getter;

/**
 * Provider-agnostic response returned by every LlmClient.
 */
@Getter
public class LlmResponse {

    private boolean success;
    private String  text;          // exact text the model returned
    private String  errorMessage;  // populated if success = false
    private String  model;         // model the provider reports, may differ from the requested one
    private int     inputTokens;
    private int     outputTokens;

    private LlmResponse() {}

    public static LlmResponse ok(String text, String model, int in, int out) {
        LlmResponse r = new LlmResponse();
        r.success      = true;
        r.text         = text;
        r.model        = model;
        r.inputTokens  = in;
        r.outputTokens = out;
        return r;
    }

    public static LlmResponse error(String message) {
        LlmResponse r = new LlmResponse();
        r.success      = false;
        r.errorMessage = message;
        return r;
    }
}

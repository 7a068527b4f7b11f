package com.chainflow.chainflow_backend.executor.capability;

import java.util.Map;

/**
 * One outgoing HTTP call. {@code body} is sent as-is; null means no body.
 */
public record ApiCallRequest(String method, String url, Map<String, String> headers, String body, int timeoutMs) {

    public ApiCallRequest {
        headers = headers != null ? Map.copyOf(headers) : Map.of();
    }
}

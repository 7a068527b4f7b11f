package com.chainflow.chainflow_backend.executor.capability;

import java.util.Map;

public record ApiCallResponse(int status, String body, Map<String, String> headers, long durationMs) {

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }
}

package com.chainflow.chainflow_backend.exception;

import lombok.Getter;

// A network or page-wait operation inside a node exceeded its configured timeout
@Getter
public class NodeTimeoutException extends NodeExecutionException {

    private final long timeoutMs;

    public NodeTimeoutException(String nodeId, long timeoutMs, Throwable cause) {
        super(nodeId, "Timed out after " + timeoutMs + " ms", cause);
        this.timeoutMs = timeoutMs;
    }
}

package com.chainflow.chainflow_backend.exception;

import lombok.Getter;

/**
 * A node's own logic failed. The flow executor records it against the node
 * and stops only that node's branch.
 */
@Getter
public class NodeExecutionException extends Exception {

    private final String nodeId;

    public NodeExecutionException(String nodeId, String message) {
        super(message);
        this.nodeId = nodeId;
    }

    public NodeExecutionException(String nodeId, String message, Throwable cause) {
        super(message, cause);
        this.nodeId = nodeId;
    }
}

package com.chainflow.chainflow_backend.exception;

/**
 * Malformed input the engine refuses to run: dangling edge, duplicate node id,
 * a graph without roots, an invalid URL.
 */
public class FlowValidationException extends RuntimeException {

    public FlowValidationException(String message) {
        super(message);
    }
}

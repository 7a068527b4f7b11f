package com.chainflow.chainflow_backend.model.context;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class ContextMeta {
    private String flowId;
    private String executionId;
    private Instant startedAt;
    private Instant completedAt;
    private ExecutionStatus status;
    /** Set when the run stops for a reason no single node owns (invalid graph, runaway guard). */
    private String errorMessage;
}

package com.chainflow.chainflow_backend.model.context;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-node accumulator, tagged with the execution that filled it.
 * Keyed by node id in ExecutionContext so multiple merger nodes do not interfere.
 */
@Data
public class AccumulatorState {
    private String executionId;
    private List<Object> accumulatedInputs = new ArrayList<>();

    public AccumulatorState() {}

    public AccumulatorState(String executionId) {
        this.executionId = executionId;
    }
}

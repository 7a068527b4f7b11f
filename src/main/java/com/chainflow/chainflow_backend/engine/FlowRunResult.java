package com.chainflow.chainflow_backend.engine;

import com.chainflow.chainflow_backend.model.context.ExecutionStatus;
import com.chainflow.chainflow_backend.model.context.NodeState;
import com.chainflow.chainflow_backend.model.domain.NodeResult;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one flow run.
 *
 * @param nodes        final state of every node that was activated, in activation order
 * @param errorMessage first failure, null on success
 */
public record FlowRunResult(
        String flowId,
        String executionId,
        ExecutionStatus status,
        List<NodeResult> results,
        Map<String, NodeState> nodes,
        String errorMessage) {

    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }
}

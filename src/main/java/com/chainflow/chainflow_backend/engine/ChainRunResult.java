package com.chainflow.chainflow_backend.engine;

import com.chainflow.chainflow_backend.model.context.ExecutionStatus;
import com.chainflow.chainflow_backend.model.domain.NodeResult;

import java.util.List;

/**
 * @param results      the selected flow's results; empty on error
 * @param failedFlowId set when a flow failed, null for chain-level errors and on success
 */
public record ChainRunResult(
        String chainId,
        ExecutionStatus status,
        List<NodeResult> results,
        String failedFlowId,
        String errorMessage) {

    static ChainRunResult succeeded(String chainId, List<NodeResult> results) {
        return new ChainRunResult(chainId, ExecutionStatus.SUCCESS, List.copyOf(results), null, null);
    }

    static ChainRunResult failed(String chainId, String flowId, String message) {
        return new ChainRunResult(chainId, ExecutionStatus.ERROR, List.of(), flowId, message);
    }

    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }
}

package com.chainflow.chainflow_backend.engine;

import com.chainflow.chainflow_backend.model.domain.NodeResult;

import java.util.List;

/**
 * Progress callbacks of one chain run. All methods default to no-ops.
 */
public interface ChainExecutionListener {

    ChainExecutionListener NONE = new ChainExecutionListener() {};

    default void onChainStart() {}

    /** @param results the selected flow's results */
    default void onChainComplete(List<NodeResult> results) {}

    default void onFlowStart(String flowId) {}

    default void onFlowComplete(String flowId, List<NodeResult> results) {}

    /** @param flowId the failing flow, or null when the failure is not attributable to one flow */
    default void onError(String flowId, String message) {}
}

package com.chainflow.chainflow_backend.repository;

import com.chainflow.chainflow_backend.model.context.ExecutionStatus;
import com.chainflow.chainflow_backend.model.domain.Flow;
import com.chainflow.chainflow_backend.model.domain.FlowChain;
import com.chainflow.chainflow_backend.model.domain.NodeResult;

import java.util.List;
import java.util.Optional;

/**
 * Durable store the chain executor reads flows from and writes run state back to.
 */
public interface FlowChainRepository {

    FlowChain save(FlowChain chain);

    Optional<FlowChain> findById(String chainId);

    List<FlowChain> findAll();

    boolean deleteById(String chainId);

    // ── Run-state operations used by the chain executor ──────────────────────

    /** The flow, if it exists and belongs to the chain. */
    Optional<Flow> getFlow(String chainId, String flowId);

    void setFlowResult(String chainId, String flowId, List<NodeResult> results);

    void setFlowStatus(String chainId, String flowId, ExecutionStatus status);

    void setChainStatus(String chainId, ExecutionStatus status, String errorMessage);
}

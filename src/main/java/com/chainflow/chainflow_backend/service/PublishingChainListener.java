package com.chainflow.chainflow_backend.service;

import com.chainflow.chainflow_backend.engine.ChainExecutionListener;
import com.chainflow.chainflow_backend.engine.ExecutionEventPublisher;
import com.chainflow.chainflow_backend.model.domain.NodeResult;
import lombok.RequiredArgsConstructor;

import java.util.List;

/** Forwards chain progress to /topic/chain/{chainId}. */
@RequiredArgsConstructor
class PublishingChainListener implements ChainExecutionListener {

    private final ExecutionEventPublisher publisher;
    private final String chainId;

    @Override
    public void onChainStart() {
        publisher.chainEvent(chainId, "CHAIN_STARTED", null, null);
    }

    @Override
    public void onChainComplete(List<NodeResult> results) {
        publisher.chainEvent(chainId, "CHAIN_COMPLETED", null, results);
    }

    @Override
    public void onFlowStart(String flowId) {
        publisher.chainEvent(chainId, "FLOW_STARTED", flowId, null);
    }

    @Override
    public void onFlowComplete(String flowId, List<NodeResult> results) {
        publisher.chainEvent(chainId, "FLOW_COMPLETED", flowId, results);
    }

    @Override
    public void onError(String flowId, String message) {
        publisher.chainEvent(chainId, "CHAIN_ERROR", flowId, message);
    }
}

package com.chainflow.chainflow_backend.repository;

import com.chainflow.chainflow_backend.model.context.ExecutionStatus;
import com.chainflow.chainflow_backend.model.domain.Flow;
import com.chainflow.chainflow_backend.model.domain.FlowChain;
import com.chainflow.chainflow_backend.model.domain.NodeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Chains live here; their flows live in the {@link FlowRepository} and are shared between chains.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class InMemoryFlowChainRepository implements FlowChainRepository {

    private final FlowRepository flowRepository;

    private final Map<String, FlowChain> storage = new ConcurrentHashMap<>();

    @Override
    public FlowChain save(FlowChain chain) {
        Objects.requireNonNull(chain, "chain must not be null");
        Objects.requireNonNull(chain.getId(), "chain id must not be null");
        storage.put(chain.getId(), chain);
        return chain;
    }

    @Override
    public Optional<FlowChain> findById(String chainId) {
        if (chainId == null) return Optional.empty();
        return Optional.ofNullable(storage.get(chainId));
    }

    @Override
    public List<FlowChain> findAll() {
        return List.copyOf(storage.values());
    }

    @Override
    public boolean deleteById(String chainId) {
        return chainId != null && storage.remove(chainId) != null;
    }

    @Override
    public Optional<Flow> getFlow(String chainId, String flowId) {
        FlowChain chain = storage.get(chainId);
        if (chain == null || !chain.getFlowIds().contains(flowId)) {
            return Optional.empty();
        }
        return flowRepository.findById(flowId);
    }

    @Override
    public void setFlowResult(String chainId, String flowId, List<NodeResult> results) {
        flowRepository.findById(flowId).ifPresentOrElse(flow -> {
            flow.setLastResults(results != null ? new ArrayList<>(results) : new ArrayList<>());
            flow.setLastRunAt(Instant.now());
        }, () -> log.warn("Chain {}: cannot store result, flow {} is gone", chainId, flowId));
    }

    @Override
    public void setFlowStatus(String chainId, String flowId, ExecutionStatus status) {
        flowRepository.findById(flowId).ifPresent(flow -> flow.setStatus(status));
    }

    @Override
    public void setChainStatus(String chainId, ExecutionStatus status, String errorMessage) {
        FlowChain chain = storage.get(chainId);
        if (chain == null) {
            log.warn("Cannot set status {} on unknown chain {}", status, chainId);
            return;
        }
        chain.setStatus(status);
        chain.setErrorMessage(errorMessage);
    }
}

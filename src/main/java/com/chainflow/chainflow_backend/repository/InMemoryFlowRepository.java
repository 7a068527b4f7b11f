package com.chainflow.chainflow_backend.repository;

import com.chainflow.chainflow_backend.model.domain.Flow;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe flow store. Saving a flow with an existing id overwrites it.
 */
@Repository
public class InMemoryFlowRepository implements FlowRepository {

    private final Map<String, Flow> storage = new ConcurrentHashMap<>();

    @Override
    public Flow save(Flow flow) {
        Objects.requireNonNull(flow, "flow must not be null");
        Objects.requireNonNull(flow.getId(), "flow id must not be null");
        storage.put(flow.getId(), flow);
        return flow;
    }

    @Override
    public Optional<Flow> findById(String flowId) {
        if (flowId == null) return Optional.empty();
        return Optional.ofNullable(storage.get(flowId));
    }

    @Override
    public List<Flow> findAll() {
        return List.copyOf(storage.values());
    }

    @Override
    public boolean existsById(String flowId) {
        return flowId != null && storage.containsKey(flowId);
    }

    @Override
    public boolean deleteById(String flowId) {
        return flowId != null && storage.remove(flowId) != null;
    }
}

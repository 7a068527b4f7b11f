package com.chainflow.chainflow_backend.repository;

import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryNodeContentStore implements NodeContentStore {

    private final Map<String, Map<String, Object>> storage = new ConcurrentHashMap<>();

    @Override
    public Map<String, Object> getContent(String nodeId) {
        Map<String, Object> content = storage.get(nodeId);
        if (content == null) return Map.of();
        synchronized (content) {
            return new LinkedHashMap<>(content);
        }
    }

    @Override
    public void putContent(String nodeId, Map<String, Object> content) {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        storage.put(nodeId, new LinkedHashMap<>(content != null ? content : Map.of()));
    }

    @Override
    public void publishContent(String nodeId, Map<String, Object> content) {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Map<String, Object> target = storage.computeIfAbsent(nodeId, id -> new LinkedHashMap<>());
        synchronized (target) {
            target.putAll(content);
        }
    }

    @Override
    public void removeContent(String nodeId) {
        storage.remove(nodeId);
    }
}

package com.chainflow.chainflow_backend.executor;

import com.chainflow.chainflow_backend.executor.impl.PassThroughExecutor;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Type tag to executor lookup. New node types plug in by declaring another NodeExecutor bean.
 * Tags with no executor fall back to pass-through (first input forwarded).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NodeExecutorRegistry {

    private final List<NodeExecutor> executors;
    private final Map<String, NodeExecutor> registry = new ConcurrentHashMap<>();
    private final NodeExecutor fallback = new PassThroughExecutor();

    @PostConstruct
    public void init() {
        executors.forEach(executor -> {
            NodeExecutor previous = registry.putIfAbsent(key(executor.supportedType()), executor);
            if (previous != null) {
                throw new IllegalStateException("Two executors registered for node type '" + executor.supportedType()
                        + "': " + previous.getClass().getSimpleName() + " and " + executor.getClass().getSimpleName());
            }
        });
        log.info("Registered node executors for types {}", registry.keySet());
    }

    public NodeExecutor get(String type) {
        NodeExecutor executor = type != null ? registry.get(key(type)) : null;
        if (executor == null) {
            log.warn("No executor registered for node type '{}', passing input through", type);
            return fallback;
        }
        return executor;
    }

    public boolean isSupported(String type) {
        return type != null && registry.containsKey(key(type));
    }

    private static String key(String type) {
        return type.trim().toLowerCase(Locale.ROOT);
    }
}

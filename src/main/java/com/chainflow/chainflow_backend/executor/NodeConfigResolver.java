package com.chainflow.chainflow_backend.executor;

import com.chainflow.chainflow_backend.model.domain.FlowNode;
import com.chainflow.chainflow_backend.repository.NodeContentStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Effective node configuration: the node's document data, overlaid with whatever the
 * content store holds for that node id.
 */
@Component
@RequiredArgsConstructor
public class NodeConfigResolver {

    private final NodeContentStore contentStore;

    public NodeConfig resolve(FlowNode node) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (node.getData() != null) merged.putAll(node.getData());
        contentStore.getContent(node.getId()).forEach((key, value) -> {
            if (value != null) merged.put(key, value);
        });
        return NodeConfig.of(merged);
    }
}

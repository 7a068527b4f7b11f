package com.chainflow.chainflow_backend.model.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One terminal node's contribution to a flow result.
 * {@code result} is the single output when there is exactly one, otherwise the whole outputs list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeResult {
    private String nodeId;
    private String nodeName;
    private String nodeType;
    private List<Object> outputs;
    private Object result;

    public static NodeResult of(FlowNode node, List<Object> outputs) {
        List<Object> copy = outputs != null ? new ArrayList<>(outputs) : new ArrayList<>();
        return NodeResult.builder()
                .nodeId(node.getId())
                .nodeName(node.getDisplayName())
                .nodeType(node.getType())
                .outputs(copy)
                .result(copy.size() == 1 ? copy.get(0) : copy)
                .build();
    }
}

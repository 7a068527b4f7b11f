package com.chainflow.chainflow_backend.engine;

import com.chainflow.chainflow_backend.model.context.ExecutionContext;
import com.chainflow.chainflow_backend.model.domain.FlowNode;
import com.chainflow.chainflow_backend.model.domain.NodeResult;
import com.chainflow.chainflow_backend.model.graph.FlowGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Turns a finished run into the flow's result list.
 *
 * One entry per leaf that produced output. Without leaves, nodes with no outgoing edge are used
 * regardless of group membership. When neither yields anything, every node that produced output
 * contributes one entry per output item, with file-like objects shown as "name (path)".
 */
@Slf4j
@Component
public class ResultAggregator {

    public List<NodeResult> collect(FlowGraph graph, ExecutionContext context) {
        List<String> terminals = graph.getLeaves();
        if (terminals.isEmpty()) {
            terminals = graph.getTerminalNodes();
        }

        List<NodeResult> results = new ArrayList<>();
        for (String nodeId : terminals) {
            List<Object> outputs = context.getOutput(nodeId);
            if (!outputs.isEmpty()) {
                results.add(NodeResult.of(graph.getNode(nodeId), outputs));
            }
        }
        if (!results.isEmpty()) return results;

        log.debug("Execution {}: no terminal node produced output, collecting from every node", context.getExecutionId());
        for (FlowNode node : graph.getNodes()) {
            for (Object output : context.getOutput(node.getId())) {
                results.add(NodeResult.of(node, Collections.singletonList(displayValue(output))));
            }
        }
        return results;
    }

    static Object displayValue(Object output) {
        if (output instanceof Map<?, ?> map && map.get("name") != null && map.get("path") != null) {
            return map.get("name") + " (" + map.get("path") + ")";
        }
        return output;
    }
}

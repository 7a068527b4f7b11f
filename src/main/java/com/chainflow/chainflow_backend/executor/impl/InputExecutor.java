package com.chainflow.chainflow_backend.executor.impl;

import com.chainflow.chainflow_backend.executor.NodeConfig;
import com.chainflow.chainflow_backend.executor.NodeConfigResolver;
import com.chainflow.chainflow_backend.executor.NodeExecutor;
import com.chainflow.chainflow_backend.model.context.ExecutionContext;
import com.chainflow.chainflow_backend.model.context.FanOut;
import com.chainflow.chainflow_backend.model.domain.FlowNode;
import com.chainflow.chainflow_backend.model.domain.NodeType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Emits the node's configured items, or the run's input batch when none are configured.
 *
 * Batch mode hands the whole list downstream as one value. With {@code iterateEachRow}
 * every item is delivered on its own, so children run once per item.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InputExecutor implements NodeExecutor {

    private final NodeConfigResolver configResolver;

    @Override
    public String supportedType() {
        return NodeType.INPUT.getTag();
    }

    @Override
    public Object execute(FlowNode node, List<Object> inputs, ExecutionContext context) {
        NodeConfig config = configResolver.resolve(node);
        boolean iterate = config.getBoolean("iterateEachRow", false);

        List<Object> items = new ArrayList<>(config.getList("items"));
        if (items.isEmpty() && config.has("text")) {
            String text = config.getString("text");
            if (iterate) {
                Arrays.stream(text.split("\\r?\\n"))
                        .map(String::trim)
                        .filter(line -> !line.isEmpty())
                        .forEach(items::add);
            } else {
                items.add(text);
            }
        }
        if (items.isEmpty() && inputs != null) {
            items.addAll(inputs);
        }

        log.debug("Input node {} emits {} item(s) in {} mode", node.getId(), items.size(), iterate ? "foreach" : "batch");
        return iterate ? new FanOut(items) : items;
    }
}

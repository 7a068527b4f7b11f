package com.chainflow.chainflow_backend.executor.impl;

import com.chainflow.chainflow_backend.executor.NodeExecutor;
import com.chainflow.chainflow_backend.model.context.ExecutionContext;
import com.chainflow.chainflow_backend.model.domain.FlowNode;

import java.util.List;

/**
 * Fallback for node types without a registered executor: forwards the first input unchanged.
 * Not a bean; the registry holds the single instance.
 */
public class PassThroughExecutor implements NodeExecutor {

    @Override
    public String supportedType() {
        return "passthrough";
    }

    @Override
    public Object execute(FlowNode node, List<Object> inputs, ExecutionContext context) {
        return inputs == null || inputs.isEmpty() ? null : inputs.get(0);
    }
}

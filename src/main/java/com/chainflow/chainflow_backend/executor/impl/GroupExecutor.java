package com.chainflow.chainflow_backend.executor.impl;

import com.chainflow.chainflow_backend.executor.NodeExecutor;
import com.chainflow.chainflow_backend.model.context.ExecutionContext;
import com.chainflow.chainflow_backend.model.domain.FlowNode;
import com.chainflow.chainflow_backend.model.domain.NodeType;
import org.springframework.stereotype.Component;

import java.util.List;

// Groups are editor containers; their members run as ordinary nodes.
@Component
public class GroupExecutor implements NodeExecutor {

    @Override
    public String supportedType() {
        return NodeType.GROUP.getTag();
    }

    @Override
    public Object execute(FlowNode node, List<Object> inputs, ExecutionContext context) {
        return null;
    }
}

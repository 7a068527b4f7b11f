package com.chainflow.chainflow_backend.executor.impl;

import com.chainflow.chainflow_backend.exception.NodeExecutionException;
import com.chainflow.chainflow_backend.executor.NodeConfig;
import com.chainflow.chainflow_backend.executor.NodeConfigResolver;
import com.chainflow.chainflow_backend.executor.NodeExecutor;
import com.chainflow.chainflow_backend.executor.TemplateResolver;
import com.chainflow.chainflow_backend.executor.ValuePaths;
import com.chainflow.chainflow_backend.model.context.ExecutionContext;
import com.chainflow.chainflow_backend.model.domain.FlowNode;
import com.chainflow.chainflow_backend.model.domain.NodeType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class JsonExtractorExecutor implements NodeExecutor {

    private final NodeConfigResolver configResolver;
    private final TemplateResolver   templates;

    @Override
    public String supportedType() {
        return NodeType.JSON_EXTRACTOR.getTag();
    }

    @Override
    public Object execute(FlowNode node, List<Object> inputs, ExecutionContext context) throws NodeExecutionException {
        NodeConfig config = configResolver.resolve(node);
        String path = config.getString("path");
        if (path == null) {
            throw new NodeExecutionException(node.getId(), "JSON extractor has no path configured");
        }

        Object input = inputs == null || inputs.isEmpty() ? null : inputs.get(0);
        if (input == null) {
            throw new NodeExecutionException(node.getId(), "JSON extractor received no input");
        }
        if (input instanceof String s) {
            Object parsed = templates.parseJson(s);
            if (parsed != null) input = parsed;
        }

        Object value = ValuePaths.extract(input, path);
        if (value == null) {
            log.debug("JSON extractor {}: path '{}' matched nothing", node.getId(), path);
        }
        return value;
    }
}

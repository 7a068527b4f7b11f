package com.chainflow.chainflow_backend.executor.impl;

import com.chainflow.chainflow_backend.executor.NodeConfig;
import com.chainflow.chainflow_backend.executor.NodeConfigResolver;
import com.chainflow.chainflow_backend.executor.NodeExecutor;
import com.chainflow.chainflow_backend.executor.TemplateResolver;
import com.chainflow.chainflow_backend.model.context.ExecutionContext;
import com.chainflow.chainflow_backend.model.domain.FlowNode;
import com.chainflow.chainflow_backend.model.domain.NodeType;
import com.chainflow.chainflow_backend.repository.NodeContentStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Formats its input for display and publishes the text to the content store under the node id.
 * Config: {@code format} = {@code text} (default) or {@code json}.
 */
@Component
@RequiredArgsConstructor
public class OutputExecutor implements NodeExecutor {

    static final String NO_INPUT     = "[No input provided]";
    static final String EMPTY_STRING = "[Empty string received]";
    static final String EMPTY_RESULT = "[generated empty response]";

    private final NodeConfigResolver configResolver;
    private final TemplateResolver   templates;
    private final NodeContentStore   contentStore;

    @Override
    public String supportedType() {
        return NodeType.OUTPUT.getTag();
    }

    @Override
    public Object execute(FlowNode node, List<Object> inputs, ExecutionContext context) {
        NodeConfig config = configResolver.resolve(node);
        Object input = inputs == null || inputs.isEmpty() ? null : inputs.get(0);

        String text = format(input, config.getString("format", "text"));
        if (text.isEmpty()) text = EMPTY_RESULT;

        contentStore.publishContent(node.getId(), Map.of("content", text));
        return text;
    }

    String format(Object input, String format) {
        if (input == null) return NO_INPUT;
        if (input instanceof String s && s.isBlank()) return EMPTY_STRING;

        if ("json".equalsIgnoreCase(format)) {
            return input instanceof String s ? s : templates.toPrettyJson(input);
        }
        if (input instanceof Map<?, ?> map) {
            Object content = map.get("content") != null ? map.get("content") : map.get("text");
            if (content != null) return templates.stringify(content);
        }
        return templates.stringify(input);
    }
}

package com.chainflow.chainflow_backend.executor.impl;

import com.chainflow.chainflow_backend.executor.NodeConfig;
import com.chainflow.chainflow_backend.executor.NodeConfigResolver;
import com.chainflow.chainflow_backend.executor.NodeExecutor;
import com.chainflow.chainflow_backend.executor.TemplateResolver;
import com.chainflow.chainflow_backend.model.context.ExecutionContext;
import com.chainflow.chainflow_backend.model.domain.FlowNode;
import com.chainflow.chainflow_backend.model.domain.NodeType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Accumulates every value delivered to it during one run and emits the aggregate after each delivery.
 *
 * The accumulator lives in the execution context, tagged with the execution id; a delivery under
 * a new id starts from an empty list. Modes:
 * <ul>
 *   <li>{@code concat} (default): ordered list, arrays flattened unless {@code arrayStrategy=preserve}</li>
 *   <li>{@code join}: text joined with {@code joinSeparator}</li>
 *   <li>{@code object}: map keyed by {@code propertyNames}, the input's source node, or position</li>
 * </ul>
 * The engine serializes firings of one node, so read-modify-write on the accumulator never interleaves.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MergerExecutor implements NodeExecutor {

    private final NodeConfigResolver configResolver;
    private final TemplateResolver   templates;

    @Override
    public String supportedType() {
        return NodeType.MERGER.getTag();
    }

    /** With {@code waitForAll} (default) the merger waits for every producer, otherwise it fires per delivery. */
    @Override
    public int arity(FlowNode node, int incomingEdges) {
        boolean waitForAll = configResolver.resolve(node).getBoolean("waitForAll", true);
        return waitForAll ? incomingEdges : Math.min(1, incomingEdges);
    }

    @Override
    public boolean replacesOutputs() {
        return true;
    }

    @Override
    public Object execute(FlowNode node, List<Object> inputs, ExecutionContext context) {
        NodeConfig config = configResolver.resolve(node);

        List<Object> additions = new ArrayList<>();
        if (inputs != null) inputs.stream().filter(Objects::nonNull).forEach(additions::add);
        config.getList("items").stream().filter(Objects::nonNull).forEach(additions::add);

        List<Object> accumulated = context.accumulate(node.getId(), context.getExecutionId(), additions);
        log.debug("Merger {} holds {} value(s) for execution {}", node.getId(), accumulated.size(), context.getExecutionId());

        if (config.getBoolean("waitForAll", true) && accumulated.isEmpty()) {
            return null;
        }

        String mode = config.getString("mergeMode", config.getString("mode", "concat")).toLowerCase(Locale.ROOT);
        switch (mode) {
            case "join":
                return join(accumulated, config.getString("joinSeparator", config.getString("separator", " ")));
            case "object":
                return toObject(accumulated, config.getList("propertyNames"));
            case "concat":
                return concat(accumulated, config.getString("arrayStrategy", "flatten"));
            default:
                log.warn("Merger {}: unknown mode '{}', using concat", node.getId(), mode);
                return concat(accumulated, config.getString("arrayStrategy", "flatten"));
        }
    }

    List<Object> concat(List<Object> values, String arrayStrategy) {
        boolean flatten = !"preserve".equalsIgnoreCase(arrayStrategy);
        List<Object> result = new ArrayList<>();
        for (Object value : values) {
            if (flatten && value instanceof List<?> list) {
                result.addAll(list);
            } else {
                result.add(value);
            }
        }
        return result;
    }

    String join(List<Object> values, String separator) {
        return values.stream()
                .map(this::joinText)
                .collect(Collectors.joining(separator != null ? separator : ""));
    }

    private String joinText(Object value) {
        if (value == null) return "";
        if (value instanceof List<?> list) {
            return list.stream().map(this::joinText).collect(Collectors.joining(", "));
        }
        return templates.stringify(value);
    }

    Map<String, Object> toObject(List<Object> values, List<Object> propertyNames) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (int i = 0; i < values.size(); i++) {
            Object value = values.get(i);
            String key;
            if (i < propertyNames.size() && propertyNames.get(i) != null && !propertyNames.get(i).toString().isBlank()) {
                key = propertyNames.get(i).toString();
            } else if (sourceIdOf(value) != null) {
                key = "input_from_" + sourceIdOf(value);
            } else {
                key = "input_" + (i + 1);
            }
            result.put(key, value);
        }
        return result;
    }

    private static String sourceIdOf(Object value) {
        if (value instanceof Map<?, ?> map && map.get("_meta") instanceof Map<?, ?> meta) {
            Object sourceId = meta.get("sourceId");
            return sourceId != null ? sourceId.toString() : null;
        }
        return null;
    }
}

package com.chainflow.chainflow_backend.executor.impl;

import com.chainflow.chainflow_backend.executor.NodeConfig;
import com.chainflow.chainflow_backend.executor.NodeConfigResolver;
import com.chainflow.chainflow_backend.executor.NodeExecutor;
import com.chainflow.chainflow_backend.executor.TemplateResolver;
import com.chainflow.chainflow_backend.executor.ValuePaths;
import com.chainflow.chainflow_backend.model.context.ExecutionContext;
import com.chainflow.chainflow_backend.model.context.RoutedOutput;
import com.chainflow.chainflow_backend.model.domain.FlowNode;
import com.chainflow.chainflow_backend.model.domain.NodeType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Routes its input unchanged along the true or the false handle.
 *
 * Condition types: contains, greater_than, less_than, equal_to (numeric when both sides
 * parse as numbers, otherwise textual) and json_path (the value at the path is truthy).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConditionalExecutor implements NodeExecutor {

    private final NodeConfigResolver configResolver;
    private final TemplateResolver   templates;

    @Override
    public String supportedType() {
        return NodeType.CONDITIONAL.getTag();
    }

    @Override
    public Object execute(FlowNode node, List<Object> inputs, ExecutionContext context) {
        NodeConfig config = configResolver.resolve(node);
        String type  = config.getString("conditionType", "contains").toLowerCase(Locale.ROOT);
        String value = config.getString("conditionValue", "");

        Object input = inputs == null || inputs.isEmpty() ? null : inputs.get(0);
        boolean result = evaluate(type, input, value);

        log.debug("Conditional {}: {} '{}' -> {}", node.getId(), type, value, result);
        return RoutedOutput.of(result, input);
    }

    boolean evaluate(String type, Object input, String conditionValue) {
        switch (type) {
            case "contains":
                return templates.stringify(input).contains(conditionValue);
            case "greater_than": {
                Double a = toNumber(input), b = toNumber(conditionValue);
                return a != null && b != null && a > b;
            }
            case "less_than": {
                Double a = toNumber(input), b = toNumber(conditionValue);
                return a != null && b != null && a < b;
            }
            case "equal_to": {
                Double a = toNumber(input), b = toNumber(conditionValue);
                if (a != null && b != null) return a.doubleValue() == b.doubleValue();
                return templates.stringify(input).equals(conditionValue);
            }
            case "json_path": {
                Object source = input instanceof String s && templates.parseJson(s) != null ? templates.parseJson(s) : input;
                return isTruthy(ValuePaths.extract(source, conditionValue));
            }
            default:
                log.warn("Unknown condition type '{}', routing to false", type);
                return false;
        }
    }

    private static Double toNumber(Object value) {
        if (value instanceof Number n) return n.doubleValue();
        if (value == null) return null;
        String s = value.toString().trim();
        if (s.isEmpty()) return null;
        try {
            double d = Double.parseDouble(s);
            return Double.isNaN(d) ? null : d;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static boolean isTruthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return n.doubleValue() != 0 && !Double.isNaN(n.doubleValue());
        if (value instanceof String s) return !s.isEmpty();
        return true;
    }
}

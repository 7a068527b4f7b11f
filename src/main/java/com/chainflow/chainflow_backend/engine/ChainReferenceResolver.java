package com.chainflow.chainflow_backend.engine;

import com.chainflow.chainflow_backend.executor.TemplateResolver;
import com.chainflow.chainflow_backend.model.domain.Flow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code ${flowId.result}} placeholders in chain inputs with another flow's stored result.
 *
 * A string that is exactly one placeholder becomes the raw result, keeping its type. A placeholder
 * inside a longer string is replaced by the result's JSON text. References to a flow that has no
 * stored result stay as written. Maps and lists are resolved recursively.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChainReferenceResolver {

    static final Pattern REFERENCE = Pattern.compile("\\$\\{([^.}]+)\\.result}");

    private final TemplateResolver templates;

    public boolean containsReference(Object value) {
        if (value instanceof String s) return REFERENCE.matcher(s).find();
        if (value instanceof Map<?, ?> map) return map.values().stream().anyMatch(this::containsReference);
        if (value instanceof List<?> list) return list.stream().anyMatch(this::containsReference);
        return false;
    }

    public List<Object> resolveAll(List<Object> inputs, Function<String, Optional<Flow>> flowLookup) {
        List<Object> resolved = new ArrayList<>();
        if (inputs != null) inputs.forEach(value -> resolved.add(resolve(value, flowLookup)));
        return resolved;
    }

    public Object resolve(Object value, Function<String, Optional<Flow>> flowLookup) {
        if (value instanceof String s) return resolveString(s, flowLookup);
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(k, resolve(v, flowLookup)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>();
            list.forEach(v -> copy.add(resolve(v, flowLookup)));
            return copy;
        }
        return value;
    }

    private Object resolveString(String text, Function<String, Optional<Flow>> flowLookup) {
        Matcher whole = REFERENCE.matcher(text);
        if (whole.matches()) {
            Optional<Flow> source = storedResultOf(whole.group(1), flowLookup);
            return source.isPresent() ? source.get().getResultValue() : text;
        }

        Matcher m = REFERENCE.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            Optional<Flow> source = storedResultOf(m.group(1), flowLookup);
            String replacement = source.isPresent() ? templates.toJson(source.get().getResultValue()) : m.group(0);
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private Optional<Flow> storedResultOf(String flowId, Function<String, Optional<Flow>> flowLookup) {
        Optional<Flow> flow = flowLookup.apply(flowId).filter(Flow::hasStoredResult);
        if (flow.isEmpty()) {
            log.warn("Reference ${{}.result} left unresolved: flow has no stored result", flowId);
        }
        return flow;
    }
}

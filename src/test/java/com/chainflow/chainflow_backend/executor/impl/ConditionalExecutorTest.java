package com.chainflow.chainflow_backend.executor.impl;

import com.chainflow.chainflow_backend.executor.NodeConfigResolver;
import com.chainflow.chainflow_backend.executor.TemplateResolver;
import com.chainflow.chainflow_backend.model.context.ExecutionContext;
import com.chainflow.chainflow_backend.model.context.RoutedOutput;
import com.chainflow.chainflow_backend.model.domain.FlowNode;
import com.chainflow.chainflow_backend.repository.InMemoryNodeContentStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConditionalExecutorTest {

    private ConditionalExecutor conditional;

    @BeforeEach
    void setUp() {
        conditional = new ConditionalExecutor(new NodeConfigResolver(new InMemoryNodeContentStore()),
                new TemplateResolver(new ObjectMapper()));
    }

    @Nested
    class Evaluate {

        @Test
        void shouldCompareNumbersParsedFromText() {
            assertThat(conditional.evaluate("greater_than", "10", "9")).isTrue();
            assertThat(conditional.evaluate("less_than", 3, "2.5")).isFalse();
            assertThat(conditional.evaluate("equal_to", 4.0, "4")).isTrue();
        }

        @Test
        void shouldFallBackToTextEqualityForNonNumbers() {
            assertThat(conditional.evaluate("equal_to", "abc", "abc")).isTrue();
            assertThat(conditional.evaluate("greater_than", "abc", "1")).isFalse();
        }

        @Test
        void shouldCheckContainsOnStringifiedInput() {
            assertThat(conditional.evaluate("contains", Map.of("status", "ok"), "\"ok\"")).isTrue();
        }

        @Test
        void shouldTestJsonPathTruthiness() {
            assertThat(conditional.evaluate("json_path", "{\"data\":{\"ready\":true}}", "$.data.ready")).isTrue();
            assertThat(conditional.evaluate("json_path", Map.of("count", 0), "count")).isFalse();
        }

        @Test
        void shouldRouteUnknownTypesToFalse() {
            assertThat(conditional.evaluate("regex", "x", "x")).isFalse();
        }
    }

    @Test
    void shouldEmitInputUnchangedOnChosenHandle() {
        Map<String, Object> data = new LinkedHashMap<>(Map.of("conditionType", "contains", "conditionValue", "err"));
        FlowNode node = FlowNode.builder().id("c1").type("conditional").data(data).build();

        Object result = conditional.execute(node, List.of("no error here"), ExecutionContext.create("f"));

        assertThat(result).isEqualTo(new RoutedOutput("true", "no error here"));
        assertThat(((RoutedOutput) result).matches("c1-source-true")).isTrue();
        assertThat(((RoutedOutput) result).matches("falseHandle")).isFalse();
    }
}

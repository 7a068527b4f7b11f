package com.chainflow.chainflow_backend.executor.impl;

import com.chainflow.chainflow_backend.executor.NodeConfigResolver;
import com.chainflow.chainflow_backend.executor.TemplateResolver;
import com.chainflow.chainflow_backend.model.context.ExecutionContext;
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

class MergerExecutorTest {

    private MergerExecutor merger;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        merger = new MergerExecutor(new NodeConfigResolver(new InMemoryNodeContentStore()),
                new TemplateResolver(new ObjectMapper()));
        context = ExecutionContext.create("flow-1");
    }

    private static FlowNode mergerNode(Map<String, Object> data) {
        return FlowNode.builder().id("m").type("merger").data(new LinkedHashMap<>(data)).build();
    }

    @Nested
    class Concat {

        @Test
        void shouldFlattenSequentialArrayInputs() {
            FlowNode node = mergerNode(Map.of("mergeMode", "concat"));

            merger.execute(node, List.of(List.of("a")), context);
            Object result = merger.execute(node, List.of(List.of("b", "c")), context);

            assertThat(result).isEqualTo(List.of("a", "b", "c"));
        }

        @Test
        void shouldPreserveArraysWhenAsked() {
            FlowNode node = mergerNode(Map.of("mergeMode", "concat", "arrayStrategy", "preserve"));

            merger.execute(node, List.of(List.of("a")), context);
            Object result = merger.execute(node, List.of(List.of("b", "c")), context);

            assertThat(result).isEqualTo(List.of(List.of("a"), List.of("b", "c")));
        }

        @Test
        void shouldFallBackToConcatForUnknownMode() {
            FlowNode node = mergerNode(Map.of("mergeMode", "zip"));

            Object result = merger.execute(node, List.of("x", "y"), context);

            assertThat(result).isEqualTo(List.of("x", "y"));
        }
    }

    @Nested
    class Join {

        @Test
        void shouldJoinWithSeparator() {
            FlowNode node = mergerNode(Map.of("mergeMode", "join", "joinSeparator", ","));

            Object result = merger.execute(node, List.of(1, 2, 3), context);

            assertThat(result).isEqualTo("1,2,3");
        }

        @Test
        void shouldCommaJoinArraysAndSerializeObjects() {
            String joined = merger.join(List.of(List.of("a", "b"), Map.of("k", 1), "z"), " | ");

            assertThat(joined).isEqualTo("a, b | {\"k\":1} | z");
        }
    }

    @Nested
    class ObjectMode {

        @Test
        void shouldKeyByPropertyNamesThenPosition() {
            FlowNode node = mergerNode(Map.of("mergeMode", "object", "propertyNames", List.of("x", "y")));

            Object result = merger.execute(node, List.of(10, 20, 30), context);

            assertThat(result).isEqualTo(Map.of("x", 10, "y", 20, "input_3", 30));
        }

        @Test
        void shouldKeyBySourceIdFromMeta() {
            Map<String, Object> tagged = Map.of("v", 1, "_meta", Map.of("sourceId", "api1"));

            Map<String, Object> result = merger.toObject(List.of(tagged), List.of());

            assertThat(result).containsOnlyKeys("input_from_api1");
        }
    }

    @Nested
    class Reset {

        @Test
        void shouldStartEmptyForANewExecution() {
            // Given values accumulated in the first run
            FlowNode node = mergerNode(Map.of());
            merger.execute(node, List.of("a", "b"), context);

            // When the context starts a new run
            context.restart();
            Object result = merger.execute(node, List.of("c"), context);

            // Then only the new run's value is present
            assertThat(result).isEqualTo(List.of("c"));
        }
    }

    @Nested
    class Arity {

        @Test
        void shouldWaitForAllProducersByDefault() {
            assertThat(merger.arity(mergerNode(Map.of()), 3)).isEqualTo(3);
        }

        @Test
        void shouldFirePerDeliveryWhenNotWaiting() {
            assertThat(merger.arity(mergerNode(Map.of("waitForAll", false)), 3)).isEqualTo(1);
        }
    }
}

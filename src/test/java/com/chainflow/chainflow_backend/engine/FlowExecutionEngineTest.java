package com.chainflow.chainflow_backend.engine;

import com.chainflow.chainflow_backend.config.EngineProperties;
import com.chainflow.chainflow_backend.exception.NodeExecutionException;
import com.chainflow.chainflow_backend.executor.NodeConfigResolver;
import com.chainflow.chainflow_backend.executor.NodeExecutor;
import com.chainflow.chainflow_backend.executor.NodeExecutorRegistry;
import com.chainflow.chainflow_backend.executor.TemplateResolver;
import com.chainflow.chainflow_backend.executor.impl.ConditionalExecutor;
import com.chainflow.chainflow_backend.executor.impl.InputExecutor;
import com.chainflow.chainflow_backend.executor.impl.MergerExecutor;
import com.chainflow.chainflow_backend.model.context.ExecutionContext;
import com.chainflow.chainflow_backend.model.context.ExecutionStatus;
import com.chainflow.chainflow_backend.model.context.NodeStatus;
import com.chainflow.chainflow_backend.model.domain.Flow;
import com.chainflow.chainflow_backend.model.domain.FlowEdge;
import com.chainflow.chainflow_backend.model.domain.FlowNode;
import com.chainflow.chainflow_backend.model.domain.NodeResult;
import com.chainflow.chainflow_backend.repository.InMemoryNodeContentStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class FlowExecutionEngineTest {

    private ExecutorService pool;
    private ExecutionEventPublisher publisher;
    private EngineProperties properties;
    private FlowExecutionEngine engine;

    /** Always fails; stands in for a node whose logic throws. */
    private static final NodeExecutor FAILING = new NodeExecutor() {
        @Override
        public String supportedType() {
            return "boom";
        }

        @Override
        public Object execute(FlowNode node, List<Object> inputs, ExecutionContext context) throws NodeExecutionException {
            throw new NodeExecutionException(node.getId(), "exploded");
        }
    };

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(4);
        publisher = mock(ExecutionEventPublisher.class);
        properties = new EngineProperties();

        NodeConfigResolver configResolver = new NodeConfigResolver(new InMemoryNodeContentStore());
        TemplateResolver templates = new TemplateResolver(new ObjectMapper());
        NodeExecutorRegistry registry = new NodeExecutorRegistry(List.of(
                new InputExecutor(configResolver),
                new MergerExecutor(configResolver, templates),
                new ConditionalExecutor(configResolver, templates),
                FAILING));
        registry.init();

        engine = new FlowExecutionEngine(registry, publisher, new ResultAggregator(), pool::execute, properties);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private static FlowNode node(String id, String type, Map<String, Object> data) {
        return FlowNode.builder().id(id).type(type).data(new LinkedHashMap<>(data)).build();
    }

    private static FlowNode node(String id, String type) {
        return node(id, type, Map.of());
    }

    private static FlowEdge edge(String source, String target) {
        return FlowEdge.builder().id(source + "-" + target).source(source).target(target).build();
    }

    private static FlowEdge edge(String source, String target, String handle) {
        return FlowEdge.builder().id(source + "-" + target).source(source).target(target).sourceHandle(handle).build();
    }

    private static Flow flow(List<FlowNode> nodes, List<FlowEdge> edges) {
        return Flow.builder().id("flow-1").name("test").nodes(new ArrayList<>(nodes)).edges(new ArrayList<>(edges)).build();
    }

    @Nested
    class Scheduling {

        @Test
        void shouldDeliverGlobalInputThroughInputToMerger() {
            // Given InputA -> MergerM in concat mode
            Flow flow = flow(
                    List.of(node("A", "input"), node("M", "merger", Map.of("mergeMode", "concat"))),
                    List.of(edge("A", "M")));
            ExecutionContext context = ExecutionContext.create("flow-1");

            // When
            FlowRunResult result = engine.run(flow, List.of("hello"), context);

            // Then
            assertThat(result.status()).isEqualTo(ExecutionStatus.SUCCESS);
            assertThat(context.getOutput("M")).containsExactly(List.of("hello"));
            assertThat(result.results()).extracting(NodeResult::getNodeId).containsExactly("M");
        }

        @Test
        void shouldFireMergerOnceWhenAllProducersDelivered() {
            // Given a diamond: A -> B, A -> C, B -> M, C -> M
            Flow flow = flow(
                    List.of(node("A", "input"), node("B", "relay"), node("C", "relay"), node("M", "merger")),
                    List.of(edge("A", "B"), edge("A", "C"), edge("B", "M"), edge("C", "M")));
            ExecutionContext context = ExecutionContext.create("flow-1");

            // When
            FlowRunResult result = engine.run(flow, List.of("v"), context);

            // Then
            assertThat(result.isSuccess()).isTrue();
            assertThat(context.getOutput("M")).containsExactly(List.of("v", "v"));
        }

        @Test
        void shouldRunChildrenOncePerFannedOutItem() {
            Flow flow = flow(
                    List.of(node("A", "input", Map.of("items", List.of(1, 2, 3), "iterateEachRow", true)),
                            node("R", "relay")),
                    List.of(edge("A", "R")));
            ExecutionContext context = ExecutionContext.create("flow-1");

            engine.run(flow, List.of(), context);

            assertThat(context.getOutput("R")).containsExactlyInAnyOrder(1, 2, 3);
        }

        @Test
        void shouldFollowOnlyTheMatchingConditionalHandle() {
            // Given 5 routed through "greater_than 3"
            Flow flow = flow(
                    List.of(node("A", "input", Map.of("items", List.of(5), "iterateEachRow", true)),
                            node("C", "conditional", Map.of("conditionType", "greater_than", "conditionValue", "3")),
                            node("T", "relay"),
                            node("F", "relay")),
                    List.of(edge("A", "C"), edge("C", "T", "C-source-true"), edge("C", "F", "C-source-false")));
            ExecutionContext context = ExecutionContext.create("flow-1");

            // When
            engine.run(flow, List.of(), context);

            // Then
            assertThat(context.getOutput("T")).containsExactly(5);
            assertThat(context.getNodeState("F").getStatus()).isEqualTo(NodeStatus.IDLE);
        }
    }

    @Nested
    class Failures {

        @Test
        void shouldKeepSiblingOutputWhenOneRootFails() {
            // Given two independent roots, R2 throws
            Flow flow = flow(List.of(node("R1", "input"), node("R2", "boom")), List.of());
            ExecutionContext context = ExecutionContext.create("flow-1");

            // When
            FlowRunResult result = engine.run(flow, List.of("x"), context);

            // Then
            assertThat(result.status()).isEqualTo(ExecutionStatus.ERROR);
            assertThat(result.errorMessage()).isEqualTo("Node R2 failed: exploded");
            assertThat(context.getOutput("R1")).containsExactly(List.of("x"));
            assertThat(context.getNodeState("R2").getStatus()).isEqualTo(NodeStatus.ERROR);
            verify(publisher).nodeError(eq(context.getExecutionId()), eq("R2"), eq("exploded"));
        }

        @Test
        void shouldSkipOnlyDescendantsOfFailedNode() {
            Flow flow = flow(
                    List.of(node("A", "input"), node("X", "boom"), node("D", "relay"), node("S", "relay")),
                    List.of(edge("A", "X"), edge("X", "D"), edge("A", "S")));
            ExecutionContext context = ExecutionContext.create("flow-1");

            engine.run(flow, List.of("x"), context);

            assertThat(context.getNodeState("D").getStatus()).isEqualTo(NodeStatus.IDLE);
            assertThat(context.getNodeState("S").getStatus()).isEqualTo(NodeStatus.SUCCESS);
        }

        @Test
        void shouldRejectFlowWithoutRoots() {
            Flow flow = flow(List.of(node("A", "relay"), node("B", "relay")), List.of(edge("A", "B"), edge("B", "A")));

            FlowRunResult result = engine.run(flow, List.of(), ExecutionContext.create("flow-1"));

            assertThat(result.status()).isEqualTo(ExecutionStatus.ERROR);
            assertThat(result.errorMessage()).contains("no root nodes");
        }

        @Test
        void shouldRejectDanglingEdges() {
            Flow flow = flow(List.of(node("A", "input")), List.of(edge("A", "ghost")));

            FlowRunResult result = engine.run(flow, List.of(), ExecutionContext.create("flow-1"));

            assertThat(result.status()).isEqualTo(ExecutionStatus.ERROR);
            verify(publisher).flowStatus(any(), eq("flow-1"), eq(ExecutionStatus.ERROR), any());
        }

        @Test
        void shouldStopAtNodeExecutionLimit() {
            properties.getEngine().setMaxNodeExecutions(2);
            Flow flow = flow(
                    List.of(node("A", "input"), node("B", "relay"), node("C", "relay"), node("D", "relay")),
                    List.of(edge("A", "B"), edge("B", "C"), edge("C", "D")));
            ExecutionContext context = ExecutionContext.create("flow-1");

            FlowRunResult result = engine.run(flow, List.of("x"), context);

            assertThat(result.status()).isEqualTo(ExecutionStatus.ERROR);
            assertThat(result.errorMessage()).contains("node execution limit");
            assertThat(context.getNodeState("D").getStatus()).isEqualTo(NodeStatus.IDLE);
        }
    }
}

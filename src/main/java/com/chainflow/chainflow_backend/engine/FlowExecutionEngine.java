package com.chainflow.chainflow_backend.engine;

import com.chainflow.chainflow_backend.config.EngineProperties;
import com.chainflow.chainflow_backend.exception.FlowValidationException;
import com.chainflow.chainflow_backend.exception.NodeExecutionException;
import com.chainflow.chainflow_backend.executor.NodeExecutor;
import com.chainflow.chainflow_backend.executor.NodeExecutorRegistry;
import com.chainflow.chainflow_backend.model.context.ExecutionContext;
import com.chainflow.chainflow_backend.model.context.ExecutionStatus;
import com.chainflow.chainflow_backend.model.context.FanOut;
import com.chainflow.chainflow_backend.model.context.NodeStatus;
import com.chainflow.chainflow_backend.model.context.RoutedOutput;
import com.chainflow.chainflow_backend.model.domain.Flow;
import com.chainflow.chainflow_backend.model.domain.FlowEdge;
import com.chainflow.chainflow_backend.model.domain.FlowNode;
import com.chainflow.chainflow_backend.model.domain.NodeResult;
import com.chainflow.chainflow_backend.model.graph.FlowGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs one flow: every root starts concurrently with the run's input batch, and each output
 * travels along the node's outgoing edges to its children.
 *
 * Every incoming edge of a node has its own FIFO of delivered values. A node fires as soon as
 * {@link NodeExecutor#arity} of its edges hold a value, taking one value from each in edge order;
 * by default that means it waits for all producers. Firings of one node never overlap.
 *
 * A failed node delivers nothing, so only its descendants are skipped; other branches run on.
 */
@Slf4j
@Service
public class FlowExecutionEngine {

    private final NodeExecutorRegistry    executorRegistry;
    private final ExecutionEventPublisher eventPublisher;
    private final ResultAggregator        resultAggregator;
    private final TaskExecutor            taskExecutor;
    private final EngineProperties        properties;

    public FlowExecutionEngine(NodeExecutorRegistry executorRegistry,
                               ExecutionEventPublisher eventPublisher,
                               ResultAggregator resultAggregator,
                               @Qualifier("flowTaskExecutor") TaskExecutor taskExecutor,
                               EngineProperties properties) {
        this.executorRegistry = executorRegistry;
        this.eventPublisher = eventPublisher;
        this.resultAggregator = resultAggregator;
        this.taskExecutor = taskExecutor;
        this.properties = properties;
    }

    /**
     * Runs the flow to completion on the given context and returns once no node is running or ready.
     * The context stays owned by the caller, who tears it down.
     */
    public FlowRunResult run(Flow flow, List<Object> inputs, ExecutionContext context) {
        String executionId = context.getExecutionId();
        context.setInputs(inputs);
        context.markRunStarted();
        eventPublisher.flowStatus(executionId, flow.getId(), ExecutionStatus.RUNNING, null);
        log.info("Execution {}: starting flow {} ({})", executionId, flow.getId(), flow.getName());

        FlowGraph graph;
        try {
            graph = FlowGraph.build(flow.getNodes(), flow.getEdges());
            if (graph.getRoots().isEmpty()) {
                throw new FlowValidationException("Flow has no root nodes");
            }
        } catch (FlowValidationException ex) {
            log.warn("Execution {}: flow {} rejected: {}", executionId, flow.getId(), ex.getMessage());
            return finish(flow, context, ExecutionStatus.ERROR, ex.getMessage(), List.of());
        }

        Run run = new Run(graph, context);
        run.start(context.getInputs());
        run.done.join();

        String error = null;
        if (run.limitReached.get()) {
            error = "Execution stopped: node execution limit (" + properties.getEngine().getMaxNodeExecutions()
                    + ") reached. Possible cycle in flow.";
        } else if (context.hasErrors()) {
            error = firstError(context);
        }
        ExecutionStatus status = error == null ? ExecutionStatus.SUCCESS : ExecutionStatus.ERROR;
        return finish(flow, context, status, error, resultAggregator.collect(graph, context));
    }

    private FlowRunResult finish(Flow flow, ExecutionContext context, ExecutionStatus status,
                                 String error, List<NodeResult> results) {
        context.markRunFinished(status, error);
        eventPublisher.flowStatus(context.getExecutionId(), flow.getId(), status, error);
        if (status == ExecutionStatus.SUCCESS) {
            log.info("Execution {}: flow {} finished with {} result(s)", context.getExecutionId(), flow.getId(), results.size());
        } else {
            log.warn("Execution {}: flow {} finished with error: {}", context.getExecutionId(), flow.getId(), error);
        }
        return new FlowRunResult(flow.getId(), context.getExecutionId(), status, results, context.getNodes(), error);
    }

    private static String firstError(ExecutionContext context) {
        return context.getNodes().values().stream()
                .filter(s -> s.getStatus() == NodeStatus.ERROR)
                .findFirst()
                .map(s -> "Node " + s.getNodeId() + " failed: " + s.getErrorMessage())
                .orElse("Flow failed");
    }

    // ── Per-run scheduling state ──────────────────────────────────────────────

    private final class Run {

        private final FlowGraph graph;
        private final ExecutionContext context;
        private final String executionId;

        private final Map<FlowEdge, Integer> edgeSlot = new IdentityHashMap<>();
        private final Map<String, List<LinkedList<Object>>> queues = new HashMap<>();
        private final Map<String, ReentrantLock> nodeLocks = new HashMap<>();

        // Starts at 1 so the run cannot complete while roots are still being submitted
        private final AtomicInteger inFlight = new AtomicInteger(1);
        private final AtomicInteger firings = new AtomicInteger();
        private final AtomicBoolean limitReached = new AtomicBoolean();
        private final CompletableFuture<Void> done = new CompletableFuture<>();

        Run(FlowGraph graph, ExecutionContext context) {
            this.graph = graph;
            this.context = context;
            this.executionId = context.getExecutionId();
            for (FlowNode node : graph.getNodes()) {
                List<FlowEdge> incoming = graph.getIncoming(node.getId());
                List<LinkedList<Object>> slots = new ArrayList<>();
                for (int i = 0; i < incoming.size(); i++) {
                    edgeSlot.put(incoming.get(i), i);
                    slots.add(new LinkedList<>());
                }
                queues.put(node.getId(), slots);
                nodeLocks.put(node.getId(), new ReentrantLock());
            }
        }

        void start(List<Object> inputs) {
            for (String rootId : graph.getRoots()) {
                dispatch(rootId, inputs);
            }
            release();
        }

        private void dispatch(String nodeId, List<Object> inputs) {
            inFlight.incrementAndGet();
            try {
                taskExecutor.execute(() -> {
                    try {
                        fire(nodeId, inputs);
                    } finally {
                        release();
                    }
                });
            } catch (TaskRejectedException ex) {
                log.error("Execution {}: node {} could not be scheduled: {}", executionId, nodeId, ex.getMessage());
                context.markError(nodeId, "Could not be scheduled: " + ex.getMessage());
                eventPublisher.nodeError(executionId, nodeId, ex.getMessage());
                release();
            }
        }

        private void release() {
            if (inFlight.decrementAndGet() == 0) {
                done.complete(null);
            }
        }

        private void fire(String nodeId, List<Object> inputs) {
            if (firings.incrementAndGet() > properties.getEngine().getMaxNodeExecutions()) {
                if (limitReached.compareAndSet(false, true)) {
                    log.warn("Execution {}: node execution limit reached, no further nodes are scheduled", executionId);
                }
                return;
            }

            FlowNode node = graph.getNode(nodeId);
            NodeExecutor executor = executorRegistry.get(node.getType());
            Object output;

            ReentrantLock lock = nodeLocks.get(nodeId);
            lock.lock();
            try {
                context.markRunning(nodeId, node.getType());
                eventPublisher.nodeStarted(executionId, nodeId);
                log.debug("Execution {}: running node {} ({})", executionId, nodeId, node.getType());

                try {
                    output = executor.execute(node, inputs, context);
                } catch (NodeExecutionException | RuntimeException ex) {
                    String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
                    log.error("Execution {}: node {} ({}) failed: {}", executionId, nodeId, node.getType(), message);
                    context.markError(nodeId, message);
                    eventPublisher.nodeError(executionId, nodeId, message);
                    return;
                }

                context.markSuccess(nodeId, recorded(output), executor.replacesOutputs());
                eventPublisher.nodeCompleted(executionId, nodeId);
            } finally {
                lock.unlock();
            }

            if (output == null) {
                log.debug("Execution {}: node {} produced nothing to deliver", executionId, nodeId);
                return;
            }
            route(nodeId, output);
        }

        private List<Object> recorded(Object output) {
            if (output == null) return List.of();
            if (output instanceof FanOut fanOut) return fanOut.items();
            if (output instanceof RoutedOutput routed) return Collections.singletonList(routed.value());
            return Collections.singletonList(output);
        }

        private void route(String nodeId, Object output) {
            for (FlowEdge edge : graph.getOutgoing(nodeId)) {
                if (output instanceof FanOut fanOut) {
                    fanOut.items().forEach(item -> deliver(edge, item));
                } else if (output instanceof RoutedOutput routed) {
                    if (routed.matches(edge.getSourceHandle())) deliver(edge, routed.value());
                } else {
                    deliver(edge, output);
                }
            }
        }

        private void deliver(FlowEdge edge, Object value) {
            String targetId = edge.getTarget();
            FlowNode target = graph.getNode(targetId);
            List<LinkedList<Object>> slots = queues.get(targetId);
            int arity = Math.max(1, Math.min(slots.size(),
                    executorRegistry.get(target.getType()).arity(target, slots.size())));

            List<List<Object>> ready = new ArrayList<>();
            synchronized (slots) {
                slots.get(edgeSlot.get(edge)).add(value);
                while (slots.stream().filter(q -> !q.isEmpty()).count() >= arity) {
                    List<Object> batch = new ArrayList<>();
                    for (LinkedList<Object> queue : slots) {
                        if (batch.size() == arity) break;
                        if (!queue.isEmpty()) batch.add(queue.poll());
                    }
                    ready.add(batch);
                }
            }
            ready.forEach(batch -> dispatch(targetId, batch));
        }
    }
}

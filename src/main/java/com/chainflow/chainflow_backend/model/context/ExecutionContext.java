package com.chainflow.chainflow_backend.model.context;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Per-run state store: node statuses and outputs, merger accumulators and the run's global inputs.
 *
 * One context belongs to one caller, who creates it, hands it to the flow executor and tears it
 * down when the run is over. All methods are safe to call from the executor's worker threads.
 *
 * Accumulators are tagged with the execution id that produced them. Touching an accumulator
 * under a different execution id discards the stale content and adopts the new id.
 */
@Slf4j
public class ExecutionContext {

    private final ContextMeta meta;

    /** Keyed by node id, in the order nodes first became active. */
    private final Map<String, NodeState> nodes = new LinkedHashMap<>();

    private final Map<String, AccumulatorState> accumulators = new HashMap<>();

    private List<Object> inputs = new ArrayList<>();

    private boolean closed;

    private ExecutionContext(ContextMeta meta) {
        this.meta = meta;
    }

    public static ExecutionContext create(String flowId) {
        return create(flowId, UUID.randomUUID().toString());
    }

    public static ExecutionContext create(String flowId, String executionId) {
        return new ExecutionContext(ContextMeta.builder()
                .flowId(flowId)
                .executionId(executionId)
                .startedAt(Instant.now())
                .status(ExecutionStatus.IDLE)
                .build());
    }

    public synchronized String getExecutionId() {
        return meta.getExecutionId();
    }

    public synchronized String getFlowId() {
        return meta.getFlowId();
    }

    /** Snapshot of the run metadata. */
    public synchronized ContextMeta getMeta() {
        return ContextMeta.builder()
                .flowId(meta.getFlowId())
                .executionId(meta.getExecutionId())
                .startedAt(meta.getStartedAt())
                .completedAt(meta.getCompletedAt())
                .status(meta.getStatus())
                .errorMessage(meta.getErrorMessage())
                .build();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    // ── Run lifecycle ─────────────────────────────────────────────────────────

    public synchronized void markRunStarted() {
        meta.setStatus(ExecutionStatus.RUNNING);
        meta.setStartedAt(Instant.now());
    }

    public synchronized void markRunFinished(ExecutionStatus status, String errorMessage) {
        meta.setStatus(status);
        meta.setCompletedAt(Instant.now());
        if (errorMessage != null) meta.setErrorMessage(errorMessage);
    }

    /**
     * Begins a new run on this context: fresh execution id, node states cleared.
     * Accumulators are kept but become stale and reset on their next access.
     */
    public synchronized String restart() {
        String executionId = UUID.randomUUID().toString();
        meta.setExecutionId(executionId);
        meta.setStartedAt(Instant.now());
        meta.setCompletedAt(null);
        meta.setStatus(ExecutionStatus.IDLE);
        meta.setErrorMessage(null);
        nodes.clear();
        closed = false;
        return executionId;
    }

    /**
     * Ends the context. Nodes still flagged RUNNING are reset to IDLE so no reader keeps
     * trusting a transient flag from an abandoned run.
     */
    public synchronized void teardown() {
        nodes.values().stream()
                .filter(s -> s.getStatus() == NodeStatus.RUNNING)
                .forEach(s -> {
                    log.debug("Execution {}: clearing running flag of node {} on teardown", meta.getExecutionId(), s.getNodeId());
                    s.setStatus(NodeStatus.IDLE);
                    s.setStartedAt(null);
                });
        if (meta.getCompletedAt() == null) meta.setCompletedAt(Instant.now());
        closed = true;
    }

    // ── Global inputs ─────────────────────────────────────────────────────────

    public synchronized void setInputs(List<Object> values) {
        this.inputs = values != null ? new ArrayList<>(values) : new ArrayList<>();
    }

    public synchronized List<Object> getInputs() {
        return Collections.unmodifiableList(new ArrayList<>(inputs));
    }

    // ── Node state transitions ────────────────────────────────────────────────

    public synchronized void markRunning(String nodeId, String nodeType) {
        NodeState state = stateFor(nodeId, nodeType);
        state.setStatus(NodeStatus.RUNNING);
        state.setErrorMessage(null);
        state.setStartedAt(Instant.now());
        state.setCompletedAt(null);
    }

    public synchronized void markSuccess(String nodeId, List<Object> outputs) {
        markSuccess(nodeId, outputs, false);
    }

    /**
     * @param replace when true the given outputs replace everything stored so far,
     *                otherwise they are appended
     */
    public synchronized void markSuccess(String nodeId, List<Object> outputs, boolean replace) {
        NodeState state = stateFor(nodeId, null);
        if (replace) state.getOutputs().clear();
        if (outputs != null) state.getOutputs().addAll(outputs);
        state.setStatus(NodeStatus.SUCCESS);
        state.setCompletedAt(Instant.now());
    }

    public synchronized void markError(String nodeId, String errorMessage) {
        NodeState state = stateFor(nodeId, null);
        state.setStatus(NodeStatus.ERROR);
        state.setErrorMessage(errorMessage);
        state.setCompletedAt(Instant.now());
    }

    public synchronized List<Object> getOutput(String nodeId) {
        NodeState state = nodes.get(nodeId);
        return state != null ? new ArrayList<>(state.getOutputs()) : new ArrayList<>();
    }

    /** Copy of a node's state; an untouched node reads as IDLE. */
    public synchronized NodeState getNodeState(String nodeId) {
        NodeState state = nodes.get(nodeId);
        if (state == null) {
            return NodeState.builder().nodeId(nodeId).build();
        }
        return state.copy();
    }

    public synchronized Map<String, NodeState> getNodes() {
        Map<String, NodeState> copy = new LinkedHashMap<>();
        nodes.forEach((id, state) -> copy.put(id, state.copy()));
        return copy;
    }

    public synchronized boolean hasErrors() {
        return nodes.values().stream().anyMatch(s -> s.getStatus() == NodeStatus.ERROR);
    }

    private NodeState stateFor(String nodeId, String nodeType) {
        NodeState state = nodes.computeIfAbsent(nodeId, id -> NodeState.builder().nodeId(id).build());
        if (nodeType != null) state.setNodeType(nodeType);
        return state;
    }

    // ── Accumulators ──────────────────────────────────────────────────────────

    /**
     * Appends to a node's accumulator and returns the accumulated list.
     * A stored accumulator from another execution is discarded first.
     */
    public synchronized List<Object> accumulate(String nodeId, String executionId, List<Object> additions) {
        AccumulatorState acc = accumulatorFor(nodeId, executionId);
        if (additions != null) acc.getAccumulatedInputs().addAll(additions);
        return new ArrayList<>(acc.getAccumulatedInputs());
    }

    public synchronized List<Object> getAccumulated(String nodeId, String executionId) {
        return new ArrayList<>(accumulatorFor(nodeId, executionId).getAccumulatedInputs());
    }

    private AccumulatorState accumulatorFor(String nodeId, String executionId) {
        AccumulatorState acc = accumulators.get(nodeId);
        if (acc == null) {
            acc = new AccumulatorState(executionId);
            accumulators.put(nodeId, acc);
        } else if (!Objects.equals(acc.getExecutionId(), executionId)) {
            log.debug("Accumulator of node {} belongs to execution {}, resetting for {}",
                    nodeId, acc.getExecutionId(), executionId);
            acc.setExecutionId(executionId);
            acc.getAccumulatedInputs().clear();
        }
        return acc;
    }
}

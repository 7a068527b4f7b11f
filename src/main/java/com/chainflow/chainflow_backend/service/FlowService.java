package com.chainflow.chainflow_backend.service;

import com.chainflow.chainflow_backend.engine.FlowExecutionEngine;
import com.chainflow.chainflow_backend.engine.FlowRunResult;
import com.chainflow.chainflow_backend.exception.ResourceNotFoundException;
import com.chainflow.chainflow_backend.model.context.ExecutionContext;
import com.chainflow.chainflow_backend.model.context.ExecutionStatus;
import com.chainflow.chainflow_backend.model.domain.Flow;
import com.chainflow.chainflow_backend.model.domain.FlowEdge;
import com.chainflow.chainflow_backend.model.domain.FlowNode;
import com.chainflow.chainflow_backend.model.dto.FlowDocumentDto;
import com.chainflow.chainflow_backend.model.dto.FlowEdgeDto;
import com.chainflow.chainflow_backend.model.dto.FlowNodeDto;
import com.chainflow.chainflow_backend.model.graph.FlowGraph;
import com.chainflow.chainflow_backend.repository.FlowRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

@Slf4j
@Service
@RequiredArgsConstructor
public class FlowService {

    private final FlowExecutionEngine engine;
    private final FlowRepository flowRepository;

    /**
     * Stores a flow document. The graph is validated first, so a stored flow always has
     * unique node ids and edges between existing nodes.
     */
    public Flow importFlow(FlowDocumentDto dto) {
        List<FlowNode> nodes = new ArrayList<>();
        for (FlowNodeDto n : dto.nodes()) {
            nodes.add(toFlowNode(n));
        }
        List<FlowEdge> edges = new ArrayList<>();
        for (FlowEdgeDto e : dto.edges()) {
            edges.add(toFlowEdge(e));
        }
        FlowGraph graph = FlowGraph.build(nodes, edges);

        Flow flow = Flow.builder()
                .id(dto.id() != null && !dto.id().isBlank() ? dto.id().trim() : UUID.randomUUID().toString())
                .name(dto.name() != null && !dto.name().isBlank() ? dto.name().trim() : "Untitled flow")
                .nodes(nodes)
                .edges(edges)
                .inputs(new ArrayList<>(dto.inputs()))
                .build();
        log.info("Imported flow {} ({}) with {} nodes, {} roots, {} leaves",
                flow.getId(), flow.getName(), graph.size(), graph.getRoots().size(), graph.getLeaves().size());
        return flowRepository.save(flow);
    }

    public List<Flow> findAll() {
        return flowRepository.findAll();
    }

    public Flow getFlow(String flowId) {
        return flowRepository.findById(flowId)
                .orElseThrow(() -> new ResourceNotFoundException("Flow", flowId));
    }

    /**
     * Runs a flow and blocks until it is done. Empty inputs fall back to the flow's stored inputs.
     */
    public FlowRunResult runFlow(String flowId, List<Object> inputs) {
        Flow flow = getFlow(flowId);
        return execute(flow, inputs, ExecutionContext.create(flowId));
    }

    /**
     * Starts a run in the background and returns its execution id right away, so the caller can
     * subscribe to /topic/execution/{executionId} before events arrive.
     */
    public String triggerFlow(String flowId, List<Object> inputs) {
        Flow flow = getFlow(flowId);
        ExecutionContext context = ExecutionContext.create(flowId);
        CompletableFuture.runAsync(() -> execute(flow, inputs, context))
                .exceptionally(ex -> {
                    log.error("Background run of flow {} failed: {}", flowId, ex.getMessage(), ex);
                    return null;
                });
        return context.getExecutionId();
    }

    private FlowRunResult execute(Flow flow, List<Object> inputs, ExecutionContext context) {
        List<Object> effective = inputs != null && !inputs.isEmpty() ? inputs : flow.getInputs();
        flow.setStatus(ExecutionStatus.RUNNING);
        FlowRunResult result;
        try {
            result = engine.run(flow, effective, context);
        } finally {
            context.teardown();
        }

        flow.setStatus(result.status());
        flow.setLastExecutionId(result.executionId());
        flow.setLastRunAt(Instant.now());
        if (result.isSuccess()) {
            flow.setLastResults(new ArrayList<>(result.results()));
        }
        flowRepository.save(flow);
        return result;
    }

    private static FlowNode toFlowNode(FlowNodeDto dto) {
        return FlowNode.builder()
                .id(dto.id() != null ? dto.id().trim() : null)
                .type(dto.type())
                .data(dto.data() != null ? new LinkedHashMap<>(dto.data()) : new LinkedHashMap<>())
                .position(dto.position())
                .groupMember(dto.isGroupMember())
                .build();
    }

    private static FlowEdge toFlowEdge(FlowEdgeDto dto) {
        return FlowEdge.builder()
                .id(dto.id())
                .source(dto.source() != null ? dto.source().trim() : null)
                .target(dto.target() != null ? dto.target().trim() : null)
                .sourceHandle(dto.sourceHandle() != null && !dto.sourceHandle().isBlank() ? dto.sourceHandle().trim() : null)
                .targetHandle(dto.targetHandle() != null && !dto.targetHandle().isBlank() ? dto.targetHandle().trim() : null)
                .build();
    }
}

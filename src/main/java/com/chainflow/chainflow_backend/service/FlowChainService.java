package com.chainflow.chainflow_backend.service;

import com.chainflow.chainflow_backend.engine.ChainRunResult;
import com.chainflow.chainflow_backend.engine.ExecutionEventPublisher;
import com.chainflow.chainflow_backend.engine.FlowChainExecutor;
import com.chainflow.chainflow_backend.exception.ResourceNotFoundException;
import com.chainflow.chainflow_backend.model.context.ExecutionStatus;
import com.chainflow.chainflow_backend.model.domain.Flow;
import com.chainflow.chainflow_backend.model.domain.FlowChain;
import com.chainflow.chainflow_backend.model.domain.FlowEdge;
import com.chainflow.chainflow_backend.model.domain.FlowNode;
import com.chainflow.chainflow_backend.model.dto.ChainExportBundle;
import com.chainflow.chainflow_backend.model.dto.ChainExportBundle.ChainMeta;
import com.chainflow.chainflow_backend.model.dto.ChainExportBundle.FlowMeta;
import com.chainflow.chainflow_backend.model.dto.CreateChainRequest;
import com.chainflow.chainflow_backend.model.graph.FlowGraph;
import com.chainflow.chainflow_backend.repository.FlowChainRepository;
import com.chainflow.chainflow_backend.repository.FlowRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class FlowChainService {

    private final FlowChainRepository     chainRepository;
    private final FlowRepository          flowRepository;
    private final FlowChainExecutor       chainExecutor;
    private final ExecutionEventPublisher eventPublisher;

    public FlowChain createChain(CreateChainRequest request) {
        List<String> flowIds = request.flowIds() != null ? new ArrayList<>(request.flowIds()) : new ArrayList<>();
        flowIds.forEach(this::requireFlow);
        if (request.selectedFlowId() != null && !flowIds.contains(request.selectedFlowId())) {
            throw new IllegalArgumentException("Selected flow " + request.selectedFlowId() + " is not part of the chain");
        }
        FlowChain chain = FlowChain.builder()
                .id(UUID.randomUUID().toString())
                .name(request.name().trim())
                .flowIds(flowIds)
                .selectedFlowId(request.selectedFlowId())
                .build();
        log.info("Created chain {} ({}) with {} flow(s)", chain.getId(), chain.getName(), flowIds.size());
        return chainRepository.save(chain);
    }

    public List<FlowChain> findAll() {
        return chainRepository.findAll();
    }

    public FlowChain getChain(String chainId) {
        return chainRepository.findById(chainId)
                .orElseThrow(() -> new ResourceNotFoundException("Chain", chainId));
    }

    public void deleteChain(String chainId) {
        if (!chainRepository.deleteById(chainId)) {
            throw new ResourceNotFoundException("Chain", chainId);
        }
    }

    // ── Structure edits ───────────────────────────────────────────────────────

    public FlowChain addFlow(String chainId, String flowId) {
        FlowChain chain = getChain(chainId);
        requireFlow(flowId);
        if (chain.getFlowIds().contains(flowId)) {
            throw new IllegalArgumentException("Flow " + flowId + " is already part of chain " + chainId);
        }
        chain.getFlowIds().add(flowId);
        return chainRepository.save(chain);
    }

    public FlowChain removeFlow(String chainId, String flowId) {
        FlowChain chain = getChain(chainId);
        if (!chain.getFlowIds().remove(flowId)) {
            throw new ResourceNotFoundException("Flow in chain " + chainId, flowId);
        }
        if (flowId.equals(chain.getSelectedFlowId())) {
            chain.setSelectedFlowId(null);
        }
        return chainRepository.save(chain);
    }

    /** The new order must contain exactly the chain's current flows. */
    public FlowChain reorder(String chainId, List<String> flowIds) {
        FlowChain chain = getChain(chainId);
        if (flowIds.size() != chain.getFlowIds().size()
                || !new HashSet<>(flowIds).equals(new HashSet<>(chain.getFlowIds()))) {
            throw new IllegalArgumentException("New order must list exactly the chain's flows: " + chain.getFlowIds());
        }
        chain.setFlowIds(new ArrayList<>(flowIds));
        return chainRepository.save(chain);
    }

    public FlowChain selectResultFlow(String chainId, String flowId) {
        FlowChain chain = getChain(chainId);
        if (!chain.getFlowIds().contains(flowId)) {
            throw new IllegalArgumentException("Flow " + flowId + " is not part of chain " + chainId);
        }
        chain.setSelectedFlowId(flowId);
        return chainRepository.save(chain);
    }

    // ── Execution ─────────────────────────────────────────────────────────────

    public ChainRunResult runChain(String chainId, List<Object> overrideInputs) {
        getChain(chainId);
        return chainExecutor.run(chainId, overrideInputs, new PublishingChainListener(eventPublisher, chainId));
    }

    // ── Export / import ───────────────────────────────────────────────────────

    /**
     * Every chain plus every flow a chain references. Structure-only leaves out inputs and results.
     */
    public ChainExportBundle exportBundle(boolean structureOnly) {
        ChainExportBundle bundle = ChainExportBundle.builder()
                .version(ChainExportBundle.CURRENT_VERSION)
                .build();
        for (FlowChain chain : chainRepository.findAll()) {
            bundle.getChains().put(chain.getId(), ChainMeta.builder()
                    .id(chain.getId())
                    .name(chain.getName())
                    .flowIds(new ArrayList<>(chain.getFlowIds()))
                    .selectedFlowId(chain.getSelectedFlowId())
                    .status(chain.getStatus())
                    .build());
            for (String flowId : chain.getFlowIds()) {
                flowRepository.findById(flowId)
                        .ifPresent(flow -> bundle.getFlows().putIfAbsent(flowId, toMeta(flow, structureOnly)));
            }
        }
        log.info("Exported {} chain(s), {} flow(s){}", bundle.getChains().size(), bundle.getFlows().size(),
                structureOnly ? " (structure only)" : "");
        return bundle;
    }

    /**
     * Loads a bundle, replacing chains and flows with the same ids. Every flow graph is validated
     * before anything is stored.
     */
    public List<FlowChain> importBundle(ChainExportBundle bundle) {
        if (bundle == null || bundle.getVersion() == null || bundle.getVersion().isBlank()) {
            throw new IllegalArgumentException("Bundle version is required");
        }
        if (!ChainExportBundle.CURRENT_VERSION.equals(bundle.getVersion())) {
            log.warn("Importing bundle version {} (current is {})", bundle.getVersion(), ChainExportBundle.CURRENT_VERSION);
        }

        List<Flow> flows = new ArrayList<>();
        Map<String, FlowMeta> flowMetas = bundle.getFlows() != null ? bundle.getFlows() : Map.of();
        flowMetas.forEach((flowId, meta) -> {
            List<FlowNode> nodes = meta.getNodes() != null ? new ArrayList<>(meta.getNodes()) : new ArrayList<>();
            List<FlowEdge> edges = meta.getEdges() != null ? new ArrayList<>(meta.getEdges()) : new ArrayList<>();
            FlowGraph.build(nodes, edges);
            flows.add(Flow.builder()
                    .id(meta.getId() != null ? meta.getId() : flowId)
                    .name(meta.getName())
                    .nodes(nodes)
                    .edges(edges)
                    .inputs(meta.getInputs() != null ? new ArrayList<>(meta.getInputs()) : new ArrayList<>())
                    .lastResults(meta.getLastResults() != null ? new ArrayList<>(meta.getLastResults()) : null)
                    .status(meta.getStatus() != null ? meta.getStatus() : ExecutionStatus.IDLE)
                    .build());
        });
        flows.forEach(flowRepository::save);

        List<FlowChain> chains = new ArrayList<>();
        Map<String, ChainMeta> chainMetas = bundle.getChains() != null ? bundle.getChains() : Map.of();
        chainMetas.forEach((chainId, meta) -> chains.add(chainRepository.save(FlowChain.builder()
                .id(meta.getId() != null ? meta.getId() : chainId)
                .name(meta.getName())
                .flowIds(meta.getFlowIds() != null ? new ArrayList<>(meta.getFlowIds()) : new ArrayList<>())
                .selectedFlowId(meta.getSelectedFlowId())
                .status(ExecutionStatus.IDLE)
                .build())));
        log.info("Imported {} chain(s), {} flow(s)", chains.size(), flows.size());
        return chains;
    }

    private static FlowMeta toMeta(Flow flow, boolean structureOnly) {
        return FlowMeta.builder()
                .id(flow.getId())
                .name(flow.getName())
                .nodes(new ArrayList<>(flow.getNodes()))
                .edges(new ArrayList<>(flow.getEdges()))
                .inputs(structureOnly ? null : new ArrayList<>(flow.getInputs()))
                .lastResults(structureOnly || flow.getLastResults() == null ? null : new ArrayList<>(flow.getLastResults()))
                .status(flow.getStatus())
                .build();
    }

    private void requireFlow(String flowId) {
        if (flowId == null || !flowRepository.existsById(flowId)) {
            throw new ResourceNotFoundException("Flow", flowId);
        }
    }
}

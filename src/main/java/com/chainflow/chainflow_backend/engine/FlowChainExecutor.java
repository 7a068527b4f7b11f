package com.chainflow.chainflow_backend.engine;

import com.chainflow.chainflow_backend.exception.ResourceNotFoundException;
import com.chainflow.chainflow_backend.model.context.ExecutionContext;
import com.chainflow.chainflow_backend.model.context.ExecutionStatus;
import com.chainflow.chainflow_backend.model.domain.Flow;
import com.chainflow.chainflow_backend.model.domain.FlowChain;
import com.chainflow.chainflow_backend.model.domain.NodeResult;
import com.chainflow.chainflow_backend.repository.FlowChainRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs a chain's flows one after another in list order.
 *
 * The first flow takes the caller's override inputs when given, else its stored inputs. A later flow
 * takes the previous flow's result values, unless its stored inputs carry {@code ${flowId.result}}
 * references, which are resolved instead. The first failing flow stops the chain.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FlowChainExecutor {

    private final FlowChainRepository    chainRepository;
    private final FlowExecutionEngine    engine;
    private final ChainReferenceResolver referenceResolver;

    public ChainRunResult run(String chainId, List<Object> overrideInputs, ChainExecutionListener listener) {
        FlowChain chain = chainRepository.findById(chainId)
                .orElseThrow(() -> new ResourceNotFoundException("Chain", chainId));
        ChainExecutionListener callbacks = listener != null ? listener : ChainExecutionListener.NONE;

        chainRepository.setChainStatus(chainId, ExecutionStatus.RUNNING, null);
        callbacks.onChainStart();
        log.info("Chain {} ({}): running {} flow(s)", chainId, chain.getName(), chain.getFlowIds().size());

        try {
            List<NodeResult> previous = null;
            boolean first = true;

            for (String flowId : List.copyOf(chain.getFlowIds())) {
                Optional<Flow> found = chainRepository.getFlow(chainId, flowId);
                if (found.isEmpty()) {
                    log.warn("Chain {}: flow {} not found, skipping", chainId, flowId);
                    continue;
                }
                Flow flow = found.get();

                List<Object> inputs = inputsFor(chainId, flow, first, overrideInputs, previous);
                callbacks.onFlowStart(flowId);
                chainRepository.setFlowStatus(chainId, flowId, ExecutionStatus.RUNNING);

                ExecutionContext context = ExecutionContext.create(flowId);
                FlowRunResult result;
                try {
                    result = engine.run(flow, inputs, context);
                } finally {
                    context.teardown();
                }
                flow.setLastExecutionId(result.executionId());

                if (!result.isSuccess()) {
                    String message = result.errorMessage();
                    log.warn("Chain {}: flow {} failed, stopping chain: {}", chainId, flowId, message);
                    chainRepository.setFlowStatus(chainId, flowId, ExecutionStatus.ERROR);
                    chainRepository.setChainStatus(chainId, ExecutionStatus.ERROR, message);
                    callbacks.onError(flowId, message);
                    return ChainRunResult.failed(chainId, flowId, message);
                }

                chainRepository.setFlowResult(chainId, flowId, result.results());
                chainRepository.setFlowStatus(chainId, flowId, ExecutionStatus.SUCCESS);
                callbacks.onFlowComplete(flowId, result.results());

                previous = result.results();
                first = false;
            }

            List<NodeResult> results = selectedResults(chainId);
            chainRepository.setChainStatus(chainId, ExecutionStatus.SUCCESS, null);
            callbacks.onChainComplete(results);
            log.info("Chain {} completed, {} result(s) from the selected flow", chainId, results.size());
            return ChainRunResult.succeeded(chainId, results);

        } catch (RuntimeException ex) {
            String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.error("Chain {} aborted: {}", chainId, message, ex);
            chainRepository.setChainStatus(chainId, ExecutionStatus.ERROR, message);
            callbacks.onError(null, message);
            return ChainRunResult.failed(chainId, null, message);
        }
    }

    private List<Object> inputsFor(String chainId, Flow flow, boolean first,
                                   List<Object> overrideInputs, List<NodeResult> previous) {
        List<Object> inputs = flow.getInputs() != null ? flow.getInputs() : List.of();
        if (first && overrideInputs != null && !overrideInputs.isEmpty()) {
            inputs = overrideInputs;
        }

        if (referenceResolver.containsReference(inputs)) {
            return referenceResolver.resolveAll(inputs, id -> chainRepository.getFlow(chainId, id));
        }
        if (!first && previous != null) {
            List<Object> forwarded = new ArrayList<>();
            previous.forEach(r -> forwarded.add(r.getResult()));
            log.debug("Chain {}: forwarding {} result(s) into flow {}", chainId, forwarded.size(), flow.getId());
            return forwarded;
        }
        return new ArrayList<>(inputs);
    }

    private List<NodeResult> selectedResults(String chainId) {
        return chainRepository.findById(chainId)
                .map(FlowChain::getSelectedFlowId)
                .flatMap(selected -> chainRepository.getFlow(chainId, selected))
                .map(Flow::getLastResults)
                .map(List::copyOf)
                .orElse(List.of());
    }
}

package com.chainflow.chainflow_backend.executor;

import com.chainflow.chainflow_backend.exception.NodeExecutionException;
import com.chainflow.chainflow_backend.model.context.ExecutionContext;
import com.chainflow.chainflow_backend.model.domain.FlowNode;

import java.util.List;

public interface NodeExecutor {

    /** Type tag this executor serves, as written in flow documents. */
    String supportedType();

    /**
     * Runs the node once.
     *
     * @param inputs values delivered on the incoming edges in edge order; for a root node, the run's input batch
     * @return the output to deliver downstream; null means "nothing to deliver yet".
     *         A {@code FanOut} is delivered item by item, a {@code RoutedOutput} only along its handle.
     */
    Object execute(FlowNode node, List<Object> inputs, ExecutionContext context) throws NodeExecutionException;

    /**
     * How many incoming edges must hold a value before the node fires.
     * Default: all of them.
     */
    default int arity(FlowNode node, int incomingEdges) {
        return incomingEdges;
    }

    /** True when each output supersedes the previous ones instead of adding to them. */
    default boolean replacesOutputs() {
        return false;
    }
}

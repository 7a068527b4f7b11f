package com.chainflow.chainflow_backend.model.domain;

import com.chainflow.chainflow_backend.model.context.ExecutionStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Flow {

    private String id;
    private String name;

    @Builder.Default
    private List<FlowNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<FlowEdge> edges = new ArrayList<>();

    /** Stored inputs for the next run. Strings may carry ${flowId.result} placeholders. */
    @Builder.Default
    private List<Object> inputs = new ArrayList<>();

    /** Leaf results of the last successful run; null until the flow has run once. */
    private List<NodeResult> lastResults;

    @Builder.Default
    private ExecutionStatus status = ExecutionStatus.IDLE;

    private String lastExecutionId;
    private Instant lastRunAt;

    /**
     * The flow's stored result as a single value: the lone leaf's result when there is exactly
     * one, otherwise the list of every leaf's result. Null when the flow never ran.
     */
    @JsonIgnore
    public Object getResultValue() {
        if (lastResults == null) return null;
        if (lastResults.size() == 1) return lastResults.get(0).getResult();
        List<Object> values = new ArrayList<>();
        lastResults.forEach(r -> values.add(r.getResult()));
        return values;
    }

    @JsonIgnore
    public boolean hasStoredResult() {
        return lastResults != null;
    }
}

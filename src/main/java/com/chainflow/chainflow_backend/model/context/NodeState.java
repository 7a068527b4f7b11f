package com.chainflow.chainflow_backend.model.context;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NodeState {
    private String nodeId;
    private String nodeType;

    @Builder.Default
    private NodeStatus status = NodeStatus.IDLE;

    // Every value the node produced in this run, in production order
    @Builder.Default
    private List<Object> outputs = new ArrayList<>();

    private String errorMessage;
    private Instant startedAt;
    private Instant completedAt;

    NodeState copy() {
        return toBuilder().outputs(new ArrayList<>(outputs)).build();
    }
}

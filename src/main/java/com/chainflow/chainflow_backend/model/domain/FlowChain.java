package com.chainflow.chainflow_backend.model.domain;

import com.chainflow.chainflow_backend.model.context.ExecutionStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FlowChain {

    private String id;
    private String name;

    // Execution order
    @Builder.Default
    private List<String> flowIds = new ArrayList<>();

    // Whose lastResults become the chain's result
    private String selectedFlowId;

    @Builder.Default
    private ExecutionStatus status = ExecutionStatus.IDLE;

    private String errorMessage;
}

package com.chainflow.chainflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FlowEdge {
    private String id;
    private String source;
    private String target;

    // Named handles for multi-output nodes (conditional true/false)
    private String sourceHandle;
    private String targetHandle;
}

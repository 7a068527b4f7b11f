package com.chainflow.chainflow_backend.model.dto;

import com.chainflow.chainflow_backend.model.context.ExecutionStatus;
import com.chainflow.chainflow_backend.model.domain.FlowEdge;
import com.chainflow.chainflow_backend.model.domain.FlowNode;
import com.chainflow.chainflow_backend.model.domain.NodeResult;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Portable snapshot of chains and the flows they reference.
 * A structure-only export leaves out every flow's inputs and last results.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChainExportBundle {

    public static final String CURRENT_VERSION = "1.0";

    private String version;

    @Builder.Default
    private Map<String, ChainMeta> chains = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, FlowMeta> flows = new LinkedHashMap<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChainMeta {
        private String id;
        private String name;
        @Builder.Default
        private List<String> flowIds = new ArrayList<>();
        private String selectedFlowId;
        private ExecutionStatus status;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FlowMeta {
        private String id;
        private String name;
        @Builder.Default
        private List<FlowNode> nodes = new ArrayList<>();
        @Builder.Default
        private List<FlowEdge> edges = new ArrayList<>();
        private List<Object> inputs;
        private List<NodeResult> lastResults;
        private ExecutionStatus status;
    }
}

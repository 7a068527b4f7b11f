package com.chainflow.chainflow_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.List;

/**
 * Request body for POST /api/flows: one flow document.
 * Null-safe: null lists are treated as empty. A missing id is assigned on import.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FlowDocumentDto(
    String id,
    String name,
    List<FlowNodeDto> nodes,
    List<FlowEdgeDto> edges,
    List<Object> inputs
) {
    public List<FlowNodeDto> nodes() {
        return nodes != null ? nodes : Collections.emptyList();
    }

    public List<FlowEdgeDto> edges() {
        return edges != null ? edges : Collections.emptyList();
    }

    public List<Object> inputs() {
        return inputs != null ? inputs : Collections.emptyList();
    }
}

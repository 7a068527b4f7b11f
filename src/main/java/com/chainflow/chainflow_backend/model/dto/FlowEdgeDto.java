package com.chainflow.chainflow_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FlowEdgeDto(
    String id,
    String source,
    String target,
    String sourceHandle,
    String targetHandle
) {}

package com.chainflow.chainflow_backend.model.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record CreateChainRequest(
    @NotBlank(message = "name is required") String name,
    List<String> flowIds,
    String selectedFlowId
) {}

package com.chainflow.chainflow_backend.model.dto;

import jakarta.validation.constraints.NotBlank;

/** Names one flow: to add to a chain, or to select as the chain's result. */
public record ChainFlowRequest(@NotBlank(message = "flowId is required") String flowId) {}

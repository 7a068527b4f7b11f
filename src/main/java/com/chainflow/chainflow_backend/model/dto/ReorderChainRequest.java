package com.chainflow.chainflow_backend.model.dto;

import jakarta.validation.constraints.NotNull;

import java.util.List;

/** New execution order; must be a permutation of the chain's current flow ids. */
public record ReorderChainRequest(@NotNull(message = "flowIds are required") List<String> flowIds) {}

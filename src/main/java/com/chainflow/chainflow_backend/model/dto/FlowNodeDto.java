package com.chainflow.chainflow_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Node as the editor writes it. Group membership is explicit ({@code groupMember}) or implied by
 * {@code parentNode} / {@code parentId}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FlowNodeDto(
    String id,
    String type,
    Map<String, Object> data,
    Map<String, Object> position,
    String parentNode,
    String parentId,
    Boolean groupMember
) {
    public boolean isGroupMember() {
        if (groupMember != null) return groupMember;
        return (parentNode != null && !parentNode.isBlank()) || (parentId != null && !parentId.isBlank());
    }
}

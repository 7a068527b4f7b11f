package com.chainflow.chainflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FlowNode {

    private String id;

    // Type tag, e.g. "merger" or "web-crawler"
    private String type;

    // Opaque per-type configuration; overlaid by the node content store at run time
    @Builder.Default
    private Map<String, Object> data = new LinkedHashMap<>();

    private Map<String, Object> position;

    // Explicit group membership. Members are never leaves.
    private boolean groupMember;

    @JsonIgnore
    public String getLabel() {
        Object label = data != null ? data.get("label") : null;
        return label instanceof String s && !s.isBlank() ? s : null;
    }

    /** Label, else type, else id. */
    @JsonIgnore
    public String getDisplayName() {
        if (getLabel() != null) return getLabel();
        if (type != null && !type.isBlank()) return type;
        return id;
    }
}

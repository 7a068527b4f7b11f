package com.chainflow.chainflow_backend.model.dto;

import java.util.Collections;
import java.util.List;

/** Body of the run endpoints. Empty inputs mean "use the stored ones". */
public record RunRequest(List<Object> inputs) {

    public List<Object> inputs() {
        return inputs != null ? inputs : Collections.emptyList();
    }
}

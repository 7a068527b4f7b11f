package com.chainflow.chainflow_backend.model.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node output that is delivered downstream one item at a time,
 * so each item triggers its own activation of the child nodes.
 */
public record FanOut(List<Object> items) {

    public FanOut {
        items = items != null ? Collections.unmodifiableList(new ArrayList<>(items)) : List.of();
    }
}

package com.chainflow.chainflow_backend.repository;

import java.util.Map;

/**
 * Per-node content the editor keeps outside the flow document (url, headers, prompt, mode ...).
 * The engine reads it as node configuration and writes to it only to publish Output-node display text.
 */
public interface NodeContentStore {

    /** Content for the node, empty when none is stored. */
    Map<String, Object> getContent(String nodeId);

    void putContent(String nodeId, Map<String, Object> content);

    /** Merges the given entries into the node's content. */
    void publishContent(String nodeId, Map<String, Object> content);

    void removeContent(String nodeId);
}

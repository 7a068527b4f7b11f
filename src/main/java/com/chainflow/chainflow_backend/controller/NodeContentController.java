package com.chainflow.chainflow_backend.controller;

import com.chainflow.chainflow_backend.repository.NodeContentStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/** Editor-side node content (url, headers, prompt ...) and the display text Output nodes publish. */
@RestController
@RequestMapping("/api/nodes/{nodeId}/content")
@RequiredArgsConstructor
public class NodeContentController {

    private final NodeContentStore contentStore;

    @GetMapping
    public Map<String, Object> getContent(@PathVariable String nodeId) {
        return contentStore.getContent(nodeId);
    }

    @PutMapping
    public Map<String, Object> putContent(@PathVariable String nodeId, @RequestBody Map<String, Object> content) {
        contentStore.putContent(nodeId, content);
        return contentStore.getContent(nodeId);
    }

    @DeleteMapping
    public ResponseEntity<Void> removeContent(@PathVariable String nodeId) {
        contentStore.removeContent(nodeId);
        return ResponseEntity.noContent().build();
    }
}

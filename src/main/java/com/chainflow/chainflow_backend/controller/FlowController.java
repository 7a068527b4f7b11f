package com.chainflow.chainflow_backend.controller;

import com.chainflow.chainflow_backend.engine.FlowRunResult;
import com.chainflow.chainflow_backend.model.domain.Flow;
import com.chainflow.chainflow_backend.model.dto.FlowDocumentDto;
import com.chainflow.chainflow_backend.model.dto.RunRequest;
import com.chainflow.chainflow_backend.service.FlowService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/flows")
@RequiredArgsConstructor
public class FlowController {

    private final FlowService flowService;

    // Import a whole flow document: nodes + edges + stored inputs in one shot
    @PostMapping
    public ResponseEntity<Flow> importFlow(@RequestBody FlowDocumentDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(flowService.importFlow(dto));
    }

    @GetMapping
    public List<Flow> getAllFlows() {
        return flowService.findAll();
    }

    @GetMapping("/{flowId}")
    public Flow getFlow(@PathVariable String flowId) {
        return flowService.getFlow(flowId);
    }

    // Blocks until the run is done; node events still go out on /topic/execution/{executionId}
    @PostMapping("/{flowId}/run")
    public FlowRunResult runFlow(@PathVariable String flowId,
                                 @RequestBody(required = false) RunRequest request) {
        return flowService.runFlow(flowId, request != null ? request.inputs() : List.of());
    }

    @PostMapping("/{flowId}/trigger")
    public ResponseEntity<Map<String, String>> triggerFlow(@PathVariable String flowId,
                                                           @RequestBody(required = false) RunRequest request) {
        String executionId = flowService.triggerFlow(flowId, request != null ? request.inputs() : List.of());
        return ResponseEntity.accepted().body(Map.of(
                "executionId", executionId,
                "topic", "/topic/execution/" + executionId));
    }
}

package com.chainflow.chainflow_backend.controller;

import com.chainflow.chainflow_backend.engine.ChainRunResult;
import com.chainflow.chainflow_backend.model.domain.FlowChain;
import com.chainflow.chainflow_backend.model.dto.ChainExportBundle;
import com.chainflow.chainflow_backend.model.dto.ChainFlowRequest;
import com.chainflow.chainflow_backend.model.dto.CreateChainRequest;
import com.chainflow.chainflow_backend.model.dto.ReorderChainRequest;
import com.chainflow.chainflow_backend.model.dto.RunRequest;
import com.chainflow.chainflow_backend.service.FlowChainService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/chains")
@RequiredArgsConstructor
public class ChainController {

    private final FlowChainService chainService;

    @PostMapping
    public ResponseEntity<FlowChain> createChain(@Valid @RequestBody CreateChainRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(chainService.createChain(request));
    }

    @GetMapping
    public List<FlowChain> getAllChains() {
        return chainService.findAll();
    }

    // Literal paths first so "export" never binds as a chain id
    @GetMapping("/export")
    public ResponseEntity<ChainExportBundle> exportChains(
            @RequestParam(defaultValue = "false") boolean structureOnly) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"chains-export.json\"")
                .body(chainService.exportBundle(structureOnly));
    }

    @PostMapping("/import")
    public List<FlowChain> importChains(@RequestBody ChainExportBundle bundle) {
        return chainService.importBundle(bundle);
    }

    @GetMapping("/{chainId}")
    public FlowChain getChain(@PathVariable String chainId) {
        return chainService.getChain(chainId);
    }

    @DeleteMapping("/{chainId}")
    public ResponseEntity<Void> deleteChain(@PathVariable String chainId) {
        chainService.deleteChain(chainId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{chainId}/flows")
    public FlowChain addFlow(@PathVariable String chainId, @Valid @RequestBody ChainFlowRequest request) {
        return chainService.addFlow(chainId, request.flowId());
    }

    @DeleteMapping("/{chainId}/flows/{flowId}")
    public FlowChain removeFlow(@PathVariable String chainId, @PathVariable String flowId) {
        return chainService.removeFlow(chainId, flowId);
    }

    @PutMapping("/{chainId}/order")
    public FlowChain reorder(@PathVariable String chainId, @Valid @RequestBody ReorderChainRequest request) {
        return chainService.reorder(chainId, request.flowIds());
    }

    @PutMapping("/{chainId}/selected")
    public FlowChain selectResultFlow(@PathVariable String chainId, @Valid @RequestBody ChainFlowRequest request) {
        return chainService.selectResultFlow(chainId, request.flowId());
    }

    // Progress goes out on /topic/chain/{chainId}; the response carries the selected flow's results
    @PostMapping("/{chainId}/run")
    public ChainRunResult runChain(@PathVariable String chainId,
                                   @RequestBody(required = false) RunRequest request) {
        return chainService.runChain(chainId, request != null ? request.inputs() : List.of());
    }
}

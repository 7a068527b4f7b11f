package com.chainflow.chainflow_backend.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Smoke tests for the REST surface, backed by the in-memory stores.
 */
@SpringBootTest
@AutoConfigureMockMvc
class ChainflowBackendSmokeTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void contextLoads() {
        // Context loads successfully
    }

    @Test
    void importAndRunFlow_returnsOutputNodeResult() throws Exception {
        Map<String, Object> document = Map.of(
                "id", "smoke-flow",
                "name", "Smoke",
                "nodes", List.of(
                        Map.of("id", "in", "type", "input", "data", Map.of()),
                        Map.of("id", "out", "type", "output", "data", Map.of("format", "text"))),
                "edges", List.of(Map.of("id", "e1", "source", "in", "target", "out")),
                "inputs", List.of("hello"));

        mockMvc.perform(post("/api/flows")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(document)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("smoke-flow"));

        mockMvc.perform(post("/api/flows/smoke-flow/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SUCCESS"))
                .andExpect(jsonPath("$.results[0].nodeId").value("out"))
                .andExpect(jsonPath("$.results[0].result").value("[\"hello\"]"));

        mockMvc.perform(get("/api/nodes/out/content"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content").value("[\"hello\"]"));
    }

    @Test
    void importFlow_withDanglingEdge_returns400() throws Exception {
        Map<String, Object> document = Map.of(
                "nodes", List.of(Map.of("id", "a", "type", "input")),
                "edges", List.of(Map.of("source", "a", "target", "missing")));

        mockMvc.perform(post("/api/flows")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(document)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("INVALID_FLOW"));
    }

    @Test
    void createChain_withoutName_returns400() throws Exception {
        mockMvc.perform(post("/api/chains")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"flowIds\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void getChain_unknownId_returns404() throws Exception {
        mockMvc.perform(get("/api/chains/does-not-exist"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }

    @Test
    void exportChains_returnsVersionedBundle() throws Exception {
        mockMvc.perform(get("/api/chains/export").param("structureOnly", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value("1.0"))
                .andExpect(jsonPath("$.chains").isMap());
    }
}

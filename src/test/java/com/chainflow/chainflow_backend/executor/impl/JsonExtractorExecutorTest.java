package com.chainflow.chainflow_backend.executor.impl;

import com.chainflow.chainflow_backend.exception.NodeExecutionException;
import com.chainflow.chainflow_backend.executor.NodeConfigResolver;
import com.chainflow.chainflow_backend.executor.TemplateResolver;
import com.chainflow.chainflow_backend.model.context.ExecutionContext;
import com.chainflow.chainflow_backend.model.domain.FlowNode;
import com.chainflow.chainflow_backend.repository.InMemoryNodeContentStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonExtractorExecutorTest {

    private JsonExtractorExecutor extractor;
    private final ExecutionContext context = ExecutionContext.create("f");

    @BeforeEach
    void setUp() {
        extractor = new JsonExtractorExecutor(new NodeConfigResolver(new InMemoryNodeContentStore()),
                new TemplateResolver(new ObjectMapper()));
    }

    private static FlowNode withPath(String path) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (path != null) data.put("path", path);
        return FlowNode.builder().id("j").type("json-extractor").data(data).build();
    }

    @Test
    void shouldExtractFromParsedJsonText() throws Exception {
        Object value = extractor.execute(withPath("$.items[1].name"),
                List.of("{\"items\":[{\"name\":\"a\"},{\"name\":\"b\"}]}"), context);

        assertThat(value).isEqualTo("b");
    }

    @Test
    void shouldAcceptDottedIndexPaths() throws Exception {
        Object value = extractor.execute(withPath("items.0"), List.of(Map.of("items", List.of(7, 8))), context);

        assertThat(value).isEqualTo(7);
    }

    @Test
    void shouldReturnNullWhenNothingMatches() throws Exception {
        assertThat(extractor.execute(withPath("missing.key"), List.of(Map.of("a", 1)), context)).isNull();
    }

    @Test
    void shouldFailWithoutPath() {
        assertThatThrownBy(() -> extractor.execute(withPath(null), List.of(Map.of()), context))
                .isInstanceOf(NodeExecutionException.class)
                .hasMessageContaining("no path");
    }

    @Test
    void shouldFailWithoutInput() {
        assertThatThrownBy(() -> extractor.execute(withPath("a"), Arrays.asList((Object) null), context))
                .isInstanceOf(NodeExecutionException.class);
    }
}

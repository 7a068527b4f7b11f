package com.chainflow.chainflow_backend.executor.impl;

import com.chainflow.chainflow_backend.config.EngineProperties;
import com.chainflow.chainflow_backend.exception.NodeExecutionException;
import com.chainflow.chainflow_backend.executor.NodeConfigResolver;
import com.chainflow.chainflow_backend.executor.TemplateResolver;
import com.chainflow.chainflow_backend.executor.capability.CrawlRequest;
import com.chainflow.chainflow_backend.executor.capability.CrawlResult;
import com.chainflow.chainflow_backend.executor.capability.WebCrawler;
import com.chainflow.chainflow_backend.model.context.ExecutionContext;
import com.chainflow.chainflow_backend.model.domain.FlowNode;
import com.chainflow.chainflow_backend.repository.InMemoryNodeContentStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebCrawlerExecutorTest {

    private WebCrawler crawler;
    private WebCrawlerExecutor executor;
    private final ExecutionContext context = ExecutionContext.create("f");

    @BeforeEach
    void setUp() {
        crawler = mock(WebCrawler.class);
        executor = new WebCrawlerExecutor(new NodeConfigResolver(new InMemoryNodeContentStore()),
                new TemplateResolver(new ObjectMapper()), crawler, new EngineProperties());
    }

    private static FlowNode crawlerNode(Map<String, Object> data) {
        return FlowNode.builder().id("wc").type("web-crawler").data(new LinkedHashMap<>(data)).build();
    }

    private static CrawlResult page(String url) {
        return new CrawlResult(url, "Title", "Body text", "<p>Body</p>", Map.of("price", "9.99"), "success", null);
    }

    @Test
    void shouldPreferStringInputOverConfiguredUrl() throws Exception {
        when(crawler.crawl(any())).thenReturn(page("https://input.example.com"));
        FlowNode node = crawlerNode(Map.of(
                "url", "https://config.example.com",
                "extractSelectors", Map.of("price", ".price"),
                "outputFormat", "text"));

        Object output = executor.execute(node, List.of("https://input.example.com"), context);

        ArgumentCaptor<CrawlRequest> request = ArgumentCaptor.forClass(CrawlRequest.class);
        verify(crawler).crawl(request.capture());
        assertThat(request.getValue().url()).isEqualTo("https://input.example.com");
        assertThat(request.getValue().extractSelectors()).containsEntry("price", ".price");
        assertThat(request.getValue().timeout()).isEqualTo(30_000);
        assertThat(output).isEqualTo("Body text");
    }

    @Test
    void shouldReturnExtractedDataOnly() throws Exception {
        when(crawler.crawl(any())).thenReturn(page("https://shop.example.com"));

        Object output = executor.execute(crawlerNode(Map.of("outputFormat", "extracted")),
                List.of(Map.of("url", "https://shop.example.com")), context);

        assertThat(output).isEqualTo(Map.of("price", "9.99"));
    }

    @Test
    void shouldReturnFullResultByDefault() throws Exception {
        when(crawler.crawl(any())).thenReturn(page("https://a.example.com"));

        Object output = executor.execute(crawlerNode(Map.of("url", "https://a.example.com")), List.of(), context);

        assertThat(output).isInstanceOf(Map.class);
        @SuppressWarnings("unchecked")
        Map<String, Object> page = (Map<String, Object>) output;
        assertThat(page).containsEntry("title", "Title").containsKey("extractedData");
    }

    @Test
    void shouldFailOnCrawlerErrorStatus() {
        when(crawler.crawl(any())).thenReturn(CrawlResult.error("https://a.example.com", "selector not found"));

        assertThatThrownBy(() -> executor.execute(crawlerNode(Map.of("url", "https://a.example.com")), List.of(), context))
                .isInstanceOf(NodeExecutionException.class)
                .hasMessage("Crawler error: selector not found");
    }

    @Test
    void shouldFailWithoutAnyUrl() {
        assertThatThrownBy(() -> executor.execute(crawlerNode(Map.of()), List.of(), context))
                .isInstanceOf(NodeExecutionException.class)
                .hasMessageContaining("No URL provided");
    }
}

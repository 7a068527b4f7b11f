package com.chainflow.chainflow_backend.executor.capability;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Body posted to the crawler service. Field names follow the service's snake_case contract.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CrawlRequest(
        String url,
        @JsonProperty("wait_for_selector") String waitForSelector,
        @JsonProperty("iframe_selector") String iframeSelector,
        @JsonProperty("extract_element_selector") String extractElementSelector,
        @JsonProperty("extract_selectors") Map<String, String> extractSelectors,
        int timeout,
        Map<String, String> headers,
        @JsonProperty("include_html") boolean includeHtml) {
}

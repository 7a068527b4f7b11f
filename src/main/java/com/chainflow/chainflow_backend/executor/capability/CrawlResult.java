package com.chainflow.chainflow_backend.executor.capability;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CrawlResult(
        String url,
        String title,
        String text,
        String html,
        @JsonProperty("extracted_data") Map<String, Object> extractedData,
        String status,
        String error) {

    public static CrawlResult error(String url, String message) {
        return new CrawlResult(url, null, null, null, null, "error", message);
    }

    public boolean isError() {
        return "error".equalsIgnoreCase(status);
    }
}

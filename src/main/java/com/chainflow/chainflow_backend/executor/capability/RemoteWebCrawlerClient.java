package com.chainflow.chainflow_backend.executor.capability;

import com.chainflow.chainflow_backend.config.EngineProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;

import java.time.Duration;

/**
 * {@link WebCrawler} backed by the headless-browser crawler service at {@code chainflow.crawler.endpoint}.
 * The client waits for the request's timeout plus {@code chainflow.crawler.timeout-margin-ms}, so the
 * service gets to report its own timeout first.
 */
@Slf4j
@Component
public class RemoteWebCrawlerClient implements WebCrawler {

    private final TimeoutRestTemplates templates;
    private final EngineProperties     properties;
    private final ObjectMapper         objectMapper;

    public RemoteWebCrawlerClient(RestTemplateBuilder builder, EngineProperties properties, ObjectMapper objectMapper) {
        this.templates    = new TimeoutRestTemplates(builder);
        this.properties   = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public CrawlResult crawl(CrawlRequest request) {
        String endpoint = properties.getCrawler().getEndpoint();
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        Duration readTimeout = Duration.ofMillis(request.timeout())
                .plusMillis(properties.getCrawler().getTimeoutMarginMs());

        try {
            CrawlResult result = templates.forTimeout(readTimeout).postForObject(endpoint, new HttpEntity<>(request, headers), CrawlResult.class);
            if (result == null) {
                return CrawlResult.error(request.url(), "Crawler returned an empty response");
            }
            return result;

        } catch (HttpStatusCodeException ex) {
            log.warn("Crawler service answered {} for {}", ex.getStatusCode().value(), request.url());
            return CrawlResult.error(request.url(), errorFrom(ex));
        }
    }

    private String errorFrom(HttpStatusCodeException ex) {
        String body = ex.getResponseBodyAsString();
        try {
            CrawlResult parsed = objectMapper.readValue(body, CrawlResult.class);
            if (parsed.error() != null) return parsed.error();
        } catch (JsonProcessingException e) {
            log.debug("Crawler error body is not JSON: {}", e.getOriginalMessage());
        }
        return "HTTP " + ex.getStatusCode().value() + (body.isBlank() ? "" : ": " + truncate(body, 200));
    }

    private static String truncate(String s, int max) {
        return s.length() > max ? s.substring(0, max) + "..." : s;
    }
}

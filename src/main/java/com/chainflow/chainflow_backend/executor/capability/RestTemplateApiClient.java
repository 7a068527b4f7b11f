package com.chainflow.chainflow_backend.executor.capability;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link ApiClient} on RestTemplate. Templates are shared per timeout through {@link TimeoutRestTemplates}.
 */
@Slf4j
@Component
public class RestTemplateApiClient implements ApiClient {

    private final TimeoutRestTemplates templates;

    public RestTemplateApiClient(RestTemplateBuilder builder) {
        this.templates = new TimeoutRestTemplates(builder);
    }

    @Override
    public ApiCallResponse call(ApiCallRequest request) {
        RestTemplate restTemplate = templates.forTimeout(Duration.ofMillis(request.timeoutMs()));

        HttpHeaders httpHeaders = new HttpHeaders();
        request.headers().forEach(httpHeaders::set);
        if (request.body() != null && httpHeaders.getContentType() == null) {
            httpHeaders.setContentType(MediaType.APPLICATION_JSON);
        }

        HttpMethod method = HttpMethod.valueOf(request.method().toUpperCase());
        HttpEntity<String> entity = new HttpEntity<>(request.body(), httpHeaders);

        long start = System.currentTimeMillis();
        try {
            ResponseEntity<String> response = restTemplate.exchange(request.url(), method, entity, String.class);
            long duration = System.currentTimeMillis() - start;
            log.debug("{} {} -> {} in {} ms", method, request.url(), response.getStatusCode().value(), duration);
            return new ApiCallResponse(response.getStatusCode().value(), response.getBody(),
                    flatten(response.getHeaders()), duration);

        } catch (HttpStatusCodeException ex) {
            long duration = System.currentTimeMillis() - start;
            log.debug("{} {} -> {} in {} ms", method, request.url(), ex.getStatusCode().value(), duration);
            return new ApiCallResponse(ex.getStatusCode().value(), ex.getResponseBodyAsString(),
                    flatten(ex.getResponseHeaders()), duration);
        }
    }

    private static Map<String, String> flatten(HttpHeaders headers) {
        return headers != null ? new LinkedHashMap<>(headers.toSingleValueMap()) : Map.of();
    }
}

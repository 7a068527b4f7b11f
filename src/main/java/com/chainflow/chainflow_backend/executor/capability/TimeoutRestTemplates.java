package com.chainflow.chainflow_backend.executor.capability;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * RestTemplates keyed by read timeout. Timeouts are rounded up to whole seconds and only the
 * most recently used {@value #MAX_TEMPLATES} templates are kept.
 */
public class TimeoutRestTemplates {

    static final int MAX_TEMPLATES = 16;

    private static final Duration MAX_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final RestTemplateBuilder builder;

    private final Map<Long, RestTemplate> templates = Collections.synchronizedMap(
            new LinkedHashMap<>(MAX_TEMPLATES, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<Long, RestTemplate> eldest) {
                    return size() > MAX_TEMPLATES;
                }
            });

    public TimeoutRestTemplates(RestTemplateBuilder builder) {
        this.builder = builder;
    }

    public RestTemplate forTimeout(Duration readTimeout) {
        return templates.computeIfAbsent(bucketSeconds(readTimeout), this::build);
    }

    int size() {
        return templates.size();
    }

    static long bucketSeconds(Duration timeout) {
        long millis = Math.max(timeout.toMillis(), 1);
        return (millis + 999) / 1000;
    }

    private RestTemplate build(long seconds) {
        Duration readTimeout = Duration.ofSeconds(seconds);
        Duration connectTimeout = readTimeout.compareTo(MAX_CONNECT_TIMEOUT) < 0 ? readTimeout : MAX_CONNECT_TIMEOUT;
        return builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }
}

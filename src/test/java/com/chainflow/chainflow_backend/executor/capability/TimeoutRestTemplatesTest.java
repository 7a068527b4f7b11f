package com.chainflow.chainflow_backend.executor.capability;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TimeoutRestTemplatesTest {

    private TimeoutRestTemplates templates;

    @BeforeEach
    void setUp() {
        templates = new TimeoutRestTemplates(new RestTemplateBuilder());
    }

    @Nested
    class Buckets {

        @Test
        void shouldRoundUpToWholeSeconds() {
            assertThat(TimeoutRestTemplates.bucketSeconds(Duration.ofMillis(1))).isEqualTo(1);
            assertThat(TimeoutRestTemplates.bucketSeconds(Duration.ofMillis(1000))).isEqualTo(1);
            assertThat(TimeoutRestTemplates.bucketSeconds(Duration.ofMillis(1001))).isEqualTo(2);
            assertThat(TimeoutRestTemplates.bucketSeconds(Duration.ZERO)).isEqualTo(1);
        }

        @Test
        void shouldShareTemplateWithinOneSecond() {
            RestTemplate first = templates.forTimeout(Duration.ofMillis(29_400));
            RestTemplate second = templates.forTimeout(Duration.ofMillis(29_900));

            assertThat(second).isSameAs(first);
            assertThat(templates.size()).isEqualTo(1);
        }
    }

    @Nested
    class Eviction {

        @Test
        void shouldKeepAtMostTheConfiguredNumberOfTemplates() {
            // Given more distinct timeouts than the cache holds
            for (int seconds = 1; seconds <= TimeoutRestTemplates.MAX_TEMPLATES + 10; seconds++) {
                templates.forTimeout(Duration.ofSeconds(seconds));
            }

            // Then
            assertThat(templates.size()).isEqualTo(TimeoutRestTemplates.MAX_TEMPLATES);
        }

        @Test
        void shouldEvictLeastRecentlyUsedTemplate() {
            RestTemplate kept = templates.forTimeout(Duration.ofSeconds(1));
            RestTemplate dropped = templates.forTimeout(Duration.ofSeconds(2));
            for (int seconds = 3; seconds <= TimeoutRestTemplates.MAX_TEMPLATES + 1; seconds++) {
                templates.forTimeout(Duration.ofSeconds(1));
                templates.forTimeout(Duration.ofSeconds(seconds));
            }

            assertThat(templates.forTimeout(Duration.ofSeconds(1))).isSameAs(kept);
            assertThat(templates.forTimeout(Duration.ofSeconds(2))).isNotSameAs(dropped);
        }
    }
}

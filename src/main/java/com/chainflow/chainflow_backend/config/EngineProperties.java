package com.chainflow.chainflow_backend.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Engine and capability-provider settings, bound from {@code chainflow.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "chainflow")
public class EngineProperties {

    private Engine engine = new Engine();

    private Http http = new Http();

    private Crawler crawler = new Crawler();

    private Llm llm = new Llm();

    @Getter
    @Setter
    public static class Engine {

        /**
         * Worker threads that run node branches.
         */
        private int corePoolSize = 8;

        private int maxPoolSize = 32;

        private int queueCapacity = 500;

        /**
         * Hard cap on node firings per run; a run that reaches it stops scheduling and ends in error.
         */
        private int maxNodeExecutions = 5_000;
    }

    @Getter
    @Setter
    public static class Http {

        /**
         * Default timeout of API nodes when the node does not configure one.
         */
        private int defaultTimeoutMs = 30_000;
    }

    @Getter
    @Setter
    public static class Crawler {

        /**
         * Remote crawler service that renders pages and runs the selectors.
         */
        private String endpoint = "http://localhost:8000/api/web-crawler/fetch";

        private int defaultTimeoutMs = 30_000;

        /**
         * Added to a node's timeout for the client-side read timeout.
         */
        private int timeoutMarginMs = 5_000;
    }

    @Getter
    @Setter
    public static class Llm {

        private String ollamaUrl = "http://localhost:11434";

        private String openaiApiKey;

        private double defaultTemperature = 0.7;

        private int timeoutSeconds = 120;
    }
}

package com.chainflow.chainflow_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Flow and flow-chain execution service.
 *
 * Imports flow documents, runs them node by node with live state events over STOMP,
 * and runs ordered chains of flows that forward results from one flow to the next.
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.chainflow.chainflow_backend.config")
public class ChainflowBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChainflowBackendApplication.class, args);
    }
}

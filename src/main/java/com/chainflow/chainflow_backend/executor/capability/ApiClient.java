package com.chainflow.chainflow_backend.executor.capability;

import org.springframework.web.client.ResourceAccessException;

/**
 * HTTP capability used by API nodes.
 */
public interface ApiClient {

    /**
     * Performs the call. Every HTTP status, including 4xx and 5xx, comes back as a response.
     *
     * @throws ResourceAccessException when the request never produced a response (connection refused, timeout)
     */
    ApiCallResponse call(ApiCallRequest request);
}

package com.chainflow.chainflow_backend.engine;

import com.chainflow.chainflow_backend.model.context.ExecutionStatus;
import com.chainflow.chainflow_backend.model.context.NodeStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pushes run progress to STOMP subscribers. Delivery is best effort: a broker failure is logged,
 * never allowed to fail the run.
 */
@Slf4j
@Component
public class ExecutionEventPublisher {

    // The executor UI subscribes to /topic/execution/{executionId} for node updates
    static final String EXECUTION_TOPIC = "/topic/execution/";
    // and to /topic/chain/{chainId} for chain progress
    static final String CHAIN_TOPIC = "/topic/chain/";

    private final SimpMessagingTemplate messagingTemplate;

    public ExecutionEventPublisher(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    public void nodeStarted(String executionId, String nodeId) {
        publishNode(executionId, nodeId, NodeStatus.RUNNING, null);
    }

    public void nodeCompleted(String executionId, String nodeId) {
        publishNode(executionId, nodeId, NodeStatus.SUCCESS, null);
    }

    public void nodeError(String executionId, String nodeId, String error) {
        publishNode(executionId, nodeId, NodeStatus.ERROR, error);
    }

    public void flowStatus(String executionId, String flowId, ExecutionStatus status, String error) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type",   "flow");
        payload.put("flowId", flowId);
        payload.put("status", status.name());
        payload.put("error",  error != null ? error : "");
        send(EXECUTION_TOPIC + executionId, payload);
    }

    /**
     * @param event  CHAIN_STARTED, FLOW_STARTED, FLOW_COMPLETED, CHAIN_COMPLETED or CHAIN_ERROR
     * @param flowId null for chain-level events
     */
    public void chainEvent(String chainId, String event, String flowId, Object detail) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type",    event);
        payload.put("chainId", chainId);
        payload.put("flowId",  flowId != null ? flowId : "");
        payload.put("detail",  detail != null ? detail : "");
        send(CHAIN_TOPIC + chainId, payload);
    }

    private void publishNode(String executionId, String nodeId, NodeStatus status, String error) {
        Map<String, Object> payload = Map.of(
                "nodeId", nodeId,
                "status", status.name(),
                "error",  error != null ? error : ""
        );
        send(EXECUTION_TOPIC + executionId, payload);
    }

    private void send(String destination, Map<String, Object> payload) {
        log.debug("Publishing to {}: {}", destination, payload.get("status") != null ? payload.get("status") : payload.get("type"));
        try {
            messagingTemplate.convertAndSend(destination, payload);
        } catch (MessagingException ex) {
            log.warn("Could not publish to {}: {}", destination, ex.getMessage());
        }
    }
}

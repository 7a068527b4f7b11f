package com.chainflow.chainflow_backend.model.context;

public enum NodeStatus {
    IDLE,
    RUNNING,
    SUCCESS,
    ERROR
}

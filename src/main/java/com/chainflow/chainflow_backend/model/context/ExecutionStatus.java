package com.chainflow.chainflow_backend.model.context;

// Status of a flow run or a chain run
public enum ExecutionStatus {
    IDLE,
    RUNNING,
    SUCCESS,
    ERROR
}

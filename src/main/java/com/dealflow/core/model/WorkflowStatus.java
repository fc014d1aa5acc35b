package com.dealflow.core.model;

/**
 * Lifecycle status of a pipeline workflow.
 */
public enum WorkflowStatus {
    IDLE,
    RUNNING,
    PAUSED,
    ERROR,
    COMPLETED
}

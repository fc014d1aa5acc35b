package com.dealflow.core.model;

/**
 * Priority of a supervisor decision. Declaration order is significance order.
 */
public enum Priority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}

package com.dealflow.core.supervisor;

/**
 * Whether human operators owe the supervisor an answer.
 */
public enum EscalationState {
    NONE_PENDING,
    PENDING_APPROVAL
}

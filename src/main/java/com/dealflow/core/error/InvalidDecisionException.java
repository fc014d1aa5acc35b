package com.dealflow.core.error;

/**
 * Thrown when a decision has a confidence outside [0, 1] or lacks a field its type requires.
 */
public class InvalidDecisionException extends SupervisorException {

    public InvalidDecisionException(String message) {
        super(message);
    }
}

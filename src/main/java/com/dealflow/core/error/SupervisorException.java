package com.dealflow.core.error;

/**
 * Base type for failures the supervisor recognizes and routes into human escalation.
 */
public class SupervisorException extends RuntimeException {

    public SupervisorException(String message) {
        super(message);
    }

    public SupervisorException(String message, Throwable cause) {
        super(message, cause);
    }
}

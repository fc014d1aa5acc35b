package com.dealflow.core.error;

/**
 * Thrown when the conflict resolver has no strategy for a conflict type.
 */
public class UnhandledConflictTypeException extends SupervisorException {

    private final String conflictId;
    private final String conflictType;

    public UnhandledConflictTypeException(String conflictId, String conflictType) {
        super("No resolution strategy for conflict type '" + conflictType + "' (conflict " + conflictId + ")");
        this.conflictId = conflictId;
        this.conflictType = conflictType;
    }

    public String getConflictId() {
        return conflictId;
    }

    public String getConflictType() {
        return conflictType;
    }
}

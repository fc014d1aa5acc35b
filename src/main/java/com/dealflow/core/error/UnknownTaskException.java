package com.dealflow.core.error;

/**
 * Thrown when a task name has no entry in the supervisor's dispatch table.
 */
public class UnknownTaskException extends SupervisorException {

    private final String taskName;

    public UnknownTaskException(String taskName) {
        super("Unknown task: " + taskName);
        this.taskName = taskName;
    }

    public String getTaskName() {
        return taskName;
    }
}

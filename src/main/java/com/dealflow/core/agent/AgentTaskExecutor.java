package com.dealflow.core.agent;

import com.dealflow.core.state.PipelineState;

import java.util.List;
import java.util.Map;

/**
 * Task contract shared by every agent in the pipeline, the supervisor included.
 * The supervisor depends on this shape only, never on an agent's internals.
 */
public interface AgentTaskExecutor {

    /**
     * Executes a named task.
     *
     * @param taskName one of {@link #availableTasks()}
     * @param data     task input
     * @param state    current workflow state
     * @return task outcome
     */
    AgentTaskResult executeTask(String taskName, Map<String, Object> data, PipelineState state);

    List<String> availableTasks();
}

package io.subrelay.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One unit of work for one agent. In a chain the position in the list orders the steps and the
 * task text may reference the previous step's output through the placeholder token.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskSpec(
        String agent,
        String task,
        String cwd
) {
    public static TaskSpec of(String agent, String task) {
        return new TaskSpec(agent, task, null);
    }

    public boolean hasAgentAndTask() {
        return agent != null && !agent.isBlank() && task != null && !task.isBlank();
    }

    public TaskSpec withTask(String newTask) {
        return new TaskSpec(agent, newTask, cwd);
    }
}

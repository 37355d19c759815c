package io.subrelay.model;

import io.subrelay.agent.AgentDefinition;

/**
 * A task paired with the agent definition its name resolved to.
 */
public record ResolvedTask(TaskSpec spec, AgentDefinition agent) {
    public String agentName() {
        return spec.agent();
    }

    public ResolvedTask withTask(String task) {
        return new ResolvedTask(spec.withTask(task), agent);
    }
}

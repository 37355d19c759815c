package io.subrelay.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.subrelay.agent.AgentScope;

import java.util.List;

/**
 * Top-level dispatch request. Exactly one of {@code single}, {@code parallel} and {@code chain}
 * must be populated; {@code async} defaults to true when absent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecutionRequest(
        TaskSpec single,
        List<TaskSpec> parallel,
        List<TaskSpec> chain,
        Boolean async,
        AgentScope agentScope,
        String cwd
) {
    public static ExecutionRequest single(String agent, String task) {
        return new ExecutionRequest(TaskSpec.of(agent, task), null, null, null, null, null);
    }

    public static ExecutionRequest parallel(List<TaskSpec> tasks) {
        return new ExecutionRequest(null, tasks, null, null, null, null);
    }

    public static ExecutionRequest chain(List<TaskSpec> steps) {
        return new ExecutionRequest(null, null, steps, null, null, null);
    }

    public ExecutionRequest sync() {
        return new ExecutionRequest(single, parallel, chain, false, agentScope, cwd);
    }

    public ExecutionRequest withScope(AgentScope scope) {
        return new ExecutionRequest(single, parallel, chain, async, scope, cwd);
    }

    public ExecutionRequest withCwd(String dir) {
        return new ExecutionRequest(single, parallel, chain, async, agentScope, dir);
    }

    public boolean runsAsync() {
        return async == null || async;
    }

    public AgentScope scopeOrDefault() {
        return agentScope == null ? AgentScope.USER : agentScope;
    }

    public boolean hasSingle() {
        return single != null && single.hasAgentAndTask();
    }

    public boolean hasParallel() {
        return parallel != null && !parallel.isEmpty();
    }

    public boolean hasChain() {
        return chain != null && !chain.isEmpty();
    }

    public int populatedModeCount() {
        return (hasSingle() ? 1 : 0) + (hasParallel() ? 1 : 0) + (hasChain() ? 1 : 0);
    }
}

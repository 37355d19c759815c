package io.subrelay.agent;

import java.util.List;

/**
 * A named worker configuration: which model to run, which tools the worker may use, and the
 * system prompt appended to its default one.
 */
public record AgentDefinition(
        String name,
        String description,
        String model,
        List<String> tools,
        String systemPrompt,
        AgentScope source
) {
    public AgentDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("agent name cannot be empty");
        }
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public static AgentDefinition of(String name, String model, List<String> tools, String systemPrompt) {
        return new AgentDefinition(name, null, model, tools, systemPrompt, AgentScope.USER);
    }

    public boolean hasSystemPrompt() {
        return systemPrompt != null && !systemPrompt.isBlank();
    }

    public String trimmedSystemPrompt() {
        return hasSystemPrompt() ? systemPrompt.trim() : null;
    }
}

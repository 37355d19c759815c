package io.subrelay.agent;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Name-indexed view over the agents visible to one request. Later registrations replace earlier
 * ones with the same name, which is how project agents shadow user agents.
 */
public final class AgentRegistry {
    private final Map<String, AgentDefinition> agents = new LinkedHashMap<>();

    public static AgentRegistry of(AgentDefinition... definitions) {
        AgentRegistry registry = new AgentRegistry();
        for (AgentDefinition definition : definitions) {
            registry.register(definition);
        }
        return registry;
    }

    public synchronized void register(AgentDefinition agent) {
        agents.put(agent.name(), agent);
    }

    public synchronized Optional<AgentDefinition> findByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(agents.get(name));
    }

    public synchronized List<String> names() {
        return new ArrayList<>(agents.keySet());
    }

    public synchronized Collection<AgentDefinition> all() {
        return List.copyOf(agents.values());
    }
}

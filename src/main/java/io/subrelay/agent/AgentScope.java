package io.subrelay.agent;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AgentScope {
    USER("user"),
    PROJECT("project"),
    BOTH("both");

    private final String label;

    AgentScope(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean includesUser() {
        return this != PROJECT;
    }

    public boolean includesProject() {
        return this != USER;
    }

    @JsonCreator
    public static AgentScope fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return USER;
        }
        for (AgentScope value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.label.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown agent scope: " + raw);
    }
}

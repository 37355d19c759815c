package io.subrelay.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExecutionMode {
    SINGLE("single"),
    PARALLEL("parallel"),
    CHAIN("chain");

    private final String label;

    ExecutionMode(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}

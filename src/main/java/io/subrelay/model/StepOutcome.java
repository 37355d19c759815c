package io.subrelay.model;

public record StepOutcome(String agent, String output, boolean success) {
}

package io.subrelay.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one synchronous worker run. Starts at exit code 0, is filled in as events arrive and
 * is final once the process has exited and the failure heuristics have run.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StepResult {
    private final String agent;
    private final String task;
    private final List<JsonNode> messages = new ArrayList<>();
    private final Usage usage = new Usage();
    private volatile int exitCode;
    private volatile String model;
    private volatile String error;

    public StepResult(String agent, String task) {
        this.agent = agent;
        this.task = task;
    }

    public static StepResult unknownAgent(String agent, String task) {
        StepResult result = new StepResult(agent, task);
        result.fail(1, "Unknown agent: " + agent);
        return result;
    }

    public String agent() {
        return agent;
    }

    public String task() {
        return task;
    }

    public int exitCode() {
        return exitCode;
    }

    public String model() {
        return model;
    }

    public String error() {
        return error;
    }

    public Usage usage() {
        return usage;
    }

    public boolean succeeded() {
        return exitCode == 0;
    }

    public synchronized List<JsonNode> messages() {
        return List.copyOf(messages);
    }

    public synchronized void appendMessage(JsonNode message) {
        messages.add(message);
    }

    public synchronized String finalOutput() {
        return Messages.finalOutput(messages);
    }

    public void exitCode(int code) {
        this.exitCode = code;
    }

    public void error(String message) {
        this.error = message;
    }

    public void fail(int code, String message) {
        this.exitCode = code;
        this.error = message;
    }

    /**
     * First non-empty model wins; later turns do not overwrite it.
     */
    public synchronized void captureModel(String candidate) {
        if (model == null && candidate != null && !candidate.isBlank()) {
            model = candidate;
        }
    }
}

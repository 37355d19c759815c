package io.subrelay.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * What a dispatch call returns: display text, an error flag and the per-step results. Async
 * acknowledgements carry the job id and no results.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionResult(
        ExecutionMode mode,
        String text,
        @JsonProperty("isError") boolean isError,
        List<StepResult> results,
        String asyncId
) {
    public ExecutionResult {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static ExecutionResult ok(ExecutionMode mode, String text, List<StepResult> results) {
        return new ExecutionResult(mode, text, false, results, null);
    }

    public static ExecutionResult error(ExecutionMode mode, String text, List<StepResult> results) {
        return new ExecutionResult(mode, text, true, results, null);
    }

    public static ExecutionResult rejected(String text) {
        return new ExecutionResult(ExecutionMode.SINGLE, text, true, List.of(), null);
    }

    public static ExecutionResult accepted(ExecutionMode mode, String text, String asyncId) {
        return new ExecutionResult(mode, text, false, List.of(), asyncId);
    }
}

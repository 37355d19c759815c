package io.subrelay.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Result document a detached runner writes for one job. {@code agent} holds the job label.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CompletionPayload(
        String id,
        String agent,
        boolean success,
        String summary,
        List<StepOutcome> results,
        int exitCode,
        long timestamp,
        Integer taskIndex,
        Integer totalTasks
) {
    public CompletionPayload {
        results = results == null ? List.of() : List.copyOf(results);
    }
}

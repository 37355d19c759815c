package io.subrelay.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Everything a detached runner needs for one job. Written once to a single-use config file and
 * owned by the runner process from then on.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobRecord(
        String id,
        List<JobStep> steps,
        String resultPath,
        String cwd,
        String placeholder,
        Integer taskIndex,
        Integer totalTasks
) {
    public JobRecord {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    /**
     * The single agent's name, or {@code chain:a->b->c} when more than one step exists.
     */
    public String label() {
        if (steps.size() == 1) {
            return steps.get(0).agent();
        }
        return "chain:" + steps.stream().map(JobStep::agent).collect(Collectors.joining("->"));
    }
}

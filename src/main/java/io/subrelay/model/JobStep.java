package io.subrelay.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobStep(
        String agent,
        String task,
        String cwd,
        String model,
        List<String> tools,
        String systemPrompt
) {
    public static JobStep from(ResolvedTask resolved) {
        return new JobStep(
                resolved.agentName(),
                resolved.spec().task(),
                resolved.spec().cwd(),
                resolved.agent().model(),
                resolved.agent().tools().isEmpty() ? null : resolved.agent().tools(),
                resolved.agent().trimmedSystemPrompt()
        );
    }
}

package io.subrelay.detect;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Classifies a run that exited 0 as failed when its message log carries a failure signature.
 * Checks run in order; the first verdict wins.
 */
public final class FailureDetector {
    public static final int MAX_DETAIL_CHARS = 200;

    private final List<FailureCheck> checks;

    public FailureDetector(List<FailureCheck> checks) {
        this.checks = List.copyOf(checks);
    }

    /**
     * Structured tool errors first, then command output pattern matching.
     */
    public static FailureDetector defaults() {
        return new FailureDetector(List.of(new ToolErrorCheck(), new CommandOutputCheck()));
    }

    public FailureVerdict detect(List<JsonNode> messages) {
        if (messages == null || messages.isEmpty()) {
            return FailureVerdict.none();
        }
        for (FailureCheck check : checks) {
            Optional<FailureVerdict> verdict = check.inspect(messages);
            if (verdict.isPresent() && verdict.get().hasError()) {
                return verdict.get();
            }
        }
        return FailureVerdict.none();
    }
}

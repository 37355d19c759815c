package io.subrelay.detect;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * One independent predicate over a run's message log.
 */
@FunctionalInterface
public interface FailureCheck {
    Optional<FailureVerdict> inspect(List<JsonNode> messages);
}

package io.subrelay.runtime;

import io.subrelay.model.ExecutionResult;

/**
 * Receives partial results of a synchronous dispatch while it runs.
 */
@FunctionalInterface
public interface ProgressListener {
    void onUpdate(ExecutionResult partial);
}

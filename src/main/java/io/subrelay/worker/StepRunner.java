package io.subrelay.worker;

import io.subrelay.model.ResolvedTask;
import io.subrelay.model.StepResult;

/**
 * Runs one task to completion and returns its finalized result. Never throws for worker-level
 * failures; those are reported through the result's exit code and error.
 */
@FunctionalInterface
public interface StepRunner {
    StepResult run(ResolvedTask task, CancellationSignal signal, StepProgressListener listener);
}

package io.subrelay.runtime;

import io.subrelay.model.ResolvedTask;
import io.subrelay.model.StepResult;
import io.subrelay.worker.CancellationSignal;
import io.subrelay.worker.StepRunner;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs steps one after another, feeding each step's final text into the next step's task through
 * the placeholder token. Stops at the first failed step.
 */
public final class ChainRunner {
    private final StepRunner stepRunner;
    private final String placeholder;

    public ChainRunner(StepRunner stepRunner, String placeholder) {
        this.stepRunner = stepRunner;
        this.placeholder = placeholder;
    }

    public ChainOutcome run(List<ResolvedTask> steps, CancellationSignal signal, ChainProgressListener listener) {
        List<StepResult> completed = new ArrayList<>();
        String previousOutput = "";
        for (ResolvedTask step : steps) {
            String task = Placeholders.substitute(step.spec().task(), placeholder, previousOutput);
            StepResult result = stepRunner.run(
                    step.withTask(task),
                    signal,
                    listener == null ? null : (partial, live) -> {
                        List<StepResult> snapshot = new ArrayList<>(completed);
                        snapshot.add(live);
                        listener.onProgress(partial, snapshot);
                    }
            );
            completed.add(result);
            if (!result.succeeded()) {
                return new ChainOutcome(completed, result.error(), true);
            }
            previousOutput = result.finalOutput();
        }
        return new ChainOutcome(completed, previousOutput, false);
    }

    @FunctionalInterface
    public interface ChainProgressListener {
        /**
         * @param results completed steps followed by the step currently running
         */
        void onProgress(String partialText, List<StepResult> results);
    }

    /**
     * @param text the last step's output on success, the failing step's error (possibly null) on failure
     */
    public record ChainOutcome(List<StepResult> results, String text, boolean failed) {
        public ChainOutcome {
            results = List.copyOf(results);
        }
    }
}

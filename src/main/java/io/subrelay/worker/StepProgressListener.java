package io.subrelay.worker;

import io.subrelay.model.StepResult;

@FunctionalInterface
public interface StepProgressListener {
    /**
     * Called on the reading thread after each recognized worker event.
     *
     * @param partialText latest assistant text, or {@code (running...)} before there is any
     * @param live        the result being filled in; do not keep it past the callback
     */
    void onProgress(String partialText, StepResult live);
}

package io.subrelay.completion;

import io.subrelay.model.CompletionPayload;

/**
 * Receives each completion payload once, on the correlator's worker thread.
 */
@FunctionalInterface
public interface CompletionListener {
    void onCompletion(CompletionPayload payload);
}

package io.subrelay.worker;

import java.util.ArrayList;
import java.util.List;

/**
 * One-shot cancellation flag shared by every worker run of a request. Callbacks registered after
 * cancellation run immediately.
 */
public final class CancellationSignal {
    private final List<Runnable> callbacks = new ArrayList<>();
    private boolean cancelled;

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        for (Runnable callback : toRun) {
            callback.run();
        }
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    public Registration onCancel(Runnable callback) {
        synchronized (this) {
            if (!cancelled) {
                callbacks.add(callback);
                return () -> {
                    synchronized (CancellationSignal.this) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        callback.run();
        return () -> {
        };
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}

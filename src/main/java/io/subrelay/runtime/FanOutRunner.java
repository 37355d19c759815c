package io.subrelay.runtime;

import io.subrelay.model.ResolvedTask;
import io.subrelay.model.StepResult;
import io.subrelay.worker.CancellationSignal;
import io.subrelay.worker.StepRunner;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs independent tasks on a fixed pool of workers. Each worker claims the next unclaimed index
 * until the list is exhausted, and writes its result to that index, so the returned list lines up
 * with the input regardless of completion order.
 */
public final class FanOutRunner {
    private final StepRunner stepRunner;
    private final int concurrency;

    public FanOutRunner(StepRunner stepRunner, int concurrency) {
        this.stepRunner = stepRunner;
        this.concurrency = Math.max(1, concurrency);
    }

    public List<StepResult> run(List<ResolvedTask> tasks, CancellationSignal signal) {
        if (tasks.isEmpty()) {
            return List.of();
        }
        StepResult[] results = new StepResult[tasks.size()];
        AtomicInteger cursor = new AtomicInteger(0);
        int workers = Math.min(concurrency, tasks.size());
        AtomicInteger threadSeq = new AtomicInteger(0);
        ExecutorService pool = Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable, "subrelay-fanout-" + threadSeq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        try {
            List<Future<?>> futures = new ArrayList<>(workers);
            for (int w = 0; w < workers; w++) {
                futures.add(pool.submit(() -> {
                    int index;
                    while ((index = cursor.getAndIncrement()) < tasks.size()) {
                        results[index] = stepRunner.run(tasks.get(index), signal, null);
                    }
                }));
            }
            for (Future<?> future : futures) {
                await(future, signal);
            }
        } finally {
            pool.shutdownNow();
        }
        return Arrays.asList(results);
    }

    public static long succeeded(List<StepResult> results) {
        return results.stream().filter(StepResult::succeeded).count();
    }

    private static void await(Future<?> future, CancellationSignal signal) {
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            signal.cancel();
            throw new CancellationException("fan-out interrupted");
        } catch (ExecutionException e) {
            signal.cancel();
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("fan-out worker failed", cause);
        }
    }
}

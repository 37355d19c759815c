package io.subrelay.completion;

import io.subrelay.model.CompletionPayload;
import io.subrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Owns the results directory: turns every completion file that appears there into exactly one
 * {@link CompletionListener} call and removes the file.
 *
 * <p>All reads and deletes happen on a single scheduler thread, so a file noticed twice (watch
 * event plus sweep) is handled once and the second attempt finds nothing.
 */
public final class CompletionCorrelator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CompletionCorrelator.class);
    private static final String RESULT_GLOB = "*.json";
    private static final String PARTIAL_GLOB = "*.json.tmp";

    private final Path resultsDir;
    private final Duration debounce;
    private final CompletionListener listener;
    private final Object lifecycleLock = new Object();

    private ScheduledExecutorService scheduler;
    private WatchService watchService;
    private Thread watchThread;

    public CompletionCorrelator(Path resultsDir, Duration debounce, CompletionListener listener) {
        this.resultsDir = resultsDir;
        this.debounce = debounce;
        this.listener = listener;
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (scheduler != null) {
                return;
            }
            try {
                Files.createDirectories(resultsDir);
                int stale = deleteStale();
                if (stale > 0) {
                    log.info("Removed {} stale result file(s) from {}", stale, resultsDir);
                }
                watchService = resultsDir.getFileSystem().newWatchService();
                resultsDir.register(watchService, StandardWatchEventKinds.ENTRY_CREATE);
            } catch (IOException e) {
                closeWatch();
                throw new UncheckedIOException("Failed to start watching " + resultsDir, e);
            }
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "subrelay-completion");
                t.setDaemon(true);
                return t;
            });
            WatchService watch = watchService;
            watchThread = new Thread(() -> watchLoop(watch), "subrelay-results-watch");
            watchThread.setDaemon(true);
            watchThread.start();
            awaitInitialSweep();
            log.info("Watching {} for completion files", resultsDir);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (scheduler == null) {
                return;
            }
            closeWatch();
            watchThread.interrupt();
            shutdownScheduler();
            watchThread = null;
            log.info("Stopped watching {}", resultsDir);
        }
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Reads, publishes and deletes one result file. A missing file is a no-op; a malformed one is
     * deleted without publishing.
     */
    public void handleResultFile(String fileName) {
        Path file = resultsDir.resolve(fileName);
        if (!Files.isRegularFile(file)) {
            return;
        }
        try {
            CompletionPayload payload;
            try {
                payload = Jsons.mapper().readValue(file.toFile(), CompletionPayload.class);
            } catch (IOException e) {
                log.warn("Discarding unreadable completion file {}: {}", file, e.getMessage());
                return;
            }
            if (payload == null) {
                log.warn("Discarding empty completion file {}", file);
                return;
            }
            try {
                listener.onCompletion(payload);
            } catch (RuntimeException e) {
                log.warn("Completion listener failed for job {}: {}", payload.id(), e.getMessage(), e);
            }
        } finally {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                log.warn("Could not delete completion file {}: {}", file, e.getMessage());
            }
        }
    }

    private void watchLoop(WatchService watch) {
        while (!Thread.currentThread().isInterrupted()) {
            WatchKey key;
            try {
                key = watch.take();
            } catch (InterruptedException | ClosedWatchServiceException e) {
                return;
            }
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                    schedule(this::sweep);
                    continue;
                }
                Object context = event.context();
                if (context instanceof Path) {
                    String name = context.toString();
                    if (name.endsWith(".json")) {
                        schedule(() -> handleResultFile(name));
                    }
                }
            }
            if (!key.reset()) {
                log.warn("Results directory {} is no longer watchable", resultsDir);
                return;
            }
        }
    }

    /**
     * Runs the first sweep on the scheduler thread so it cannot race a watch-triggered read of the
     * same file.
     */
    private void awaitInitialSweep() {
        try {
            scheduler.submit(this::sweep).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.warn("Initial sweep of {} failed: {}", resultsDir, e.getCause().getMessage());
        }
    }

    private void closeWatch() {
        if (watchService == null) {
            return;
        }
        try {
            watchService.close();
        } catch (IOException e) {
            log.warn("Failed to close results watch on {}: {}", resultsDir, e.getMessage());
        }
        watchService = null;
    }

    private void schedule(Runnable action) {
        synchronized (lifecycleLock) {
            if (scheduler == null || scheduler.isShutdown()) {
                return;
            }
            scheduler.schedule(action, debounce.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private void sweep() {
        for (Path file : listResultFiles()) {
            handleResultFile(file.getFileName().toString());
        }
    }

    /**
     * Clears results left from earlier sessions, and partial writes from runners that died mid-write.
     */
    private int deleteStale() throws IOException {
        List<Path> stale = listResultFiles();
        stale.addAll(listFiles(PARTIAL_GLOB));
        int removed = 0;
        for (Path file : stale) {
            if (Files.deleteIfExists(file)) {
                removed++;
            }
        }
        return removed;
    }

    private List<Path> listResultFiles() {
        return listFiles(RESULT_GLOB);
    }

    private List<Path> listFiles(String glob) {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(resultsDir, glob)) {
            for (Path path : stream) {
                files.add(path);
            }
        } catch (IOException e) {
            log.warn("Could not list {}: {}", resultsDir, e.getMessage());
        }
        files.sort(null);
        return files;
    }

    private void shutdownScheduler() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        try {
            scheduler.awaitTermination(1, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        scheduler = null;
    }
}

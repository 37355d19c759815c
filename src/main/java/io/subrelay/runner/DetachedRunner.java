package io.subrelay.runner;

import io.subrelay.config.SubRelayConfig;
import io.subrelay.model.CompletionPayload;
import io.subrelay.model.JobRecord;
import io.subrelay.model.JobStep;
import io.subrelay.model.StepOutcome;
import io.subrelay.runtime.Placeholders;
import io.subrelay.util.Jsons;
import io.subrelay.worker.BlockingWorkerClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Executes one job outside the dispatching process and leaves a {@link CompletionPayload} at the
 * job's result path. Steps run in order in blocking mode; the first failing step ends the job.
 */
public final class DetachedRunner {
    private static final Logger log = LoggerFactory.getLogger(DetachedRunner.class);

    private final BlockingWorkerClient worker;
    private final Clock clock;

    public DetachedRunner(BlockingWorkerClient worker) {
        this(worker, Clock.systemUTC());
    }

    public DetachedRunner(BlockingWorkerClient worker, Clock clock) {
        this.worker = worker;
        this.clock = clock;
    }

    /**
     * Reads the job config and removes the file; it is single-use.
     */
    public static JobRecord readConfig(Path configFile) {
        try {
            return Jsons.mapper().readValue(configFile.toFile(), JobRecord.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read job config: " + configFile, e);
        } finally {
            try {
                Files.deleteIfExists(configFile);
            } catch (IOException e) {
                log.debug("Could not delete job config {}: {}", configFile, e.getMessage());
            }
        }
    }

    public static JobRecord readConfig(InputStream in) {
        try {
            return Jsons.mapper().readValue(in, JobRecord.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read job config from stdin", e);
        }
    }

    public CompletionPayload run(JobRecord job) {
        if (job.steps().isEmpty()) {
            throw new IllegalArgumentException("Job has no steps: " + job.id());
        }
        String placeholder = job.placeholder() == null || job.placeholder().isEmpty()
                ? SubRelayConfig.DEFAULT_PLACEHOLDER
                : job.placeholder();
        List<StepOutcome> outcomes = new ArrayList<>();
        String previousOutput = "";
        for (JobStep step : job.steps()) {
            String task = Placeholders.substitute(step.task(), placeholder, previousOutput);
            Path cwd = workingDir(step, job);
            log.info("Job {} running {} in {}", job.id(), step.agent(), cwd);
            BlockingWorkerClient.WorkerOutcome outcome = worker.run(step, task, cwd);
            outcomes.add(new StepOutcome(step.agent(), outcome.output(), outcome.success()));
            if (!outcome.success()) {
                log.info("Job {} step {} failed with exit {}", job.id(), step.agent(), outcome.exitCode());
                break;
            }
            previousOutput = outcome.output();
        }

        boolean success = outcomes.stream().allMatch(StepOutcome::success);
        CompletionPayload payload = new CompletionPayload(
                job.id(),
                job.label(),
                success,
                summarize(outcomes),
                outcomes,
                success ? 0 : 1,
                clock.millis(),
                job.taskIndex(),
                job.totalTasks()
        );
        writeResult(Path.of(job.resultPath()), payload);
        return payload;
    }

    static String summarize(List<StepOutcome> outcomes) {
        return outcomes.stream()
                .map(o -> o.agent() + ":\n" + o.output())
                .collect(Collectors.joining("\n\n"));
    }

    /**
     * Writes next to the target and moves it into place so a watcher never sees a partial file.
     */
    static void writeResult(Path target, CompletionPayload payload) {
        Path dir = target.toAbsolutePath().getParent();
        Path tmp = dir.resolve(target.getFileName() + ".tmp");
        try {
            Files.createDirectories(dir);
            Files.writeString(tmp, Jsons.toCompactJson(payload), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException atomicUnsupported) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write completion payload: " + target, e);
        }
    }

    private static Path workingDir(JobStep step, JobRecord job) {
        if (step.cwd() != null && !step.cwd().isBlank()) {
            return Path.of(step.cwd());
        }
        if (job.cwd() != null && !job.cwd().isBlank()) {
            return Path.of(job.cwd());
        }
        return null;
    }
}

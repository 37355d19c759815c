package io.subrelay.async;

import io.subrelay.model.ExecutionMode;
import io.subrelay.model.ExecutionResult;
import io.subrelay.model.JobRecord;
import io.subrelay.model.JobStep;
import io.subrelay.model.ResolvedTask;
import io.subrelay.util.Texts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Turns an already validated request into detached jobs and acknowledges immediately. One job id
 * covers the whole request; parallel tasks get one job each, a chain is one job.
 */
public final class AsyncDispatcher {
    private static final Logger log = LoggerFactory.getLogger(AsyncDispatcher.class);

    private final JobLauncher launcher;
    private final Path resultsDir;
    private final String placeholder;
    private final Path defaultCwd;
    private final Supplier<String> idGenerator;

    public AsyncDispatcher(JobLauncher launcher, Path resultsDir, String placeholder, Path defaultCwd) {
        this(launcher, resultsDir, placeholder, defaultCwd, () -> UUID.randomUUID().toString());
    }

    public AsyncDispatcher(
            JobLauncher launcher,
            Path resultsDir,
            String placeholder,
            Path defaultCwd,
            Supplier<String> idGenerator
    ) {
        this.launcher = launcher;
        this.resultsDir = resultsDir;
        this.placeholder = placeholder;
        this.defaultCwd = defaultCwd;
        this.idGenerator = idGenerator;
    }

    public ExecutionResult dispatchSingle(ResolvedTask task, String requestCwd) {
        String id = idGenerator.get();
        String cwd = Texts.firstNonBlank(task.spec().cwd(), requestCwd, defaultCwd.toString());
        launchQuietly(new JobRecord(
                id,
                List.of(JobStep.from(task)),
                resultsDir.resolve(id + ".json").toString(),
                cwd,
                placeholder,
                null,
                null
        ));
        return ExecutionResult.accepted(ExecutionMode.SINGLE, "Async: " + task.agentName() + " [" + id + "]", id);
    }

    public ExecutionResult dispatchParallel(List<ResolvedTask> tasks, String requestCwd) {
        String id = idGenerator.get();
        for (int i = 0; i < tasks.size(); i++) {
            ResolvedTask task = tasks.get(i);
            String cwd = Texts.firstNonBlank(task.spec().cwd(), requestCwd, defaultCwd.toString());
            launchQuietly(new JobRecord(
                    id,
                    List.of(JobStep.from(task)),
                    resultsDir.resolve(id + "-" + i + ".json").toString(),
                    cwd,
                    placeholder,
                    i,
                    tasks.size()
            ));
        }
        return ExecutionResult.accepted(
                ExecutionMode.PARALLEL,
                "Async parallel: " + tasks.size() + " tasks [" + id + "]",
                id
        );
    }

    public ExecutionResult dispatchChain(List<ResolvedTask> steps, String requestCwd) {
        String id = idGenerator.get();
        List<JobStep> jobSteps = steps.stream().map(JobStep::from).toList();
        launchQuietly(new JobRecord(
                id,
                jobSteps,
                resultsDir.resolve(id + ".json").toString(),
                Texts.firstNonBlank(requestCwd, defaultCwd.toString()),
                placeholder,
                null,
                null
        ));
        String arrow = steps.stream().map(ResolvedTask::agentName).collect(Collectors.joining(" -> "));
        return ExecutionResult.accepted(ExecutionMode.CHAIN, "Async chain: " + arrow + " [" + id + "]", id);
    }

    /**
     * The caller is acknowledged whether or not the hand-off worked; a failed launch only leaves
     * a log line and no completion file is ever written for it.
     */
    private void launchQuietly(JobRecord job) {
        try {
            launcher.launch(job);
            log.info("Dispatched async job {} ({}) -> {}", job.id(), job.label(), job.resultPath());
        } catch (UncheckedIOException e) {
            log.warn("Async job {} ({}) was not launched: {}", job.id(), job.label(), e.getMessage());
        }
    }
}

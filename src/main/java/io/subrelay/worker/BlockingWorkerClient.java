package io.subrelay.worker;

import io.subrelay.model.JobStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the worker CLI in plain print mode and waits for it. The exit code is the only completion
 * signal; stdout is the answer.
 */
public final class BlockingWorkerClient {
    private static final Logger log = LoggerFactory.getLogger(BlockingWorkerClient.class);
    private static final int MAX_OUTPUT_BYTES = 10 * 1024 * 1024;

    private final List<String> workerCommand;
    private final Path tempRoot;

    public BlockingWorkerClient(List<String> workerCommand, Path tempRoot) {
        if (workerCommand == null || workerCommand.isEmpty()) {
            throw new IllegalArgumentException("worker command cannot be empty");
        }
        this.workerCommand = List.copyOf(workerCommand);
        this.tempRoot = tempRoot;
    }

    public WorkerOutcome run(JobStep step, String task, Path cwd) {
        try (SystemPromptFile prompt = SystemPromptFile.writeIfPresent(tempRoot, step.agent(), step.systemPrompt())) {
            List<String> command = WorkerArguments.blocking(
                    workerCommand,
                    step.model(),
                    step.tools(),
                    prompt == null ? null : prompt.path(),
                    task
            );
            return execute(command, cwd, step.agent());
        } catch (UncheckedIOException e) {
            log.warn("Could not prepare worker for agent {}: {}", step.agent(), e.getMessage());
            return new WorkerOutcome(1, "");
        }
    }

    private WorkerOutcome execute(List<String> command, Path cwd, String agent) {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (cwd != null) {
            pb.directory(cwd.toFile());
        }
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            log.warn("Worker spawn failed for agent {}: {}", agent, e.getMessage());
            return new WorkerOutcome(1, "");
        }
        try (InputStream stdout = process.getInputStream()) {
            process.getOutputStream().close();
            String output = readCapped(stdout);
            int exitCode = process.waitFor();
            return new WorkerOutcome(exitCode, output.trim());
        } catch (IOException e) {
            log.warn("Lost worker output for agent {}: {}", agent, e.getMessage());
            process.destroyForcibly();
            return new WorkerOutcome(1, "");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            awaitExit(process);
            return new WorkerOutcome(1, "");
        }
    }

    private static String readCapped(InputStream in) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[8_192];
        int read;
        while ((read = in.read(buffer)) != -1) {
            int room = MAX_OUTPUT_BYTES - out.size();
            if (room > 0) {
                out.write(buffer, 0, Math.min(room, read));
            }
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    private static void awaitExit(Process process) {
        try {
            process.waitFor(1, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public record WorkerOutcome(int exitCode, String output) {
        public boolean success() {
            return exitCode == 0;
        }
    }
}

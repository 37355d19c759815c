package io.subrelay.worker;

import com.fasterxml.jackson.databind.JsonNode;
import io.subrelay.agent.AgentDefinition;
import io.subrelay.detect.FailureDetector;
import io.subrelay.detect.FailureVerdict;
import io.subrelay.model.Messages;
import io.subrelay.model.ResolvedTask;
import io.subrelay.model.StepResult;
import io.subrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs one agent task through the worker CLI in streaming JSON mode and turns its event stream
 * into a {@link StepResult}.
 */
public final class StepExecutor implements StepRunner {
    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    static final String EVENT_MESSAGE_END = "message_end";
    static final String EVENT_TOOL_RESULT_END = "tool_result_end";
    static final String RUNNING_PLACEHOLDER = "(running...)";
    private static final int READ_BUFFER_BYTES = 8_192;

    private final List<String> workerCommand;
    private final Path defaultCwd;
    private final Path tempRoot;
    private final Duration killGrace;
    private final FailureDetector detector;

    public StepExecutor(
            List<String> workerCommand,
            Path defaultCwd,
            Path tempRoot,
            Duration killGrace,
            FailureDetector detector
    ) {
        if (workerCommand == null || workerCommand.isEmpty()) {
            throw new IllegalArgumentException("worker command cannot be empty");
        }
        this.workerCommand = List.copyOf(workerCommand);
        this.defaultCwd = defaultCwd;
        this.tempRoot = tempRoot;
        this.killGrace = killGrace;
        this.detector = detector;
    }

    @Override
    public StepResult run(ResolvedTask task, CancellationSignal signal, StepProgressListener listener) {
        String agentName = task.agentName();
        String taskText = task.spec().task();
        AgentDefinition agent = task.agent();
        if (agent == null) {
            return StepResult.unknownAgent(agentName, taskText);
        }

        StepResult result = new StepResult(agentName, taskText);
        int exitCode;
        try (SystemPromptFile prompt = SystemPromptFile.writeIfPresent(tempRoot, agent.name(), agent.systemPrompt())) {
            List<String> command = WorkerArguments.streaming(
                    workerCommand,
                    agent.model(),
                    agent.tools(),
                    prompt == null ? null : prompt.path(),
                    taskText
            );
            exitCode = runProcess(command, workingDir(task), result, signal, listener);
        } catch (UncheckedIOException e) {
            result.fail(1, e.getMessage());
            return result;
        }
        result.exitCode(exitCode);

        if (exitCode == 0 && result.error() == null) {
            FailureVerdict verdict = detector.detect(result.messages());
            if (verdict.hasError()) {
                log.info("Agent {} exited 0 but {} reported a failure (exit {})",
                        agentName, verdict.originatingTool(), verdict.exitCode());
                result.fail(verdict.exitCode(), verdict.describe());
            }
        }
        return result;
    }

    private int runProcess(
            List<String> command,
            Path cwd,
            StepResult result,
            CancellationSignal signal,
            StepProgressListener listener
    ) {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (cwd != null) {
            pb.directory(cwd.toFile());
        }
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            log.warn("Worker spawn failed for agent {}: {}", result.agent(), e.getMessage());
            return 1;
        }

        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        Thread stderrReader = new Thread(() -> drain(process.getErrorStream(), stderr),
                "subrelay-stderr-" + process.pid());
        stderrReader.setDaemon(true);
        stderrReader.start();

        CancellationSignal effective = signal == null ? CancellationSignal.none() : signal;
        try (CancellationSignal.Registration ignored = effective.onCancel(() -> terminate(process));
             InputStream stdout = process.getInputStream()) {
            process.getOutputStream().close();
            JsonLineDecoder decoder = new JsonLineDecoder();
            byte[] buffer = new byte[READ_BUFFER_BYTES];
            int read;
            while ((read = stdout.read(buffer)) != -1) {
                for (String line : decoder.feed(buffer, read)) {
                    handleLine(line, result, listener);
                }
            }
            handleLine(decoder.finish(), result, listener);

            int exitCode = process.waitFor();
            stderrReader.join(TimeUnit.SECONDS.toMillis(1));
            String errText;
            synchronized (stderr) {
                errText = stderr.toString(StandardCharsets.UTF_8).trim();
            }
            if (exitCode != 0 && !errText.isEmpty() && result.error() == null) {
                result.error(errText);
            }
            return exitCode;
        } catch (IOException e) {
            log.warn("Lost worker output for agent {}: {}", result.agent(), e.getMessage());
            process.destroyForcibly();
            return waitQuietly(process);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return 1;
        }
    }

    void handleLine(String line, StepResult result, StepProgressListener listener) {
        JsonNode event = Jsons.tryParse(line).orElse(null);
        if (event == null) {
            return;
        }
        String type = event.path("type").asText("");
        JsonNode message = event.get("message");
        if (message == null || !message.isObject()) {
            return;
        }
        if (EVENT_MESSAGE_END.equals(type)) {
            result.appendMessage(message);
            if (Messages.isAssistant(message)) {
                result.usage().addTurn(message.path("usage"));
                result.captureModel(message.path("model").asText(null));
                String errorMessage = message.path("errorMessage").asText("");
                if (!errorMessage.isEmpty()) {
                    result.error(errorMessage);
                }
            }
        } else if (EVENT_TOOL_RESULT_END.equals(type)) {
            result.appendMessage(message);
        } else {
            return;
        }
        if (listener != null) {
            String text = result.finalOutput();
            listener.onProgress(text.isEmpty() ? RUNNING_PLACEHOLDER : text, result);
        }
    }

    private void terminate(Process process) {
        if (!process.isAlive()) {
            return;
        }
        log.warn("Cancelling worker pid={}", process.pid());
        process.destroy();
        CompletableFuture.delayedExecutor(killGrace.toMillis(), TimeUnit.MILLISECONDS).execute(() -> {
            if (process.isAlive()) {
                log.warn("Worker pid={} still alive after {}ms, killing", process.pid(), killGrace.toMillis());
                process.destroyForcibly();
            }
        });
    }

    private Path workingDir(ResolvedTask task) {
        String cwd = task.spec().cwd();
        if (cwd != null && !cwd.isBlank()) {
            return Path.of(cwd);
        }
        return defaultCwd;
    }

    private static void drain(InputStream in, ByteArrayOutputStream sink) {
        byte[] buffer = new byte[READ_BUFFER_BYTES];
        try (InputStream stream = in) {
            int read;
            while ((read = stream.read(buffer)) != -1) {
                synchronized (sink) {
                    sink.write(buffer, 0, read);
                }
            }
        } catch (IOException e) {
            log.debug("Worker stderr closed early: {}", e.getMessage());
        }
    }

    private static int waitQuietly(Process process) {
        try {
            return process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        }
    }
}

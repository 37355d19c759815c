package io.subrelay.async;

import io.subrelay.config.SubRelayConfig;
import io.subrelay.model.JobRecord;
import io.subrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the job to a single-use config file and starts the detached runner on it. The child's
 * stdio is disconnected and the {@link Process} is dropped, so the runner keeps going after this
 * JVM exits.
 */
public final class DetachedProcessLauncher implements JobLauncher {
    private static final Logger log = LoggerFactory.getLogger(DetachedProcessLauncher.class);
    static final String CONFIG_PREFIX = "subrelay-async-cfg-";

    private final List<String> runnerCommand;
    private final List<String> workerCommand;
    private final Path configDir;

    public DetachedProcessLauncher(List<String> runnerCommand, List<String> workerCommand, Path configDir) {
        if (runnerCommand == null || runnerCommand.isEmpty()) {
            throw new IllegalArgumentException("runner command cannot be empty");
        }
        this.runnerCommand = List.copyOf(runnerCommand);
        this.workerCommand = List.copyOf(workerCommand);
        this.configDir = configDir;
    }

    public static DetachedProcessLauncher fromConfig(SubRelayConfig config) {
        return new DetachedProcessLauncher(config.runnerCommand(), config.workerCommand(), config.tempDir());
    }

    @Override
    public void launch(JobRecord job) {
        Path configFile = writeConfig(job);
        List<String> command = new ArrayList<>(runnerCommand);
        command.add(configFile.toString());
        ProcessBuilder pb = new ProcessBuilder(command);
        if (job.cwd() != null && !job.cwd().isBlank()) {
            pb.directory(Path.of(job.cwd()).toFile());
        }
        pb.environment().put(SubRelayConfig.WORKER_ARGV_ENV, Jsons.toCompactJson(workerCommand));
        pb.redirectInput(ProcessBuilder.Redirect.PIPE);
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        try {
            Process process = pb.start();
            process.getOutputStream().close();
            log.debug("Launched runner pid={} for job {}", process.pid(), job.id());
        } catch (IOException e) {
            deleteQuietly(configFile);
            throw new UncheckedIOException("Failed to launch detached runner for job: " + job.id(), e);
        }
    }

    Path writeConfig(JobRecord job) {
        try {
            Files.createDirectories(configDir);
            Path file = configDir.resolve(CONFIG_PREFIX + suffixOf(job) + ".json");
            Files.writeString(file, Jsons.toCompactJson(job), StandardCharsets.UTF_8);
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write job config: " + job.id(), e);
        }
    }

    /**
     * Result file name without extension: {@code <id>} or {@code <id>-<index>}.
     */
    static String suffixOf(JobRecord job) {
        String name = Path.of(job.resultPath()).getFileName().toString();
        return name.endsWith(".json") ? name.substring(0, name.length() - ".json".length()) : name;
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not remove orphaned job config {}: {}", file, e.getMessage());
        }
    }
}

package io.subrelay.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.subrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

public final class SubRelayConfig {
    private static final Logger log = LoggerFactory.getLogger(SubRelayConfig.class);

    public static final String SETTINGS_FILE = "subrelay-settings.json";
    public static final String WORKER_ENV = "SUBRELAY_WORKER";
    /** Worker command handed to detached runners as a JSON array, so arguments keep their spaces. */
    public static final String WORKER_ARGV_ENV = "SUBRELAY_WORKER_ARGV";
    public static final String DEFAULT_WORKER = "pi";
    public static final String DEFAULT_PLACEHOLDER = "{previous}";
    public static final String RUNNER_MAIN_CLASS = "io.subrelay.runner.DetachedRunnerMain";
    public static final int MAX_PARALLEL = 8;
    public static final int DEFAULT_MAX_CONCURRENCY = 4;
    public static final long DEFAULT_DEBOUNCE_MS = 50L;
    public static final long DEFAULT_KILL_GRACE_MS = 3_000L;

    private final Path rootDir;
    private final Path resultsDir;
    private final Path tempDir;
    private final List<String> workerCommand;
    private final List<String> runnerCommand;
    private final int maxParallel;
    private final int maxConcurrency;
    private final String placeholder;
    private final long debounceMs;
    private final long killGraceMs;

    public SubRelayConfig(
            Path rootDir,
            Path resultsDir,
            Path tempDir,
            List<String> workerCommand,
            List<String> runnerCommand,
            int maxParallel,
            int maxConcurrency,
            String placeholder,
            long debounceMs,
            long killGraceMs
    ) {
        this.rootDir = rootDir;
        this.resultsDir = resultsDir;
        this.tempDir = tempDir;
        this.workerCommand = List.copyOf(workerCommand);
        this.runnerCommand = List.copyOf(runnerCommand);
        this.maxParallel = maxParallel;
        this.maxConcurrency = maxConcurrency;
        this.placeholder = placeholder;
        this.debounceMs = debounceMs;
        this.killGraceMs = killGraceMs;
    }

    public static SubRelayConfig fromRoot(String root) {
        return fromRoot(root, System.getenv());
    }

    public static SubRelayConfig fromRoot(String root, Map<String, String> env) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        SettingsFile settings = readSettings(base.resolve(SETTINGS_FILE));

        List<String> worker = splitCommand(env == null ? null : env.get(WORKER_ENV));
        if (worker.isEmpty()) {
            worker = sanitizeCommand(settings.workerCommand(), List.of(DEFAULT_WORKER));
        }
        Path results = settings.resultsDir() == null || settings.resultsDir().isBlank()
                ? base.resolve("async-results")
                : base.resolve(settings.resultsDir()).normalize();
        return new SubRelayConfig(
                base,
                results,
                Paths.get(System.getProperty("java.io.tmpdir")),
                worker,
                sanitizeCommand(settings.runnerCommand(), defaultRunnerCommand()),
                clamp(settings.maxParallel(), MAX_PARALLEL, 1, MAX_PARALLEL),
                clamp(settings.maxConcurrency(), DEFAULT_MAX_CONCURRENCY, 1, MAX_PARALLEL),
                settings.placeholder() == null || settings.placeholder().isEmpty()
                        ? DEFAULT_PLACEHOLDER
                        : settings.placeholder(),
                sanitizeLong(settings.debounceMs(), DEFAULT_DEBOUNCE_MS, 0L),
                sanitizeLong(settings.killGraceMs(), DEFAULT_KILL_GRACE_MS, 0L)
        );
    }

    /**
     * Command that re-enters this JVM's classpath at the detached runner entry point.
     */
    public static List<String> defaultRunnerCommand() {
        String javaBin = ProcessHandle.current().info().command()
                .orElseGet(() -> Paths.get(System.getProperty("java.home"), "bin", "java").toString());
        return runnerCommandFor(javaBin, System.getProperty("java.class.path"));
    }

    public static List<String> runnerCommandFor(String javaBin, String classPath) {
        List<String> command = new ArrayList<>();
        command.add(javaBin);
        command.add("-cp");
        command.add(absoluteClassPath(classPath));
        command.add(RUNNER_MAIN_CLASS);
        return command;
    }

    /**
     * Runners start in the job's cwd, so relative entries are pinned to this process's working
     * directory. An empty entry means the working directory itself.
     */
    static String absoluteClassPath(String classPath) {
        Path cwd = Paths.get("").toAbsolutePath();
        if (classPath == null || classPath.isEmpty()) {
            return cwd.toString();
        }
        List<String> entries = new ArrayList<>();
        for (String entry : classPath.split(Pattern.quote(File.pathSeparator), -1)) {
            if (entry.isEmpty()) {
                entries.add(cwd.toString());
            } else if (entry.equals("*") || entry.endsWith(File.separator + "*") || entry.endsWith("/*")) {
                String dir = entry.substring(0, entry.length() - 1);
                entries.add(cwd.resolve(dir).normalize() + File.separator + "*");
            } else {
                entries.add(cwd.resolve(entry).normalize().toString());
            }
        }
        return String.join(File.pathSeparator, entries);
    }

    static List<String> splitCommand(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        for (String token : raw.trim().split("\\s+")) {
            if (!token.isBlank()) {
                out.add(token);
            }
        }
        return out;
    }

    private static SettingsFile readSettings(Path file) {
        if (!Files.exists(file)) {
            return SettingsFile.empty();
        }
        try {
            SettingsFile settings = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return settings == null ? SettingsFile.empty() : settings;
        } catch (IOException e) {
            log.warn("Ignoring unreadable settings file {}: {}", file, e.getMessage());
            return SettingsFile.empty();
        }
    }

    private static List<String> sanitizeCommand(List<String> raw, List<String> fallback) {
        if (raw == null || raw.isEmpty() || raw.stream().anyMatch(s -> s == null || s.isBlank())) {
            return fallback;
        }
        return raw;
    }

    private static int clamp(Integer raw, int fallback, int min, int max) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, Math.min(max, raw));
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path resultsDir() {
        return resultsDir;
    }

    public Path tempDir() {
        return tempDir;
    }

    public List<String> workerCommand() {
        return workerCommand;
    }

    public List<String> runnerCommand() {
        return runnerCommand;
    }

    public int maxParallel() {
        return maxParallel;
    }

    public int maxConcurrency() {
        return maxConcurrency;
    }

    public String placeholder() {
        return placeholder;
    }

    public Duration debounce() {
        return Duration.ofMillis(debounceMs);
    }

    public Duration killGrace() {
        return Duration.ofMillis(killGraceMs);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record SettingsFile(
            List<String> workerCommand,
            List<String> runnerCommand,
            Integer maxParallel,
            Integer maxConcurrency,
            String placeholder,
            Long debounceMs,
            Long killGraceMs,
            String resultsDir
    ) {
        static SettingsFile empty() {
            return new SettingsFile(null, null, null, null, null, null, null, null);
        }
    }
}

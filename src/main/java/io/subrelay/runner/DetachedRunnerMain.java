package io.subrelay.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.subrelay.config.SubRelayConfig;
import io.subrelay.model.CompletionPayload;
import io.subrelay.model.JobRecord;
import io.subrelay.util.Jsons;
import io.subrelay.worker.BlockingWorkerClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Process entry point for detached jobs. Takes the config file path as its only argument, or reads
 * the config from stdin when none is given.
 */
@Command(name = "subrelay-runner", mixinStandardHelpOptions = true, description = "Run one detached subrelay job")
public final class DetachedRunnerMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(DetachedRunnerMain.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    @Parameters(index = "0", arity = "0..1", description = "Job config file (read from stdin when omitted)")
    Path configFile;

    public static void main(String[] args) {
        int code = new CommandLine(new DetachedRunnerMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        JobRecord job;
        try {
            job = configFile == null ? DetachedRunner.readConfig(System.in) : DetachedRunner.readConfig(configFile);
        } catch (RuntimeException e) {
            log.error("Cannot start job: {}", e.getMessage());
            return 1;
        }
        try {
            DetachedRunner runner = new DetachedRunner(new BlockingWorkerClient(
                    workerCommand(),
                    Paths.get(System.getProperty("java.io.tmpdir"))
            ));
            CompletionPayload payload = runner.run(job);
            log.info("Job {} ({}) finished success={}", job.id(), payload.agent(), payload.success());
            return 0;
        } catch (RuntimeException e) {
            log.error("Job {} failed: {}", job.id(), e.getMessage(), e);
            return 1;
        }
    }

    private static List<String> workerCommand() {
        return workerCommand(System.getenv(SubRelayConfig.WORKER_ARGV_ENV), System.getenv(SubRelayConfig.WORKER_ENV));
    }

    /**
     * The JSON argv set by the launcher wins; a hand-set {@code SUBRELAY_WORKER} is whitespace-split.
     */
    static List<String> workerCommand(String argvJson, String raw) {
        if (argvJson != null && !argvJson.isBlank()) {
            try {
                List<String> argv = Jsons.mapper().readValue(argvJson, STRING_LIST);
                if (argv != null && !argv.isEmpty() && argv.stream().noneMatch(s -> s == null || s.isBlank())) {
                    return List.copyOf(argv);
                }
                log.warn("Ignoring empty {}", SubRelayConfig.WORKER_ARGV_ENV);
            } catch (JsonProcessingException e) {
                log.warn("Ignoring malformed {}: {}", SubRelayConfig.WORKER_ARGV_ENV, e.getOriginalMessage());
            }
        }
        if (raw == null || raw.isBlank()) {
            return List.of(SubRelayConfig.DEFAULT_WORKER);
        }
        return List.of(raw.trim().split("\\s+"));
    }
}

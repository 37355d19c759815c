package io.subrelay.cli;

import io.subrelay.agent.AgentCatalog;
import io.subrelay.agent.AgentRegistry;
import io.subrelay.agent.AgentScope;
import io.subrelay.agent.JsonAgentCatalog;
import io.subrelay.async.AsyncDispatcher;
import io.subrelay.async.DetachedProcessLauncher;
import io.subrelay.completion.CompletionCorrelator;
import io.subrelay.completion.CompletionNotices;
import io.subrelay.config.SubRelayConfig;
import io.subrelay.detect.FailureDetector;
import io.subrelay.model.ExecutionRequest;
import io.subrelay.model.ExecutionResult;
import io.subrelay.model.StepResult;
import io.subrelay.model.TaskSpec;
import io.subrelay.runtime.Dispatcher;
import io.subrelay.util.Jsons;
import io.subrelay.worker.CancellationSignal;
import io.subrelay.worker.StepExecutor;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "subrelay",
        mixinStandardHelpOptions = true,
        description = "Dispatch agent tasks to worker processes",
        subcommands = {
                SubRelayCommand.RunCommand.class,
                SubRelayCommand.WatchCommand.class,
                SubRelayCommand.AgentsCommand.class
        }
)
public final class SubRelayCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    AgentCatalog catalog = new JsonAgentCatalog();

    @Override
    public void run() {
        System.out.println("Use subcommands: run | watch | agents");
    }

    SubRelayConfig config() {
        return SubRelayConfig.fromRoot(root);
    }

    static Path processCwd() {
        return Paths.get("").toAbsolutePath();
    }

    Dispatcher dispatcher(SubRelayConfig config) {
        Path cwd = processCwd();
        StepExecutor executor = new StepExecutor(
                config.workerCommand(),
                cwd,
                config.tempDir(),
                config.killGrace(),
                FailureDetector.defaults()
        );
        AsyncDispatcher async = new AsyncDispatcher(
                DetachedProcessLauncher.fromConfig(config),
                config.resultsDir(),
                config.placeholder(),
                cwd
        );
        return new Dispatcher(
                catalog,
                executor,
                async,
                cwd,
                config.maxParallel(),
                config.maxConcurrency(),
                config.placeholder()
        );
    }

    @Command(name = "run", description = "Dispatch a single task, a parallel fan-out or a chain")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        SubRelayCommand parent;

        @ArgGroup(exclusive = true, multiplicity = "1")
        Mode mode;

        @Option(names = {"--sync"}, defaultValue = "false", description = "Wait for the result instead of running in the background")
        boolean sync;

        @Option(names = {"--scope"}, description = "Agent scope: user|project|both")
        String scope;

        @Option(names = {"--cwd"}, description = "Working directory for the workers")
        String cwd;

        static final class Mode {
            @ArgGroup(exclusive = false)
            Single single;

            @Option(names = {"--parallel"}, description = "Parallel task as AGENT=TASK (repeatable)")
            List<String> parallel;

            @Option(names = {"--chain"}, description = "Chain step as AGENT=TASK (repeatable, in order)")
            List<String> chain;

            @Option(names = {"--file"}, description = "Request JSON file")
            Path file;
        }

        static final class Single {
            @Option(names = {"--agent"}, required = true, description = "Agent name")
            String agent;

            @Option(names = {"--task"}, required = true, description = "Task text")
            String task;
        }

        @Override
        public Integer call() throws Exception {
            ExecutionRequest request = buildRequest();
            SubRelayConfig config = parent.config();
            Dispatcher dispatcher = parent.dispatcher(config);
            CancellationSignal signal = new CancellationSignal();
            Thread hook = new Thread(signal::cancel, "subrelay-cancel-hook");
            Runtime.getRuntime().addShutdownHook(hook);
            ExecutionResult result;
            try {
                result = dispatcher.execute(request, signal, null);
            } finally {
                try {
                    Runtime.getRuntime().removeShutdownHook(hook);
                } catch (IllegalStateException shuttingDown) {
                    signal.cancel();
                }
            }
            System.out.println(Jsons.toJson(result));
            for (StepResult step : result.results()) {
                if (step.usage().turns() > 0) {
                    System.err.println(step.agent() + ": " + step.usage().format(step.model()));
                }
            }
            return result.isError() ? 1 : 0;
        }

        ExecutionRequest buildRequest() throws Exception {
            ExecutionRequest request;
            if (mode.file != null) {
                request = Jsons.mapper().readValue(mode.file.toFile(), ExecutionRequest.class);
            } else if (mode.single != null) {
                request = ExecutionRequest.single(mode.single.agent, mode.single.task);
            } else if (mode.parallel != null) {
                request = ExecutionRequest.parallel(parseTasks(mode.parallel));
            } else {
                request = ExecutionRequest.chain(parseTasks(mode.chain));
            }
            if (sync) {
                request = request.sync();
            }
            if (scope != null) {
                request = request.withScope(AgentScope.fromString(scope));
            }
            if (cwd != null) {
                request = request.withCwd(cwd);
            }
            return request;
        }

        static List<TaskSpec> parseTasks(List<String> raw) {
            List<TaskSpec> out = new ArrayList<>();
            for (String item : raw) {
                int eq = item.indexOf('=');
                if (eq <= 0) {
                    throw new IllegalArgumentException("Expected AGENT=TASK but got: " + item);
                }
                out.add(TaskSpec.of(item.substring(0, eq).trim(), item.substring(eq + 1)));
            }
            return out;
        }
    }

    @Command(name = "watch", description = "Print completion notices for background tasks until interrupted")
    static final class WatchCommand implements Callable<Integer> {
        @ParentCommand
        SubRelayCommand parent;

        @Override
        public Integer call() throws Exception {
            SubRelayConfig config = parent.config();
            CountDownLatch stopped = new CountDownLatch(1);
            CompletionCorrelator correlator = new CompletionCorrelator(
                    config.resultsDir(),
                    config.debounce(),
                    payload -> {
                        System.out.println(CompletionNotices.describe(payload));
                        System.out.println();
                    }
            );
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                correlator.stop();
                stopped.countDown();
            }, "subrelay-watch-shutdown"));
            correlator.start();
            stopped.await();
            return 0;
        }
    }

    @Command(name = "agents", description = "List the agents visible from the working directory")
    static final class AgentsCommand implements Callable<Integer> {
        @ParentCommand
        SubRelayCommand parent;

        @Option(names = {"--scope"}, defaultValue = "user", description = "Agent scope: user|project|both")
        String scope;

        @Option(names = {"--cwd"}, description = "Project directory (defaults to the current directory)")
        Path cwd;

        @Override
        public Integer call() {
            Path dir = cwd == null ? processCwd() : cwd;
            AgentRegistry registry = parent.catalog.discover(dir, AgentScope.fromString(scope));
            System.out.println(Jsons.toJson(registry.all()));
            return 0;
        }
    }
}

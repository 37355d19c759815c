package io.subrelay.runtime;

import io.subrelay.agent.AgentCatalog;
import io.subrelay.agent.AgentRegistry;
import io.subrelay.async.AsyncDispatcher;
import io.subrelay.model.ExecutionMode;
import io.subrelay.model.ExecutionRequest;
import io.subrelay.model.ExecutionResult;
import io.subrelay.model.ResolvedTask;
import io.subrelay.model.StepResult;
import io.subrelay.model.TaskSpec;
import io.subrelay.worker.CancellationSignal;
import io.subrelay.worker.StepRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for one dispatch request: checks its shape, resolves every agent it names and routes
 * it to the synchronous runners or to the async job path.
 */
public final class Dispatcher {
    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final AgentCatalog catalog;
    private final StepRunner stepRunner;
    private final AsyncDispatcher asyncDispatcher;
    private final Path defaultCwd;
    private final int maxParallel;
    private final FanOutRunner fanOutRunner;
    private final ChainRunner chainRunner;

    public Dispatcher(
            AgentCatalog catalog,
            StepRunner stepRunner,
            AsyncDispatcher asyncDispatcher,
            Path defaultCwd,
            int maxParallel,
            int maxConcurrency,
            String placeholder
    ) {
        this.catalog = catalog;
        this.stepRunner = stepRunner;
        this.asyncDispatcher = asyncDispatcher;
        this.defaultCwd = defaultCwd;
        this.maxParallel = maxParallel;
        this.fanOutRunner = new FanOutRunner(stepRunner, maxConcurrency);
        this.chainRunner = new ChainRunner(stepRunner, placeholder);
    }

    public ExecutionResult execute(ExecutionRequest request) {
        return execute(request, CancellationSignal.none(), null);
    }

    public ExecutionResult execute(ExecutionRequest request, CancellationSignal signal, ProgressListener listener) {
        AgentRegistry agents = catalog.discover(cwdOf(request), request.scopeOrDefault());
        ExecutionMode mode;
        List<ResolvedTask> tasks;
        try {
            mode = resolveMode(request, agents);
            tasks = resolve(mode, request, agents);
        } catch (RequestValidationException e) {
            log.info("Rejected dispatch request: {}", e.getMessage());
            return ExecutionResult.rejected(e.getMessage());
        }
        for (ResolvedTask task : tasks) {
            if (task.agent() == null) {
                log.info("Rejected dispatch request: unknown agent {}", task.agentName());
                StepResult unknown = StepResult.unknownAgent(task.agentName(), task.spec().task());
                return ExecutionResult.error(mode, unknown.error(), List.of(unknown));
            }
        }

        log.info("Dispatching {} request ({} task{}, async={})",
                mode.label(), tasks.size(), tasks.size() == 1 ? "" : "s", request.runsAsync());
        if (request.runsAsync()) {
            return switch (mode) {
                case SINGLE -> asyncDispatcher.dispatchSingle(tasks.get(0), request.cwd());
                case PARALLEL -> asyncDispatcher.dispatchParallel(tasks, request.cwd());
                case CHAIN -> asyncDispatcher.dispatchChain(tasks, request.cwd());
            };
        }
        CancellationSignal effective = signal == null ? CancellationSignal.none() : signal;
        return switch (mode) {
            case SINGLE -> runSingle(tasks.get(0), effective, listener);
            case PARALLEL -> runParallel(tasks, effective);
            case CHAIN -> runChain(tasks, effective, listener);
        };
    }

    ExecutionMode resolveMode(ExecutionRequest request, AgentRegistry agents) {
        if (request.populatedModeCount() != 1) {
            List<String> names = agents.names();
            throw new RequestValidationException(
                    "Provide exactly one mode. Agents: " + (names.isEmpty() ? "none" : String.join(", ", names))
            );
        }
        if (request.hasParallel()) {
            if (request.parallel().size() > maxParallel) {
                throw new RequestValidationException("Max " + maxParallel + " tasks");
            }
            return ExecutionMode.PARALLEL;
        }
        return request.hasChain() ? ExecutionMode.CHAIN : ExecutionMode.SINGLE;
    }

    private List<ResolvedTask> resolve(ExecutionMode mode, ExecutionRequest request, AgentRegistry agents) {
        List<TaskSpec> specs = switch (mode) {
            case SINGLE -> List.of(withRequestCwd(request.single(), request.cwd()));
            case PARALLEL -> request.parallel().stream().map(t -> withRequestCwd(t, request.cwd())).toList();
            case CHAIN -> request.chain().stream().map(t -> withRequestCwd(t, request.cwd())).toList();
        };
        List<ResolvedTask> resolved = new ArrayList<>(specs.size());
        for (TaskSpec spec : specs) {
            if (spec == null || !spec.hasAgentAndTask()) {
                throw new RequestValidationException("Each task needs an agent and a task");
            }
            resolved.add(new ResolvedTask(spec, agents.findByName(spec.agent()).orElse(null)));
        }
        return resolved;
    }

    private ExecutionResult runSingle(ResolvedTask task, CancellationSignal signal, ProgressListener listener) {
        StepResult result = stepRunner.run(
                task,
                signal,
                listener == null ? null : (partial, live) ->
                        listener.onUpdate(ExecutionResult.ok(ExecutionMode.SINGLE, partial, List.of(live)))
        );
        if (!result.succeeded()) {
            return ExecutionResult.error(ExecutionMode.SINGLE, orDefault(result.error(), "Failed"), List.of(result));
        }
        return ExecutionResult.ok(ExecutionMode.SINGLE, orDefault(result.finalOutput(), "(no output)"), List.of(result));
    }

    private ExecutionResult runParallel(List<ResolvedTask> tasks, CancellationSignal signal) {
        List<StepResult> results = fanOutRunner.run(tasks, signal);
        long ok = FanOutRunner.succeeded(results);
        return ExecutionResult.ok(ExecutionMode.PARALLEL, ok + "/" + results.size() + " succeeded", results);
    }

    private ExecutionResult runChain(List<ResolvedTask> steps, CancellationSignal signal, ProgressListener listener) {
        ChainRunner.ChainOutcome outcome = chainRunner.run(
                steps,
                signal,
                listener == null ? null : (partial, results) ->
                        listener.onUpdate(ExecutionResult.ok(ExecutionMode.CHAIN, partial, results))
        );
        if (outcome.failed()) {
            return ExecutionResult.error(ExecutionMode.CHAIN, orDefault(outcome.text(), "Chain failed"), outcome.results());
        }
        return ExecutionResult.ok(ExecutionMode.CHAIN, orDefault(outcome.text(), "(no output)"), outcome.results());
    }

    private Path cwdOf(ExecutionRequest request) {
        if (request.cwd() != null && !request.cwd().isBlank()) {
            return Path.of(request.cwd());
        }
        return defaultCwd;
    }

    private static TaskSpec withRequestCwd(TaskSpec spec, String requestCwd) {
        if (spec == null || spec.cwd() != null || requestCwd == null || requestCwd.isBlank()) {
            return spec;
        }
        return new TaskSpec(spec.agent(), spec.task(), requestCwd);
    }

    private static String orDefault(String text, String fallback) {
        return text == null || text.isEmpty() ? fallback : text;
    }
}

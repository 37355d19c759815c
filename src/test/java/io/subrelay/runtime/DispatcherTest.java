package io.subrelay.runtime;

import io.subrelay.agent.AgentCatalog;
import io.subrelay.agent.AgentDefinition;
import io.subrelay.agent.AgentRegistry;
import io.subrelay.agent.AgentScope;
import io.subrelay.async.AsyncDispatcher;
import io.subrelay.model.ExecutionMode;
import io.subrelay.model.ExecutionRequest;
import io.subrelay.model.ExecutionResult;
import io.subrelay.model.JobRecord;
import io.subrelay.model.StepResult;
import io.subrelay.model.TaskSpec;
import io.subrelay.worker.CancellationSignal;
import io.subrelay.worker.StepRunner;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

final class DispatcherTest {
    private static final Path CWD = Path.of("/work/project");

    private final List<JobRecord> launched = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger syncRuns = new AtomicInteger();
    private final List<AgentScope> requestedScopes = new ArrayList<>();

    @Test
    void requestWithTwoModesIsRejectedAndListsAgents() {
        ExecutionRequest request = new ExecutionRequest(
                TaskSpec.of("scout", "x"),
                List.of(TaskSpec.of("scout", "y")),
                null,
                false,
                null,
                null
        );

        ExecutionResult result = dispatcher().execute(request);

        Assertions.assertTrue(result.isError());
        Assertions.assertEquals("Provide exactly one mode. Agents: scout, planner", result.text());
        assertNothingRan();
    }

    @Test
    void requestWithNoModeAndNoAgentsSaysNone() {
        AgentCatalog empty = (cwd, scope) -> new AgentRegistry();
        ExecutionRequest request = new ExecutionRequest(null, List.of(), null, false, null, null);

        ExecutionResult result = dispatcher(empty).execute(request);

        Assertions.assertTrue(result.isError());
        Assertions.assertEquals("Provide exactly one mode. Agents: none", result.text());
        assertNothingRan();
    }

    @Test
    void unknownAgentIsRejectedBeforeAnythingRuns() {
        ExecutionRequest request = ExecutionRequest.chain(List.of(
                TaskSpec.of("scout", "a"),
                TaskSpec.of("ghost", "b")
        ));

        ExecutionResult result = dispatcher().execute(request);

        Assertions.assertTrue(result.isError());
        Assertions.assertEquals(ExecutionMode.CHAIN, result.mode());
        Assertions.assertEquals("Unknown agent: ghost", result.text());
        Assertions.assertEquals(1, result.results().size());
        Assertions.assertEquals(1, result.results().get(0).exitCode());
        assertNothingRan();
    }

    @Test
    void moreThanEightParallelTasksAreRejected() {
        List<TaskSpec> tasks = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            tasks.add(TaskSpec.of("scout", "t" + i));
        }

        ExecutionResult result = dispatcher().execute(ExecutionRequest.parallel(tasks).sync());

        Assertions.assertTrue(result.isError());
        Assertions.assertEquals("Max 8 tasks", result.text());
        assertNothingRan();
    }

    @Test
    void asyncIsTheDefaultAndAcknowledgesImmediately() {
        ExecutionResult result = dispatcher().execute(ExecutionRequest.single("scout", "look around"));

        Assertions.assertFalse(result.isError());
        Assertions.assertEquals("job-1", result.asyncId());
        Assertions.assertEquals("Async: scout [job-1]", result.text());
        Assertions.assertEquals(0, syncRuns.get());
        Assertions.assertEquals(1, launched.size());
        Assertions.assertEquals("/work/project", launched.get(0).cwd());
    }

    @Test
    void asyncParallelLaunchesOneJobPerTask() {
        ExecutionResult result = dispatcher().execute(ExecutionRequest.parallel(List.of(
                TaskSpec.of("scout", "a"),
                TaskSpec.of("planner", "b")
        )));

        Assertions.assertEquals("Async parallel: 2 tasks [job-1]", result.text());
        Assertions.assertEquals(2, launched.size());
    }

    @Test
    void syncSingleReturnsFinalOutput() {
        ExecutionResult result = dispatcher().execute(ExecutionRequest.single("scout", "look").sync());

        Assertions.assertFalse(result.isError());
        Assertions.assertEquals(ExecutionMode.SINGLE, result.mode());
        Assertions.assertEquals("scout did look", result.text());
        Assertions.assertTrue(launched.isEmpty());
    }

    @Test
    void syncSingleFailureWithoutMessageSaysFailed() {
        StepRunner failing = (task, signal, listener) -> StepResults.failed(task.agentName(), task.spec().task(), 1, null);
        Dispatcher dispatcher = new Dispatcher(catalog(), failing, asyncDispatcher(), CWD, 8, 4, "{previous}");

        ExecutionResult result = dispatcher.execute(ExecutionRequest.single("scout", "look").sync());

        Assertions.assertTrue(result.isError());
        Assertions.assertEquals("Failed", result.text());
    }

    @Test
    void syncEmptyOutputSaysNoOutput() {
        StepRunner silent = (task, signal, listener) -> new StepResult(task.agentName(), task.spec().task());
        Dispatcher dispatcher = new Dispatcher(catalog(), silent, asyncDispatcher(), CWD, 8, 4, "{previous}");

        ExecutionResult result = dispatcher.execute(ExecutionRequest.single("scout", "look").sync());

        Assertions.assertFalse(result.isError());
        Assertions.assertEquals("(no output)", result.text());
    }

    @Test
    void syncParallelSummarizesSuccessCount() {
        StepRunner runner = (task, signal, listener) -> "planner".equals(task.agentName())
                ? StepResults.failed("planner", task.spec().task(), 2, "nope")
                : StepResults.ok(task.agentName(), task.spec().task(), "fine");
        Dispatcher dispatcher = new Dispatcher(catalog(), runner, asyncDispatcher(), CWD, 8, 4, "{previous}");

        ExecutionResult result = dispatcher.execute(ExecutionRequest.parallel(List.of(
                TaskSpec.of("scout", "a"),
                TaskSpec.of("planner", "b"),
                TaskSpec.of("scout", "c")
        )).sync());

        Assertions.assertFalse(result.isError());
        Assertions.assertEquals("2/3 succeeded", result.text());
        Assertions.assertEquals(List.of("scout", "planner", "scout"),
                result.results().stream().map(StepResult::agent).toList());
    }

    @Test
    void syncChainReturnsLastOutputAndFailureReturnsError() {
        ExecutionResult ok = dispatcher().execute(ExecutionRequest.chain(List.of(
                TaskSpec.of("scout", "find"),
                TaskSpec.of("planner", "plan {previous}")
        )).sync());
        Assertions.assertEquals("planner did plan scout did find", ok.text());

        StepRunner failing = (task, signal, listener) -> StepResults.failed(task.agentName(), task.spec().task(), 1, null);
        Dispatcher dispatcher = new Dispatcher(catalog(), failing, asyncDispatcher(), CWD, 8, 4, "{previous}");
        ExecutionResult failed = dispatcher.execute(ExecutionRequest.chain(List.of(
                TaskSpec.of("scout", "find"),
                TaskSpec.of("planner", "plan")
        )).sync());
        Assertions.assertTrue(failed.isError());
        Assertions.assertEquals("Chain failed", failed.text());
        Assertions.assertEquals(1, failed.results().size());
    }

    @Test
    void requestCwdAndScopeReachTheCatalogAndSteps() {
        List<String> stepCwds = new ArrayList<>();
        List<Path> catalogCwds = new ArrayList<>();
        AgentCatalog catalog = (cwd, scope) -> {
            catalogCwds.add(cwd);
            requestedScopes.add(scope);
            return AgentRegistry.of(AgentDefinition.of("scout", null, List.of(), null));
        };
        StepRunner runner = (task, signal, listener) -> {
            stepCwds.add(task.spec().cwd());
            return StepResults.ok(task.agentName(), task.spec().task(), "x");
        };
        Dispatcher dispatcher = new Dispatcher(catalog, runner, asyncDispatcher(), CWD, 8, 4, "{previous}");

        dispatcher.execute(ExecutionRequest.single("scout", "x").sync()
                .withScope(AgentScope.BOTH)
                .withCwd("/other"));

        Assertions.assertEquals(List.of(Path.of("/other")), catalogCwds);
        Assertions.assertEquals(List.of(AgentScope.BOTH), requestedScopes);
        Assertions.assertEquals(List.of("/other"), stepCwds);
    }

    @Test
    void progressIsForwardedForSyncSingle() {
        List<String> partials = new ArrayList<>();
        StepRunner runner = (task, signal, listener) -> {
            StepResult live = StepResults.ok(task.agentName(), task.spec().task(), "halfway");
            listener.onProgress("halfway", live);
            return live;
        };
        Dispatcher dispatcher = new Dispatcher(catalog(), runner, asyncDispatcher(), CWD, 8, 4, "{previous}");

        dispatcher.execute(
                ExecutionRequest.single("scout", "x").sync(),
                new CancellationSignal(),
                partial -> partials.add(partial.text())
        );

        Assertions.assertEquals(List.of("halfway"), partials);
    }

    private Dispatcher dispatcher() {
        return dispatcher(catalog());
    }

    private Dispatcher dispatcher(AgentCatalog catalog) {
        StepRunner echo = (task, signal, listener) -> {
            syncRuns.incrementAndGet();
            return StepResults.ok(task.agentName(), task.spec().task(), task.agentName() + " did " + task.spec().task());
        };
        return new Dispatcher(catalog, echo, asyncDispatcher(), CWD, 8, 4, "{previous}");
    }

    private AsyncDispatcher asyncDispatcher() {
        AtomicInteger ids = new AtomicInteger();
        return new AsyncDispatcher(
                launched::add,
                Path.of("/results"),
                "{previous}",
                CWD,
                () -> "job-" + ids.incrementAndGet()
        );
    }

    private static AgentCatalog catalog() {
        return (cwd, scope) -> AgentRegistry.of(
                AgentDefinition.of("scout", "fast-model", List.of("read"), null),
                AgentDefinition.of("planner", null, List.of(), "Plan carefully.")
        );
    }

    private void assertNothingRan() {
        Assertions.assertEquals(0, syncRuns.get());
        Assertions.assertTrue(launched.isEmpty());
    }
}

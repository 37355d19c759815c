package io.subrelay.async;

import io.subrelay.agent.AgentDefinition;
import io.subrelay.model.ExecutionMode;
import io.subrelay.model.ExecutionResult;
import io.subrelay.model.JobRecord;
import io.subrelay.model.JobStep;
import io.subrelay.model.ResolvedTask;
import io.subrelay.model.TaskSpec;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

final class AsyncDispatcherTest {
    private static final Path RESULTS = Path.of("/tmp/subrelay-results");
    private static final Path CWD = Path.of("/work");

    private final List<JobRecord> launched = new ArrayList<>();

    @Test
    void singleJobCarriesResolvedAgentMetadata() {
        ResolvedTask task = resolved("reviewer", "check", null,
                AgentDefinition.of("reviewer", "model-r", List.of("read"), "  Be strict.\n"));

        ExecutionResult ack = dispatcher().dispatchSingle(task, null);

        Assertions.assertEquals(ExecutionMode.SINGLE, ack.mode());
        Assertions.assertEquals("Async: reviewer [abc]", ack.text());
        Assertions.assertEquals("abc", ack.asyncId());
        Assertions.assertTrue(ack.results().isEmpty());

        JobRecord job = launched.get(0);
        Assertions.assertEquals("abc", job.id());
        Assertions.assertEquals(RESULTS.resolve("abc.json").toString(), job.resultPath());
        Assertions.assertEquals("/work", job.cwd());
        Assertions.assertEquals("{previous}", job.placeholder());
        Assertions.assertNull(job.taskIndex());
        JobStep step = job.steps().get(0);
        Assertions.assertEquals("model-r", step.model());
        Assertions.assertEquals(List.of("read"), step.tools());
        Assertions.assertEquals("Be strict.", step.systemPrompt());
    }

    @Test
    void parallelTasksShareTheIdButNotTheResultFile() {
        List<ResolvedTask> tasks = List.of(
                resolved("a", "one", null, null),
                resolved("b", "two", "/elsewhere", null),
                resolved("c", "three", null, null)
        );

        ExecutionResult ack = dispatcher().dispatchParallel(tasks, "/request");

        Assertions.assertEquals("Async parallel: 3 tasks [abc]", ack.text());
        Assertions.assertEquals(3, launched.size());
        for (int i = 0; i < 3; i++) {
            JobRecord job = launched.get(i);
            Assertions.assertEquals("abc", job.id());
            Assertions.assertEquals(RESULTS.resolve("abc-" + i + ".json").toString(), job.resultPath());
            Assertions.assertEquals(i, job.taskIndex().intValue());
            Assertions.assertEquals(3, job.totalTasks().intValue());
        }
        Assertions.assertEquals("/request", launched.get(0).cwd());
        Assertions.assertEquals("/elsewhere", launched.get(1).cwd());
    }

    @Test
    void chainIsOneJobWithAllSteps() {
        List<ResolvedTask> steps = List.of(
                resolved("scout", "find", null, null),
                resolved("planner", "plan {previous}", null, null)
        );

        ExecutionResult ack = dispatcher().dispatchChain(steps, null);

        Assertions.assertEquals("Async chain: scout -> planner [abc]", ack.text());
        Assertions.assertEquals(1, launched.size());
        Assertions.assertEquals(2, launched.get(0).steps().size());
        Assertions.assertEquals("chain:scout->planner", launched.get(0).label());
        Assertions.assertEquals("plan {previous}", launched.get(0).steps().get(1).task());
    }

    @Test
    void launchFailureStillAcknowledges() {
        AsyncDispatcher dispatcher = new AsyncDispatcher(
                job -> {
                    throw new UncheckedIOException("no runner", new IOException("boom"));
                },
                RESULTS,
                "{previous}",
                CWD,
                () -> "abc"
        );

        ExecutionResult ack = dispatcher.dispatchSingle(resolved("a", "x", null, null), null);

        Assertions.assertFalse(ack.isError());
        Assertions.assertEquals("abc", ack.asyncId());
    }

    private AsyncDispatcher dispatcher() {
        return new AsyncDispatcher(launched::add, RESULTS, "{previous}", CWD, () -> "abc");
    }

    private static ResolvedTask resolved(String agent, String task, String cwd, AgentDefinition definition) {
        return new ResolvedTask(
                new TaskSpec(agent, task, cwd),
                definition == null ? AgentDefinition.of(agent, null, List.of(), null) : definition
        );
    }
}

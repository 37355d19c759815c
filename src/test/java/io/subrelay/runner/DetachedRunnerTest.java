package io.subrelay.runner;

import io.subrelay.TestFiles;
import io.subrelay.model.CompletionPayload;
import io.subrelay.model.JobRecord;
import io.subrelay.model.JobStep;
import io.subrelay.util.Jsons;
import io.subrelay.worker.BlockingWorkerClient;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.ByteArrayInputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;

@EnabledOnOs({OS.LINUX, OS.MAC})
final class DetachedRunnerTest {
    private static final Clock FIXED = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);

    /**
     * Echoes the task back; tasks containing FAIL exit 2.
     */
    private static final String ECHO_WORKER = """
            for arg in "$@"; do last="$arg"; done
            case "$last" in
              *FAIL*) echo "partial"; exit 2 ;;
            esac
            printf '  answer<%s>  \\n' "$last"
            """;

    @Test
    void chainPassesOutputForwardAndWritesOnePayload() throws Exception {
        Path root = Files.createTempDirectory("subrelay-runner-chain-");
        try {
            Path result = root.resolve("results").resolve("job-1.json");
            JobRecord job = new JobRecord(
                    "job-1",
                    List.of(step("scout", "find"), step("planner", "plan {previous}")),
                    result.toString(),
                    root.toString(),
                    "{previous}",
                    null,
                    null
            );

            CompletionPayload payload = runner(root).run(job);

            Assertions.assertTrue(payload.success());
            Assertions.assertEquals(0, payload.exitCode());
            Assertions.assertEquals("chain:scout->planner", payload.agent());
            Assertions.assertEquals("answer<Task: find>", payload.results().get(0).output());
            Assertions.assertEquals("answer<Task: plan answer<Task: find>>", payload.results().get(1).output());
            Assertions.assertEquals(
                    "scout:\nanswer<Task: find>\n\nplanner:\nanswer<Task: plan answer<Task: find>>",
                    payload.summary()
            );
            Assertions.assertEquals(1_700_000_000_000L, payload.timestamp());

            CompletionPayload written = Jsons.mapper().readValue(result.toFile(), CompletionPayload.class);
            Assertions.assertEquals(payload, written);
            try (Stream<Path> files = Files.list(result.getParent())) {
                Assertions.assertEquals(List.of(result), files.toList());
            }
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void failingStepEndsTheChain() throws Exception {
        Path root = Files.createTempDirectory("subrelay-runner-fail-");
        try {
            JobRecord job = new JobRecord(
                    "job-2",
                    List.of(step("a", "ok"), step("b", "FAIL now"), step("c", "never")),
                    root.resolve("job-2.json").toString(),
                    root.toString(),
                    "{previous}",
                    null,
                    null
            );

            CompletionPayload payload = runner(root).run(job);

            Assertions.assertFalse(payload.success());
            Assertions.assertEquals(1, payload.exitCode());
            Assertions.assertEquals(2, payload.results().size());
            Assertions.assertEquals("partial", payload.results().get(1).output());
            Assertions.assertFalse(payload.results().get(1).success());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void parallelSliceKeepsIndexAndLabel() throws Exception {
        Path root = Files.createTempDirectory("subrelay-runner-slice-");
        try {
            JobRecord job = new JobRecord(
                    "job-3",
                    List.of(step("scout", "look")),
                    root.resolve("job-3-1.json").toString(),
                    root.toString(),
                    "{previous}",
                    1,
                    4
            );

            CompletionPayload payload = runner(root).run(job);

            Assertions.assertEquals("scout", payload.agent());
            Assertions.assertEquals(1, payload.taskIndex().intValue());
            Assertions.assertEquals(4, payload.totalTasks().intValue());
            Assertions.assertTrue(Files.exists(root.resolve("job-3-1.json")));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void configFileIsDeletedOnceRead() throws Exception {
        Path root = Files.createTempDirectory("subrelay-runner-cfg-");
        try {
            Path config = root.resolve("subrelay-async-cfg-x.json");
            JobRecord job = new JobRecord("x", List.of(step("a", "t")), root.resolve("x.json").toString(),
                    null, "{previous}", null, null);
            Files.writeString(config, Jsons.toCompactJson(job), StandardCharsets.UTF_8);

            JobRecord read = DetachedRunner.readConfig(config);

            Assertions.assertEquals(job, read);
            Assertions.assertFalse(Files.exists(config));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void malformedConfigIsStillDeleted() throws Exception {
        Path root = Files.createTempDirectory("subrelay-runner-badcfg-");
        try {
            Path config = root.resolve("subrelay-async-cfg-bad.json");
            Files.writeString(config, "{not json", StandardCharsets.UTF_8);

            Assertions.assertThrows(UncheckedIOException.class, () -> DetachedRunner.readConfig(config));
            Assertions.assertFalse(Files.exists(config));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void configCanComeFromStdin() {
        String json = "{\"id\":\"s1\",\"steps\":[{\"agent\":\"a\",\"task\":\"t\"}],\"resultPath\":\"/tmp/s1.json\",\"extra\":true}";

        JobRecord job = DetachedRunner.readConfig(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

        Assertions.assertEquals("s1", job.id());
        Assertions.assertEquals("a", job.label());
    }

    private static DetachedRunner runner(Path root) throws Exception {
        Path worker = TestFiles.fakeWorker(root, "worker.sh", ECHO_WORKER);
        return new DetachedRunner(new BlockingWorkerClient(List.of(worker.toString()), root), FIXED);
    }

    private static JobStep step(String agent, String task) {
        return new JobStep(agent, task, null, null, null, null);
    }
}

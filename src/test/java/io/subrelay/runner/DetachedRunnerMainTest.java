package io.subrelay.runner;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class DetachedRunnerMainTest {

    @Test
    void workerArgvKeepsArgumentsWithSpaces() {
        List<String> command = DetachedRunnerMain.workerCommand("[\"/opt/My Tools/pi\",\"--offline\"]", "other");

        Assertions.assertEquals(List.of("/opt/My Tools/pi", "--offline"), command);
    }

    @Test
    void plainWorkerVariableIsSplitOnWhitespace() {
        Assertions.assertEquals(List.of("pi", "--offline"), DetachedRunnerMain.workerCommand(null, "  pi   --offline "));
    }

    @Test
    void malformedOrEmptyArgvFallsBack() {
        Assertions.assertEquals(List.of("pi-local"), DetachedRunnerMain.workerCommand("[\"unterminated", "pi-local"));
        Assertions.assertEquals(List.of("pi"), DetachedRunnerMain.workerCommand("[]", null));
        Assertions.assertEquals(List.of("pi"), DetachedRunnerMain.workerCommand("", " "));
    }
}

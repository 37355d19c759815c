package io.subrelay.worker;

import io.subrelay.TestFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

final class SystemPromptFileTest {

    @Test
    void blankPromptWritesNothing() throws Exception {
        Path root = Files.createTempDirectory("subrelay-prompt-blank-");
        try {
            Assertions.assertNull(SystemPromptFile.writeIfPresent(root, "scout", "   "));
            Assertions.assertNull(SystemPromptFile.writeIfPresent(root, "scout", null));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void fileIsRemovedOnClose() throws Exception {
        Path root = Files.createTempDirectory("subrelay-prompt-close-");
        try {
            Path written;
            try (SystemPromptFile prompt = SystemPromptFile.writeIfPresent(root, "code/reviewer", "Be brief.")) {
                written = prompt.path();
                Assertions.assertEquals("code_reviewer.md", written.getFileName().toString());
                Assertions.assertEquals("Be brief.", Files.readString(written, StandardCharsets.UTF_8));
            }
            Assertions.assertFalse(Files.exists(written));
            Assertions.assertFalse(Files.exists(written.getParent()));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }
}

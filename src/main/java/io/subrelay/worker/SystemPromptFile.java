package io.subrelay.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Agent system prompt written to a private temp directory for the worker's
 * {@code --append-system-prompt} option. Closing removes the directory.
 */
public final class SystemPromptFile implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SystemPromptFile.class);

    private final Path dir;
    private final Path file;

    private SystemPromptFile(Path dir, Path file) {
        this.dir = dir;
        this.file = file;
    }

    /**
     * Returns null when there is no prompt to write, which try-with-resources accepts.
     */
    public static SystemPromptFile writeIfPresent(Path tempRoot, String agentName, String prompt) {
        if (prompt == null || prompt.isBlank()) {
            return null;
        }
        try {
            Files.createDirectories(tempRoot);
            Path dir = Files.createTempDirectory(tempRoot, "subrelay-agent-");
            Path file = dir.resolve(safeFileName(agentName) + ".md");
            Files.writeString(file, prompt, StandardCharsets.UTF_8);
            restrictToOwner(file);
            return new SystemPromptFile(dir, file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write system prompt for agent: " + agentName, e);
        }
    }

    static String safeFileName(String agentName) {
        if (agentName == null || agentName.isBlank()) {
            return "agent";
        }
        return agentName.replaceAll("[^\\w.-]", "_");
    }

    private static void restrictToOwner(Path file) throws IOException {
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
            return;
        }
        File plain = file.toFile();
        plain.setReadable(false, false);
        plain.setWritable(false, false);
        plain.setReadable(true, true);
        plain.setWritable(true, true);
    }

    public Path path() {
        return file;
    }

    @Override
    public void close() {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            log.warn("Failed to remove system prompt directory {}: {}", dir, e.getMessage());
        }
    }
}

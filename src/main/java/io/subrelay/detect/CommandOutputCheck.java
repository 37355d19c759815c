package io.subrelay.detect;

import com.fasterxml.jackson.databind.JsonNode;
import io.subrelay.model.Messages;
import io.subrelay.util.Texts;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scans output of command-execution tool results, whether or not they were flagged, for a
 * nonzero exit phrase or a well-known fatal message.
 */
public final class CommandOutputCheck implements FailureCheck {
    public static final Set<String> DEFAULT_COMMAND_TOOLS = Set.of("bash");

    static final List<Pattern> FATAL_PATTERNS = List.of(
            Pattern.compile("command not found", Pattern.CASE_INSENSITIVE),
            Pattern.compile("permission denied", Pattern.CASE_INSENSITIVE),
            Pattern.compile("no such file or directory", Pattern.CASE_INSENSITIVE),
            Pattern.compile("segmentation fault", Pattern.CASE_INSENSITIVE),
            Pattern.compile("killed|terminated", Pattern.CASE_INSENSITIVE),
            Pattern.compile("out of memory", Pattern.CASE_INSENSITIVE),
            Pattern.compile("connection refused", Pattern.CASE_INSENSITIVE),
            Pattern.compile("timeout", Pattern.CASE_INSENSITIVE)
    );

    private final Set<String> commandTools;

    public CommandOutputCheck() {
        this(DEFAULT_COMMAND_TOOLS);
    }

    public CommandOutputCheck(Set<String> commandTools) {
        this.commandTools = Set.copyOf(commandTools);
    }

    @Override
    public Optional<FailureVerdict> inspect(List<JsonNode> messages) {
        for (JsonNode message : messages) {
            if (!Messages.isToolResult(message)) {
                continue;
            }
            String tool = Messages.toolName(message);
            if (tool == null || !commandTools.contains(tool)) {
                continue;
            }
            String output = Messages.firstText(message);
            if (output == null) {
                continue;
            }
            OptionalInt exitCode = ExitCodePhrases.find(output);
            if (exitCode.isPresent() && exitCode.getAsInt() != 0) {
                return Optional.of(verdict(exitCode.getAsInt(), tool, output));
            }
            for (Pattern pattern : FATAL_PATTERNS) {
                if (pattern.matcher(output).find()) {
                    return Optional.of(verdict(1, tool, output));
                }
            }
        }
        return Optional.empty();
    }

    private static FailureVerdict verdict(int exitCode, String tool, String output) {
        return FailureVerdict.failed(exitCode, tool, Texts.truncate(output, FailureDetector.MAX_DETAIL_CHARS));
    }
}

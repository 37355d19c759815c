package io.subrelay.detect;

import com.fasterxml.jackson.databind.JsonNode;
import io.subrelay.model.Messages;
import io.subrelay.util.Texts;

import java.util.List;
import java.util.Optional;

/**
 * First tool result the worker itself flagged with {@code isError}.
 */
public final class ToolErrorCheck implements FailureCheck {
    @Override
    public Optional<FailureVerdict> inspect(List<JsonNode> messages) {
        for (JsonNode message : messages) {
            if (!Messages.isToolResult(message) || !Messages.isErrorFlagged(message)) {
                continue;
            }
            String detail = Messages.firstText(message);
            int exitCode = ExitCodePhrases.find(detail).orElse(1);
            String tool = Messages.toolName(message);
            return Optional.of(FailureVerdict.failed(
                    exitCode,
                    tool == null || tool.isBlank() ? "tool" : tool,
                    Texts.truncate(detail, FailureDetector.MAX_DETAIL_CHARS)
            ));
        }
        return Optional.empty();
    }
}

package io.subrelay.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Accessors over the worker's message objects ({@code role}, {@code content[]}, {@code toolName},
 * {@code isError}).
 */
public final class Messages {
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL_RESULT = "toolResult";

    private Messages() {
    }

    public static String role(JsonNode message) {
        return message == null ? "" : message.path("role").asText("");
    }

    public static boolean isAssistant(JsonNode message) {
        return ROLE_ASSISTANT.equals(role(message));
    }

    public static boolean isToolResult(JsonNode message) {
        return ROLE_TOOL_RESULT.equals(role(message));
    }

    public static boolean isErrorFlagged(JsonNode message) {
        return message != null && message.path("isError").asBoolean(false);
    }

    public static String toolName(JsonNode message) {
        if (message == null) {
            return null;
        }
        JsonNode name = message.get("toolName");
        return name == null || name.isNull() ? null : name.asText();
    }

    /**
     * First text part of the message content, or null.
     */
    public static String firstText(JsonNode message) {
        if (message == null) {
            return null;
        }
        JsonNode content = message.path("content");
        if (content.isTextual()) {
            return content.asText();
        }
        for (JsonNode part : content) {
            if ("text".equals(part.path("type").asText()) && part.has("text")) {
                return part.path("text").asText();
            }
        }
        return null;
    }

    /**
     * Text of the most recent assistant message that has any, or the empty string.
     */
    public static String finalOutput(List<JsonNode> messages) {
        if (messages == null) {
            return "";
        }
        for (int i = messages.size() - 1; i >= 0; i--) {
            JsonNode message = messages.get(i);
            if (isAssistant(message)) {
                String text = firstText(message);
                if (text != null) {
                    return text;
                }
            }
        }
        return "";
    }
}

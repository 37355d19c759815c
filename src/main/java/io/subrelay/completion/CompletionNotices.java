package io.subrelay.completion;

import io.subrelay.model.CompletionPayload;

public final class CompletionNotices {
    private CompletionNotices() {
    }

    public static String describe(CompletionPayload payload) {
        String status = payload.success() ? "completed" : "failed";
        String position = payload.taskIndex() != null && payload.totalTasks() != null
                ? " (" + (payload.taskIndex() + 1) + "/" + payload.totalTasks() + ")"
                : "";
        String summary = payload.summary() == null ? "" : payload.summary();
        return "Background task " + status + ": **" + payload.agent() + "**" + position + "\n\n" + summary;
    }
}

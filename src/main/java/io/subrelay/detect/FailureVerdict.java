package io.subrelay.detect;

/**
 * Result of inspecting a run's message log. {@code detail} is at most
 * {@link FailureDetector#MAX_DETAIL_CHARS} characters and may be null.
 */
public record FailureVerdict(
        boolean hasError,
        int exitCode,
        String originatingTool,
        String detail
) {
    private static final FailureVerdict NONE = new FailureVerdict(false, 0, null, null);

    public static FailureVerdict none() {
        return NONE;
    }

    public static FailureVerdict failed(int exitCode, String originatingTool, String detail) {
        return new FailureVerdict(true, exitCode, originatingTool, detail);
    }

    public String describe() {
        if (!hasError) {
            return null;
        }
        if (detail != null && !detail.isEmpty()) {
            return originatingTool + " failed (exit " + exitCode + "): " + detail;
        }
        return originatingTool + " failed with exit code " + exitCode;
    }
}

package io.subrelay.runtime;

/**
 * Literal, global, single-pass token replacement. There is no escaping: any occurrence of the
 * token in the task text is replaced.
 */
public final class Placeholders {
    private Placeholders() {
    }

    public static String substitute(String template, String token, String value) {
        if (template == null) {
            return null;
        }
        if (token == null || token.isEmpty()) {
            return template;
        }
        return template.replace(token, value == null ? "" : value);
    }
}

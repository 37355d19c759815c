package io.subrelay.util;

public final class Texts {
    private Texts() {
    }

    public static String truncate(String raw, int maxChars) {
        if (raw == null) {
            return null;
        }
        if (raw.length() <= maxChars) {
            return raw;
        }
        return raw.substring(0, maxChars);
    }

    public static boolean isBlank(String raw) {
        return raw == null || raw.isBlank();
    }

    public static String firstNonBlank(String... values) {
        for (String value : values) {
            if (!isBlank(value)) {
                return value;
            }
        }
        return null;
    }
}

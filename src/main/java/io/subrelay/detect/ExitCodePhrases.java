package io.subrelay.detect;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds phrases such as "exit code 2", "exited with status 127" or "exit: 1" in free text.
 */
final class ExitCodePhrases {
    private static final Pattern EXIT_PHRASE = Pattern.compile(
            "exit(?:ed)?\\s*(?:with\\s*)?(?:code|status)?\\s*[:\\s]?\\s*(\\d+)",
            Pattern.CASE_INSENSITIVE
    );

    private ExitCodePhrases() {
    }

    static OptionalInt find(String text) {
        if (text == null || text.isEmpty()) {
            return OptionalInt.empty();
        }
        Matcher matcher = EXIT_PHRASE.matcher(text);
        if (!matcher.find()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(matcher.group(1)));
        } catch (NumberFormatException e) {
            // wider than an int
            return OptionalInt.of(1);
        }
    }
}

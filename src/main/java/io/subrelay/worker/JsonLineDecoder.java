package io.subrelay.worker;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a byte stream into newline-terminated lines. The trailing partial line is held back
 * until the next chunk, so multi-byte characters are never cut in half.
 */
final class JsonLineDecoder {
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();

    List<String> feed(byte[] chunk, int length) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < length; i++) {
            if (chunk[i] == '\n') {
                pending.write(chunk, start, i - start);
                lines.add(drain());
                start = i + 1;
            }
        }
        if (start < length) {
            pending.write(chunk, start, length - start);
        }
        return lines;
    }

    /**
     * Whatever is left once the stream has ended; empty when the last line was terminated.
     */
    String finish() {
        return drain();
    }

    private String drain() {
        String line = pending.toString(StandardCharsets.UTF_8);
        pending.reset();
        if (line.endsWith("\r")) {
            return line.substring(0, line.length() - 1);
        }
        return line;
    }
}
